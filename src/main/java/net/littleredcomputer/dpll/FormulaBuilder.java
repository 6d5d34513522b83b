package net.littleredcomputer.dpll;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Collects clauses, written as signed one-based variable numbers in the manner of DIMACS
 * files, and assembles them into a {@link Formula}. A clause containing some variable
 * together with its negation is always true, so it is dropped; a literal repeated within
 * a clause is kept once.
 */
public class FormulaBuilder {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final CharMatcher digits = CharMatcher.inRange('0', '9');
    private final int nVariables;
    private final List<Clause> clauses = new ArrayList<>();
    private int nTautologies = 0;

    public FormulaBuilder(int nVariables) {
        if (nVariables < 1) throw new IllegalArgumentException("Must have at least one variable");
        this.nVariables = nVariables;
    }

    public FormulaBuilder addClause(int... variables) {
        List<Integer> vs = new ArrayList<>(variables.length);
        for (int v : variables) vs.add(v);
        return addClause(vs);
    }

    public FormulaBuilder addClause(Iterable<Integer> variables) {
        List<Literal> clause = new ArrayList<>();
        for (int v : variables) {
            if (v > nVariables || v < -nVariables) throw new IllegalArgumentException("Literal out of declared bounds: " + v);
            Literal l = Literal.fromDimacs(v);
            if (clause.contains(l.not())) {
                ++nTautologies;
                return this;
            }
            if (!clause.contains(l)) clause.add(l);
        }
        clauses.add(new Clause(clause));
        return this;
    }

    /** @return the number of clauses dropped because they contained a complementary pair */
    int nTautologies() { return nTautologies; }

    @CheckReturnValue
    public Formula build() {
        return new Formula(nVariables, clauses);
    }

    @CheckReturnValue
    public static Formula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Parse a problem in DIMACS CNF format. Comment lines (beginning with 'c') may precede the
     * problem line "p cnf V C", which must be followed by exactly C clauses, each terminated
     * by 0. Line breaks carry no meaning after the problem line.
     *
     * @throws IllegalArgumentException if the input is malformed
     */
    @CheckReturnValue
    public static Formula parseFrom(Reader r) {
        Iterator<String> ls = new BufferedReader(r).lines().iterator();
        String pLine = null;
        while (pLine == null && ls.hasNext()) {
            String s = ls.next();
            if (!s.startsWith("c") && !CharMatcher.whitespace().matchesAllOf(s)) pLine = s;
        }
        if (pLine == null) throw new IllegalArgumentException("Missing problem line");
        List<String> params = splitter.splitToList(pLine);
        if (params.size() != 4) throw new IllegalArgumentException("Wrong number of parameters in problem line");
        if (!params.get(0).equals("p")) throw new IllegalArgumentException("Invalid problem line");
        if (!params.get(1).equals("cnf")) throw new IllegalArgumentException("Only cnf-formatted inputs are supported");
        final int nVar = parseCount(params.get(2), 1, "variable");
        final int nClause = parseCount(params.get(3), 0, "clause");
        FormulaBuilder b = new FormulaBuilder(nVar);
        List<Integer> literals = new ArrayList<>();
        int terminated = 0;
        // Comment lines are only recognized ahead of the problem line; from here on every
        // token must be an integer.
        while (ls.hasNext()) {
            for (String token : splitter.split(ls.next())) {
                if (terminated == nClause) throw new IllegalArgumentException("Too many clauses");
                if (token.equals("0")) {
                    b.addClause(literals);
                    literals.clear();
                    ++terminated;
                } else {
                    final int v = parseLiteral(token);
                    if (v > nVar || v < -nVar) throw new IllegalArgumentException("Literal out of declared bounds: " + v);
                    literals.add(v);
                }
            }
        }
        if (terminated < nClause) throw new IllegalArgumentException("Not enough clauses");
        log.debug("parsed %d variables, %d clauses; dropped %d tautologies", nVar, nClause, b.nTautologies());
        return b.build();
    }

    // A literal is an optional minus sign and a nonzero ASCII number without leading zeros.
    // The bare token "0" ends a clause and is handled by the caller.
    private static int parseLiteral(String token) {
        String magnitude = token.startsWith("-") ? token.substring(1) : token;
        if (magnitude.isEmpty() || !digits.matchesAllOf(magnitude) || magnitude.startsWith("0")) {
            throw new IllegalArgumentException("Illegal variable '" + token + "'");
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Illegal variable '" + token + "'", e);
        }
    }

    private static int parseCount(String field, int min, String what) {
        if (!digits.matchesAllOf(field)) throw new IllegalArgumentException("Invalid " + what + " count '" + field + "'");
        final int n;
        try {
            n = Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + " count '" + field + "'", e);
        }
        if (n < min) throw new IllegalArgumentException("Invalid " + what + " count '" + field + "'");
        return n;
    }
}
