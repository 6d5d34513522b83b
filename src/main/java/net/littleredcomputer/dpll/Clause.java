package net.littleredcomputer.dpll;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A disjunction of literals. Clauses never hold a literal together with its complement;
 * FormulaBuilder discards such clauses before they get here.
 */
public final class Clause {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private final ImmutableList<Literal> literals;

    Clause(List<Literal> literals) {
        this.literals = ImmutableList.copyOf(literals);
    }

    public List<Literal> literals() { return literals; }
    public int size() { return literals.size(); }

    public boolean isSatisfiedBy(Assignment a) {
        for (Literal l : literals) if (a.isSatisfied(l)) return true;
        return false;
    }

    /** @return the number of literals not falsified by a */
    int liveCount(Assignment a) {
        int n = 0;
        for (Literal l : literals) if (!a.isFalsified(l)) ++n;
        return n;
    }

    /**
     * @return the first literal not falsified by a, or null if every literal is false
     */
    Literal firstLive(Assignment a) {
        for (Literal l : literals) if (!a.isFalsified(l)) return l;
        return null;
    }

    @Override
    public String toString() { return "(" + spaceJoiner.join(literals) + ")"; }
}
