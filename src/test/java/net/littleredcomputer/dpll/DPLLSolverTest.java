package net.littleredcomputer.dpll;

import org.junit.Test;

import java.util.Optional;
import java.util.Random;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class DPLLSolverTest extends SATTestBase {
    private static final Formula ex6 = FormulaBuilder.parseFrom("p cnf 4 8\n1 2 -3 0 2 3 -4 0 3 4 1 0 4 -1 2 0 -1 -2 3 0 -2 -3 4 0 -3 -4 -1 0 -4 1 -2 0");
    private static final Formula ex7 = FormulaBuilder.parseFrom("p cnf 4 7\n1 2 -3 0 2 3 -4 0 3 4 1 0 4 -1 2 0 -1 -2 3 0 -2 -3 4 0 -3 -4 -1 0");

    @Test
    public void singleUnit() {
        Optional<Assignment> a = solve(FormulaBuilder.parseFrom("p cnf 1 1\n1 0"));
        assertThat(a.map(Assignment::toString), is(Optional.of("1 0")));
    }

    @Test
    public void contradictoryUnits() {
        assertThat(solve(FormulaBuilder.parseFrom("p cnf 1 2\n1 0\n-1 0")), isEmpty());
    }

    @Test
    public void unitPropagationAvoidsBranching() {
        Formula f = FormulaBuilder.parseFrom("p cnf 2 2\n1 2 0\n-1 2 0");
        DPLLSolver s = new DPLLSolver(f);
        Optional<Assignment> a = s.solve();
        assertThat(a.map(x -> x.value(1)), is(Optional.of(true)));
        assertThat(s.nDecisions(), is(1L));
        assertThat(s.nBacktracks(), is(0L));
    }

    @Test
    public void threeVariables() {
        assertSAT(FormulaBuilder.parseFrom("p cnf 3 3\n1 2 3 0\n-1 -2 0\n-1 -3 0"));
    }

    @Test
    public void noClauses() {
        Optional<Assignment> a = solve(FormulaBuilder.parseFrom("p cnf 2 0"));
        assertThat(a, isPresent());
        assertThat(a.get().nVariables(), is(2));
        assertThat(a.get().isAssigned(0) && a.get().isAssigned(1), is(true));
    }

    @Test
    public void onlyTautologies() {
        Formula f = FormulaBuilder.parseFrom("p cnf 3 2\n1 -1 0\n2 3 -2 0");
        assertThat(f.nClauses(), is(0));
        Optional<Assignment> a = solve(f);
        assertThat(a, isPresent());
        // Nothing constrains the variables, so every point satisfies what is left.
        for (int bits = 0; bits < 8; ++bits) assertThat(f.evaluate(fromBits(3, bits)), is(true));
    }

    @Test
    public void emptyClause() {
        assertUNSAT(FormulaBuilder.parseFrom("p cnf 2 2\n1 2 0\n0"));
    }

    @Test
    public void secondBranch() {
        // x1 must be false; the solver tries true first and has to back up.
        Formula f = FormulaBuilder.parseFrom("p cnf 3 3\n-1 2 0\n-1 -2 0\n1 3 0");
        DPLLSolver s = new DPLLSolver(f);
        Optional<Assignment> a = s.solve();
        assertThat(a.map(Assignment::toString), is(Optional.of("-1 2 3 0")));
        assertThat(s.nDecisions(), is(2L));
    }

    @Test public void ex6() { assertUNSAT(ex6); }
    @Test public void ex7() { assertSAT(ex7); }

    @Test public void w3_3() { assertThat(waerden(3, 3), is(9)); }
    @Test public void w3_4() { assertThat(waerden(3, 4), is(18)); }
    @Test public void w4_3() { assertThat(waerden(4, 3), is(18)); }

    @Test public void langford() { testLangford(); }
    @Test public void hole4() { assertUNSAT(fromResource("hole4.cnf")); }
    @Test public void queens4() { assertSAT(fromResource("queens4.cnf")); }

    @Test
    public void agreesWithTruthTable() {
        Random r = new Random(20181019);
        for (int trial = 0; trial < 2000; ++trial) {
            int n = 1 + r.nextInt(6);
            Formula f = build(n, randomClauses(r, n, r.nextInt(6 * n + 1)));
            boolean expected = bruteForce(f);
            Optional<Assignment> a = solve(f);
            assertThat(a.isPresent(), is(expected));
            if (expected) assertThat(f.evaluate(a.get()), is(true));
        }
    }

    @Test
    public void solvesLargeChainWithoutDeepRecursion() {
        // A 200000-link implication chain followed by a clause refuting its end.
        final int n = 200000;
        FormulaBuilder b = new FormulaBuilder(n);
        for (int i = 1; i < n; ++i) b.addClause(-i, i + 1);
        b.addClause(-n, -1);
        Optional<Assignment> a = solve(b.build());
        assertThat(a, isPresent());
        assertThat(a.get().value(0), is(false));
    }
}
