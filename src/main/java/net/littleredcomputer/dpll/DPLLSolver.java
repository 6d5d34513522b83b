package net.littleredcomputer.dpll;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * The Davis-Putnam-Logemann-Loveland procedure. At each level the lowest-numbered unassigned
 * variable is set true, and if that fails, false; {@link Formula#assign(Literal)} carries out the
 * unit propagation. The recursion over levels is kept in explicit arrays, so the depth of the
 * Java stack does not depend on the number of variables.
 */
public class DPLLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger();
    private long nDecisions = 0;
    private long nBacktracks = 0;

    public DPLLSolver(Formula formula) {
        super("DPLL", formula);
    }

    long nDecisions() { return nDecisions; }
    long nBacktracks() { return nBacktracks; }

    @Override
    public Optional<Assignment> solve() {
        start();
        final int nVariables = formula.nVariables();
        int[] m = new int[nVariables + 1];  // m[d] is 0 while trying x true at depth d, 1 while trying it false
        Literal[] H = new Literal[nVariables + 1];  // decision literal at each depth
        int d = 0;
        formula.propagateUnits();
        int state = 2;
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(m, d);
            switch (state) {
                case 2:  // Success?
                    if (formula.solved()) {
                        report("SAT");
                        return Optional.of(formula.assignment().completed());
                    }
                    if (formula.contradiction()) {
                        state = 4;
                        continue;
                    }
                /* case 3: */  // Choose.
                    ++d;
                    H[d] = formula.nextUnassigned();
                    m[d] = 0;
                    ++nDecisions;
                    formula.assign(H[d]);
                    state = 2;
                    continue;
                case 4:  // Try again.
                    if (d == 0) {
                        report("UNSAT");
                        return Optional.empty();
                    }
                    formula.unAssign(H[d]);
                    if (m[d] == 0) {
                        m[d] = 1;
                        H[d] = H[d].not();
                        ++nDecisions;
                        formula.assign(H[d]);
                        state = 2;
                        continue;
                    }
                /* case 5: */  // Backtrack.
                    --d;
                    ++nBacktracks;
                    state = 4;
                    continue;
                default:
                    throw new IllegalStateException("unknown state " + state);
            }
        }
    }

    private void report(String outcome) {
        if (stopwatch.isRunning()) stopwatch.stop();
        log.info("%s %s: %d decisions, %d forced, %d backtracks", outcome, stopwatch, nDecisions, formula.nForced(), nBacktracks);
    }
}
