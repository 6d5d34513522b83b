package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    final Formula formula;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractSATSolver(String name, Formula formula) {
        this.name = name;
        this.formula = formula;
    }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;
    private String stateToString(int[] state, int depth) {
        StringBuilder s = new StringBuilder();
        if (depth > 100) {
            for (int i = 1; i <= initialStateSegment; ++i) s.append(state[i]);
            s.append("...");
            for (int i = depth - finalStateSegment + 1; i <= depth; ++i) s.append(state[i]);
        } else {
            for (int i = 1; i <= depth; ++i) s.append(state[i]);
        }
        return s.toString();
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /**
     * @param m move codes, one-based, of the current branch
     * @param d depth of the current branch
     */
    void maybeReportProgress(int[] m, int d) {
        maybeReportProgress(() -> stateToString(m, d));
    }

    /**
     * @return a satisfying assignment of every variable, or empty if the formula is unsatisfiable
     */
    public abstract Optional<Assignment> solve();
}
