package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.Optional;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("problem", true, "filename of DIMACS CNF problem, or - for standard input")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    static void report(Optional<Assignment> outcome, PrintStream out) {
        if (outcome.isPresent()) {
            out.println("s SATISFIABLE");
            out.println("v " + outcome.get());
        } else {
            out.println("s UNSATISFIABLE");
        }
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Stopwatch sw = Stopwatch.createStarted();
        Formula f = FormulaBuilder.parseFrom(problem(cmd));
        DPLLSolver s = new DPLLSolver(f);
        s.setLogInterval(logInterval(cmd));
        Optional<Assignment> outcome = s.solve();
        sw.stop();
        System.out.println("c " + sw);
        report(outcome, System.out);
    }
}
