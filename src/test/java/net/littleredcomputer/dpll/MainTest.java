package net.littleredcomputer.dpll;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest extends SATTestBase {
    private static String render(Optional<Assignment> outcome) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true);
        Main.report(outcome, out);
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    public void satisfiable() {
        Optional<Assignment> a = solve(FormulaBuilder.parseFrom("p cnf 3 2\n-1 0\n2 -3 0"));
        assertThat(render(a), is("s SATISFIABLE\nv -1 2 3 0\n"));
    }

    @Test
    public void unsatisfiable() {
        assertThat(render(solve(FormulaBuilder.parseFrom("p cnf 1 2\n1 0\n-1 0"))), is("s UNSATISFIABLE\n"));
    }
}
