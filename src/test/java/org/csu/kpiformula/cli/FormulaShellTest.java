package org.csu.kpiformula.cli;

import org.csu.kpiformula.engine.FormulaEngine;
import org.csu.kpiformula.engine.FormulaLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Scanner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行交互的测试，直接调用 execute 并检查返回的文本。
 */
public class FormulaShellTest {

    private FormulaShell shell;

    @BeforeEach
    void setUp() {
        shell = new FormulaShell(new FormulaEngine());
    }

    @Test
    void testSetAndEvaluate() {
        System.out.println("--- Test: Set And Evaluate ---");
        assertEquals("spent = 1000", shell.execute("set spent = 1000"));
        assertEquals("leads = 50", shell.execute("set leads=50"));
        assertEquals("20", shell.execute("spent / leads"));
        assertEquals("20", shell.execute("eval spent / leads"));
        assertEquals("0.5", shell.execute("eval leads / 100"));

        // 绑定值本身也可以是公式
        assertEquals("cpl = 20", shell.execute("set cpl = spent / leads"));
        assertEquals(Map.of("spent", 1000.0, "leads", 50.0, "cpl", 20.0), shell.getSession().getBindings());
    }

    @Test
    void testErrorsAreReportedNotThrown() {
        shell.execute("set spent = 1");
        assertEquals("ERROR: Undefined variable: missing", shell.execute("spent / missing"));
        assertEquals("ERROR: Division by zero", shell.execute("1 / 0"));
        assertEquals("ERROR: Unsafe construct: function call", shell.execute("eval abs(spent)"));
        assertEquals("ERROR: Empty formula", shell.execute("eval"));
        assertTrue(shell.execute("spent +").startsWith("ERROR: Syntax error"));
        assertTrue(shell.getSession().isRunning());
    }

    @Test
    void testSetRejectsBadInput() {
        assertEquals("ERROR: 'lambda' is a reserved word", shell.execute("set lambda = 1"));
        assertEquals("ERROR: Usage: set <name> = <formula>", shell.execute("set 1x = 2"));
        assertEquals("ERROR: Usage: set <name> = <formula>", shell.execute("set x"));
        assertTrue(shell.getSession().getBindings().isEmpty());
    }

    @Test
    void testVarsValidateAndAst() {
        assertEquals("likes, comments, impressions", shell.execute("vars (likes + comments) / impressions"));
        assertEquals("(none)", shell.execute("vars 1 + 2"));
        assertEquals("(none)", shell.execute("vars abs(x)"));

        assertEquals("VALID [a, b]", shell.execute("validate a / (b - b)"));
        assertTrue(shell.execute("validate x ** 2").startsWith("INVALID: Unsafe construct"));

        assertEquals("(a + (b * c))", shell.execute("ast a + b * c"));
        assertEquals("((-a) / 2.5)", shell.execute("ast -a / 2.5"));
    }

    @Test
    void testBindingsUnsetAndClear() {
        assertEquals("No variables bound.", shell.execute("bindings"));

        shell.execute("set spent = 1000");
        shell.execute("set leads = 50");
        String table = shell.execute("bindings");
        assertTrue(table.contains("| variable | value |"), table);
        assertTrue(table.contains("| spent    | 1000  |"), table);
        assertTrue(table.endsWith("2 variables bound."), table);

        assertEquals("Unset leads.", shell.execute("unset leads"));
        assertEquals("No such variable: leads", shell.execute("unset leads"));
        assertEquals("All bindings removed.", shell.execute("clear"));
        assertTrue(shell.getSession().getBindings().isEmpty());
    }

    @Test
    void testHelpAndBlankLines() {
        assertTrue(shell.execute("help").startsWith("Commands:"));
        assertEquals("", shell.execute("   "));
        assertEquals("", shell.execute(null));
        assertEquals(1, shell.getSession().getCommandCount());
    }

    @Test
    void testRunLoopStopsOnExit() {
        String input = "set a = 2\na * 3\n\nexit\na * 100\n";
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        shell.run(new Scanner(input), new PrintStream(output, true, StandardCharsets.UTF_8));

        String printed = output.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("kpi[1]> a = 2"), printed);
        assertTrue(printed.contains("kpi[2]> 6"), printed);
        assertFalse(printed.contains("200"), printed);
        assertFalse(shell.getSession().isRunning());
        assertEquals(3, shell.getSession().getCommandCount());
    }

    @Test
    void testRunLoopStopsAtEndOfInput() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        shell.run(new Scanner("1 + 1"), new PrintStream(output, true, StandardCharsets.UTF_8));

        assertTrue(output.toString(StandardCharsets.UTF_8).contains("kpi[1]> 2"));
        assertTrue(shell.getSession().isRunning());
    }

    @Test
    void testParseLimits() {
        assertTrue(FormulaShell.parseLimits(new String[0]).isUnlimited());

        FormulaLimits limits = FormulaShell.parseLimits(new String[]{"--max-length", "200", "--max-depth", "8"});
        assertEquals(200, limits.getMaxLength());
        assertEquals(8, limits.getMaxDepth());

        assertThrows(IllegalArgumentException.class, () -> FormulaShell.parseLimits(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> FormulaShell.parseLimits(new String[]{"--max-depth"}));
        assertThrows(IllegalArgumentException.class, () -> FormulaShell.parseLimits(new String[]{"--max-depth", "x"}));
        assertThrows(IllegalArgumentException.class, () -> FormulaShell.parseLimits(new String[]{"--max-depth", "-1"}));
    }

    @Test
    void testLimitsApplyToShell() {
        FormulaShell limited = new FormulaShell(new FormulaEngine(new FormulaLimits(0, 1)));
        assertEquals("3", limited.execute("(1 + 2)"));
        assertTrue(limited.execute("((1 + 2))").startsWith("ERROR:"));
    }
}
