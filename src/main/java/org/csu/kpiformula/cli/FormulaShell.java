package org.csu.kpiformula.cli;

import org.csu.kpiformula.common.exception.FormulaException;
import org.csu.kpiformula.compiler.lexer.Lexer;
import org.csu.kpiformula.engine.FormulaEngine;
import org.csu.kpiformula.engine.FormulaLimits;
import org.csu.kpiformula.engine.ValidationResult;

import java.io.PrintStream;
import java.util.List;
import java.util.Scanner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 公式交互式命令行
 *
 * 用于在控制台中编写、校验和试算 KPI 公式。
 * 所有公式错误都只打印为 "ERROR: ..."，不会结束会话。
 */
public class FormulaShell {

    private static final Pattern SET_COMMAND = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*=(.*)");

    private static final String HELP = String.join("\n",
            "Commands:",
            "  set <name> = <formula>   bind a variable (the value may use bound variables)",
            "  unset <name>             remove a binding",
            "  bindings                 show all bindings",
            "  clear                    remove all bindings",
            "  vars <formula>           list the variables a formula uses",
            "  validate <formula>       check a formula without real data",
            "  ast <formula>            show the parsed formula with explicit parentheses",
            "  eval <formula>           evaluate a formula (the 'eval' keyword is optional)",
            "  help                     show this message",
            "  exit                     quit");

    private final FormulaEngine engine;
    private final ShellSession session = new ShellSession();

    public FormulaShell(FormulaEngine engine) {
        this.engine = engine;
    }

    public static void main(String[] args) {
        FormulaLimits limits;
        try {
            limits = parseLimits(args);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.err.println("Usage: FormulaShell [--max-length N] [--max-depth N]");
            return;
        }

        System.out.println("KPI formula shell. " + limits + ". Type 'help' for commands, 'exit' to quit.");
        try (Scanner consoleScanner = new Scanner(System.in)) {
            new FormulaShell(new FormulaEngine(limits)).run(consoleScanner, System.out);
        }
        System.out.println("Bye!");
    }

    static FormulaLimits parseLimits(String[] args) {
        int maxLength = 0;
        int maxDepth = 0;
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (!flag.equals("--max-length") && !flag.equals("--max-depth")) {
                throw new IllegalArgumentException("Unknown argument: " + flag);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            int value;
            try {
                value = Integer.parseInt(args[++i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + args[i]);
            }
            if (flag.equals("--max-length")) {
                maxLength = value;
            } else {
                maxDepth = value;
            }
        }
        return new FormulaLimits(maxLength, maxDepth);
    }

    public void run(Scanner scanner, PrintStream out) {
        while (session.isRunning()) {
            out.print("kpi[" + (session.getCommandCount() + 1) + "]> ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String response = execute(scanner.nextLine());
            if (!response.isEmpty()) {
                out.println(response);
            }
        }
    }

    /**
     * 执行一行命令并返回要打印的文本。
     */
    public String execute(String line) {
        String input = line == null ? "" : line.strip();
        if (input.isEmpty()) {
            return "";
        }
        session.countCommand();

        String command = input;
        String argument = "";
        int space = input.indexOf(' ');
        if (space > 0) {
            command = input.substring(0, space);
            argument = input.substring(space + 1).strip();
        }

        try {
            switch (command.toLowerCase()) {
                case "exit":
                case "quit":
                    session.setRunning(false);
                    return "";
                case "help":
                    return HELP;
                case "set":
                    return handleSet(argument);
                case "unset":
                    return session.unbind(argument) ? "Unset " + argument + "." : "No such variable: " + argument;
                case "bindings":
                    return BindingsFormatter.format(session.getBindings());
                case "clear":
                    session.clear();
                    return "All bindings removed.";
                case "vars":
                    List<String> variables = engine.extractVariables(argument);
                    return variables.isEmpty() ? "(none)" : String.join(", ", variables);
                case "validate":
                    return formatValidation(engine.validate(argument));
                case "ast":
                    return engine.parse(argument).toString();
                case "eval":
                    return BindingsFormatter.formatNumber(engine.evaluate(argument, session.getBindings()));
                default:
                    return BindingsFormatter.formatNumber(engine.evaluate(input, session.getBindings()));
            }
        } catch (FormulaException e) {
            return "ERROR: " + e.getMessage();
        }
    }

    private String handleSet(String argument) {
        Matcher matcher = SET_COMMAND.matcher(argument);
        if (!matcher.matches()) {
            return "ERROR: Usage: set <name> = <formula>";
        }
        String name = matcher.group(1);
        if (Lexer.isReservedWord(name)) {
            return "ERROR: '" + name + "' is a reserved word";
        }
        double value = engine.evaluate(matcher.group(2), session.getBindings());
        session.bind(name, value);
        return name + " = " + BindingsFormatter.formatNumber(value);
    }

    private String formatValidation(ValidationResult result) {
        if (result.valid()) {
            return "VALID " + result.variables();
        }
        return "INVALID: " + result.error();
    }

    public ShellSession getSession() {
        return session;
    }
}
