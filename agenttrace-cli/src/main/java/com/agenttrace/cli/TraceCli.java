package com.agenttrace.cli;

import com.agenttrace.cli.render.Verbosity;
import com.agenttrace.core.serialization.TraceSerializer;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar agenttrace-cli.jar inspect &lt;trace-file&gt; \
 *     [--verbosity minimal|standard|full] [--json] [--output &lt;path&gt;]
 *
 * Exit codes: 0 success, 1 unreadable or invalid trace file, 2 usage error.
 */
public class TraceCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
        "Usage: agenttrace inspect <trace-file> [--verbosity minimal|standard|full] [--json] [--output <path>]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        InspectCommand command;
        try {
            command = parse(args);
        } catch (UsageException e) {
            err.println("[agenttrace] ERROR: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        return command.execute(out, err);
    }

    static InspectCommand parse(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No command specified");
        }
        if (!args[0].equals("inspect")) {
            throw new UsageException("Unknown command: " + args[0]);
        }

        String traceFile = null;
        Verbosity verbosity = Verbosity.STANDARD;
        boolean json = false;
        String output = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--verbosity" -> verbosity = parseVerbosity(requireNext(args, i++, "--verbosity"));
                case "--json"      -> json = true;
                case "--output"    -> output = requireNext(args, i++, "--output");
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new UsageException("Unknown flag: " + args[i]);
                    }
                    if (traceFile != null) {
                        throw new UsageException("Unexpected argument: " + args[i]);
                    }
                    traceFile = args[i];
                }
            }
        }

        if (traceFile == null) throw new UsageException("<trace-file> is required");
        if (output != null && !json) {
            throw new UsageException("--output is only supported when --json is provided");
        }

        return new InspectCommand(
            Paths.get(traceFile),
            verbosity,
            json,
            output != null ? Path.of(output) : null,
            new TraceSerializer());
    }

    private static Verbosity parseVerbosity(String value) {
        try {
            return Verbosity.parse(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
