package com.jscst.tools;

import com.jscst.Diagnostic;
import com.jscst.ParserOptions;
import com.jscst.UnitParser;
import com.jscst.UnitResult;
import com.jscst.json.CstJsonProvider;
import com.jscst.json.CstJsonSerializer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Command-line front end: parses JavaScript files in parallel and prints their trees as
 * JSON or their diagnostics.
 *
 * Usage:
 *   java -cp ... com.jscst.tools.CstTool [options] <files or directories...>
 *
 * Options:
 *   --mode=json|check     Print each tree as JSON, or only the diagnostics (default: check)
 *   --threads=N           Number of worker threads (default: available processors)
 *   --timeout-ms=N        Abandon a file after N ms, 0 = no limit (default: 0)
 *   --strict              Report strict mode violations
 *   --pretty              Indent JSON output
 *   --verbose             Log parser activity to stderr
 */
public class CstTool {

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(2);
        }

        try {
            System.exit(new CstTool(config, System.out, System.err).run());
        } catch (IOException e) {
            System.err.println("Fatal error: " + e.getMessage());
            System.exit(2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
            System.exit(2);
        }
    }

    public CstTool(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * @return the process exit code: 0 when every file parsed cleanly, 1 otherwise
     */
    public int run() throws IOException, InterruptedException {
        if (config.verbose) {
            enableVerboseLogging();
        }

        int failed = 0;
        Map<String, String> units = new LinkedHashMap<>();
        for (Path file : discoverFiles()) {
            try {
                units.put(file.toString(), Files.readString(file));
            } catch (IOException e) {
                // MalformedInputException when the file is not UTF-8
                err.println(file + ": cannot read: " + e);
                failed++;
            }
        }

        ParserOptions options = ParserOptions.defaults().withStrictMode(config.strict);
        List<UnitResult> results;
        try (UnitParser parser = new UnitParser(config.threads, options, config.timeoutMs)) {
            results = parser.parseAll(units);
        }

        CstJsonSerializer serializer = config.mode == Mode.JSON
            ? CstJsonProvider.getProvider().getSerializer()
            : null;

        for (UnitResult result : results) {
            switch (result.status()) {
                case PARSED -> {
                    if (serializer != null) {
                        out.println(serializer.serialize(result.result(), config.pretty));
                    } else {
                        result.result().diagnostics().forEach(d -> out.println(format(result.name(), d)));
                        int dropped = result.result().droppedDiagnostics();
                        if (dropped > 0) {
                            out.println(result.name() + ": " + dropped + " more diagnostics not shown");
                        }
                    }
                    if (result.result().hasDiagnostics()) {
                        failed++;
                    }
                }
                case FATAL -> {
                    err.println(format(result.name(), result.fatal()));
                    failed++;
                }
                case TIMED_OUT -> {
                    err.println(result.name() + ": timed out after " + config.timeoutMs + "ms");
                    failed++;
                }
            }
        }

        if (config.verbose) {
            err.println("Parsed " + results.size() + " files, " + failed + " with problems");
        }
        return failed > 0 ? 1 : 0;
    }

    static String format(String name, Diagnostic diagnostic) {
        return name + ":" + diagnostic.span().start() + "-" + diagnostic.span().end() + " "
            + diagnostic.kind() + " expected " + diagnostic.expected() + ", found " + diagnostic.found();
    }

    private List<Path> discoverFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : config.inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> paths = Files.walk(input)) {
                    paths.filter(Files::isRegularFile)
                         .filter(CstTool::isJavaScript)
                         .sorted()
                         .forEach(files::add);
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                err.println("Warning: no such file: " + input);
            }
        }
        return files;
    }

    private static boolean isJavaScript(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".js") || name.endsWith(".mjs") || name.endsWith(".cjs");
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("com.jscst");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
        root.setLevel(Level.FINE);
    }

    private static void printUsage() {
        System.out.println("Usage: CstTool [options] <files or directories...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --mode=json|check     Print trees as JSON or only diagnostics (default: check)");
        System.out.println("  --threads=N           Number of worker threads (default: CPU count)");
        System.out.println("  --timeout-ms=N        Abandon a file after N ms, 0 = no limit (default: 0)");
        System.out.println("  --strict              Report strict mode violations");
        System.out.println("  --pretty              Indent JSON output");
        System.out.println("  --verbose             Log parser activity to stderr");
        System.out.println("  --help                Show this help");
    }

    // ========== Inner classes ==========

    public enum Mode {
        JSON, CHECK
    }

    public static class Config {
        Mode mode = Mode.CHECK;
        int threads = Runtime.getRuntime().availableProcessors();
        long timeoutMs = 0;
        boolean strict = false;
        boolean pretty = false;
        boolean verbose = false;
        List<Path> inputs = new ArrayList<>();

        /**
         * @return the configuration, or null after printing why {@code args} are invalid
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                try {
                    if (arg.equals("--help") || arg.equals("-h")) {
                        return null;
                    } else if (arg.startsWith("--mode=")) {
                        config.mode = Mode.valueOf(arg.substring(7).toUpperCase());
                    } else if (arg.startsWith("--threads=")) {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } else if (arg.startsWith("--timeout-ms=")) {
                        config.timeoutMs = Long.parseLong(arg.substring(13));
                    } else if (arg.equals("--strict")) {
                        config.strict = true;
                    } else if (arg.equals("--pretty")) {
                        config.pretty = true;
                    } else if (arg.equals("--verbose") || arg.equals("-v")) {
                        config.verbose = true;
                    } else if (!arg.startsWith("-")) {
                        config.inputs.add(Path.of(arg));
                    } else {
                        System.err.println("Unknown option: " + arg);
                        return null;
                    }
                } catch (IllegalArgumentException e) {
                    System.err.println("Invalid value in " + arg);
                    return null;
                }
            }

            if (config.threads < 1 || config.timeoutMs < 0) {
                System.err.println("Error: --threads must be positive and --timeout-ms not negative");
                return null;
            }
            if (config.inputs.isEmpty()) {
                System.err.println("Error: No input files specified");
                return null;
            }
            return config;
        }
    }
}
