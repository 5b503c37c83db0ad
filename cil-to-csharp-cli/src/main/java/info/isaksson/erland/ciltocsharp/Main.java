package info.isaksson.erland.ciltocsharp;

import info.isaksson.erland.ciltocsharp.ast.AstJson;
import info.isaksson.erland.ciltocsharp.builder.AstBuildStats;
import info.isaksson.erland.ciltocsharp.core.CilToCSharpOptions;
import info.isaksson.erland.ciltocsharp.core.CilToCSharpResult;
import info.isaksson.erland.ciltocsharp.core.CilToCSharpService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entrypoint: reads a compiled-module snapshot (JSON) and writes the decompiled C# source.
 */
public final class Main {

    private static final CilToCSharpService SERVICE = new CilToCSharpService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.module == null) {
            System.err.println("Error: --module is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path modulePath = Paths.get(parsed.module).toAbsolutePath().normalize();
        if (!Files.exists(modulePath) || Files.isDirectory(modulePath)) {
            System.err.println("Error: --module must point to an existing module JSON file: " + modulePath);
            return 1;
        }

        final String baseName = stripExtension(modulePath.getFileName().toString());
        final Path csOut = resolveOutput(parsed.output, baseName, ".cs");

        final CilToCSharpResult res;
        try {
            res = SERVICE.translateSnapshot(modulePath, toCoreOptions(parsed));
        } catch (IOException e) {
            System.err.println("Error: could not read module JSON: " + modulePath);
            System.err.println(e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            System.err.println("Error: translation failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            Files.createDirectories(csOut.toAbsolutePath().normalize().getParent());
            Files.writeString(csOut, res.csharp);
        } catch (IOException e) {
            System.err.println("Error: could not write C# output to: " + csOut);
            System.err.println(e.getMessage());
            return 2;
        }

        // Optional: export the declaration tree
        Path astOut = null;
        if (parsed.writeAst != null && !parsed.writeAst.isBlank()) {
            astOut = resolveOutput(parsed.writeAst, baseName, ".ast.json");
            try {
                AstJson.write(res.unit, astOut);
            } catch (IOException e) {
                System.err.println("Error: could not write declaration tree to: " + astOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        AstBuildStats stats = res.stats;
        System.out.println(
                "cil-to-csharp\n" +
                "- Module: " + modulePath + "\n" +
                "- C#: " + csOut + "\n" +
                (astOut != null ? "- AST: " + astOut + "\n" : "") +
                "- Namespaces: " + stats.namespacesCreated + "\n" +
                "- Types: " + stats.typesCreated + " (nested: " + stats.nestedTypesCreated + ")\n" +
                "- Members: " + (stats.fieldsCreated + stats.eventsCreated + stats.propertiesCreated
                        + stats.constructorsCreated + stats.methodsCreated)
        );
        return 0;
    }

    private static CilToCSharpOptions toCoreOptions(CliArgs parsed) {
        CilToCSharpOptions o = new CilToCSharpOptions();
        o.reduceAstJumps = parsed.reduceJumps;
        o.reduceAstLoops = parsed.reduceLoops;
        o.reduceAstOther = parsed.reduceOther;
        o.transformIterations = parsed.iterations;
        return o;
    }

    /**
     * If the argument ends with {@code suffix} it is the file path; otherwise it is a directory
     * and the file is named after the module.
     */
    private static Path resolveOutput(String outputArg, String baseName, String suffix) {
        if (outputArg != null && outputArg.toLowerCase().endsWith(suffix)) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve(baseName + suffix);
    }

    private static String stripExtension(String fileName) {
        if (fileName == null) return "";
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0) return fileName;
        return fileName.substring(0, idx);
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String module;
        String output = "./output";
        String writeAst;

        boolean reduceJumps = true;
        boolean reduceLoops = true;
        boolean reduceOther = true;
        int iterations = 4;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--module":
                        out.module = requireValue(args, ++i, "--module");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--write-ast":
                        out.writeAst = requireValue(args, ++i, "--write-ast");
                        break;
                    case "--reduce-jumps":
                        out.reduceJumps = parseBoolean(requireValue(args, ++i, "--reduce-jumps"), "--reduce-jumps");
                        break;
                    case "--reduce-loops":
                        out.reduceLoops = parseBoolean(requireValue(args, ++i, "--reduce-loops"), "--reduce-loops");
                        break;
                    case "--reduce-other":
                        out.reduceOther = parseBoolean(requireValue(args, ++i, "--reduce-other"), "--reduce-other");
                        break;
                    case "--iterations":
                        out.iterations = parseNonNegativeInt(requireValue(args, ++i, "--iterations"), "--iterations");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --module
                        if (out.module == null) {
                            out.module = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parseNonNegativeInt(String v, String flag) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n < 0) throw new IllegalArgumentException("Negative value for " + flag + ": " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v, e);
            }
        }

        static void printHelp() {
            System.out.println(
                    "cil-to-csharp\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar cil-to-csharp.jar --module <module.json> [--output <dir|file.cs>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --module <path>         Compiled-module snapshot (JSON) to translate (required)\n" +
                    "  --output <path>         Output folder (default: ./output) or a .cs file path\n" +
                    "  --write-ast <path>      Also write the declaration tree as JSON (folder or .ast.json file)\n" +
                    "  --reduce-jumps <bool>   Run dead-label removal (default: true)\n" +
                    "  --reduce-loops <bool>   Reserved for loop restoration; no effect (default: true)\n" +
                    "  --reduce-other <bool>   Run idiom, empty-else, negation and type-reference passes\n" +
                    "                          (default: true)\n" +
                    "  --iterations <n>        Rounds of the main pass loop (default: 4)\n" +
                    "  -h, --help              Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/cil-to-csharp.jar --module build/MyLib.module.json --output out\n" +
                    "  java -jar target/cil-to-csharp.jar build/MyLib.module.json --write-ast out\n"
            );
        }
    }
}
