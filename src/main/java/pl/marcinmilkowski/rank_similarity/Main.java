package pl.marcinmilkowski.rank_similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.rank_similarity.api.SimilarityApiServer;
import pl.marcinmilkowski.rank_similarity.config.SimilarityConfig;
import pl.marcinmilkowski.rank_similarity.config.SimilarityConfigLoader;
import pl.marcinmilkowski.rank_similarity.io.RankingReader;
import pl.marcinmilkowski.rank_similarity.kendall.KendallResult;
import pl.marcinmilkowski.rank_similarity.kendall.KendallTauB;
import pl.marcinmilkowski.rank_similarity.measure.LoggingProgressListener;
import pl.marcinmilkowski.rank_similarity.measure.ProgressListener;
import pl.marcinmilkowski.rank_similarity.measure.RankBiasedOverlap;
import pl.marcinmilkowski.rank_similarity.measure.RankingSimilarity;
import pl.marcinmilkowski.rank_similarity.model.RankedList;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command-line entry point for comparing two rankings.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run one command.
     *
     * @return process exit code: 0 on success, 1 on usage errors, 2 on failures
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            showUsage(out);
            return 1;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "rbo":
                    return handleRboCommand(args, out, err);
                case "rbo-ext":
                    return handleRboExtCommand(args, out, err);
                case "kendall":
                    return handleKendallCommand(args, out, err);
                case "server":
                    return handleServerCommand(args, out, err);
                case "help":
                    showUsage(out);
                    return 0;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage(err);
                    return 1;
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            logger.error("Application error", e);
            err.println("Error: " + e.getMessage());
            err.println("Use 'help' command for usage information.");
            return 2;
        }
    }

    /**
     * Options shared by the comparison commands.
     */
    private static final class CommandOptions {
        String first;
        String second;
        String firstFile;
        String secondFile;
        String configPath;
        Integer depth;
        Double p;
        Boolean extrapolate;
        boolean progress;
        int port = 8080;

        static CommandOptions parse(String[] args, PrintStream err) {
            CommandOptions options = new CommandOptions();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--first":
                    case "-s":
                        options.first = requireValue(args, ++i);
                        break;
                    case "--second":
                    case "-t":
                        options.second = requireValue(args, ++i);
                        break;
                    case "--first-file":
                        options.firstFile = requireValue(args, ++i);
                        break;
                    case "--second-file":
                        options.secondFile = requireValue(args, ++i);
                        break;
                    case "--config":
                    case "-c":
                        options.configPath = requireValue(args, ++i);
                        break;
                    case "--depth":
                    case "-k":
                        options.depth = Integer.parseInt(requireValue(args, ++i));
                        break;
                    case "--p":
                    case "-p":
                        options.p = Double.parseDouble(requireValue(args, ++i));
                        break;
                    case "--extrapolate":
                    case "-e":
                        options.extrapolate = true;
                        break;
                    case "--progress":
                        options.progress = true;
                        break;
                    case "--port":
                        options.port = Integer.parseInt(requireValue(args, ++i));
                        break;
                    default:
                        err.println("Unknown option: " + args[i]);
                }
            }
            return options;
        }

        private static String requireValue(String[] args, int index) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for option " + args[index - 1]);
            }
            return args[index];
        }
    }

    private static SimilarityConfigLoader loadConfig(CommandOptions options) throws IOException {
        if (options.configPath != null) {
            return new SimilarityConfigLoader(Paths.get(options.configPath));
        }
        return SimilarityConfigLoader.fromClasspath();
    }

    private static RankedList<String> readRanking(String inline, String file, String name) throws IOException {
        if (file != null) {
            return RankingReader.read(Paths.get(file));
        }
        if (inline != null) {
            return RankingReader.parseInline(inline);
        }
        throw new IllegalArgumentException("--" + name + " or --" + name + "-file is required");
    }

    private static RankingSimilarity<String> buildSimilarity(CommandOptions options, SimilarityConfig config,
                                                             String label) throws IOException {
        RankedList<String> first = readRanking(options.first, options.firstFile, "first");
        RankedList<String> second = readRanking(options.second, options.secondFile, "second");
        ProgressListener listener = options.progress ? new LoggingProgressListener(label) : ProgressListener.NONE;
        return new RankingSimilarity<>(first, second, new KendallTauB(), listener, config.progressDelta());
    }

    private static int handleRboCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        CommandOptions options = CommandOptions.parse(args, err);
        SimilarityConfig config = loadConfig(options).getConfig();

        int depth = options.depth != null ? options.depth : config.depth();
        double p = options.p != null ? options.p : config.persistence();
        boolean extrapolate = options.extrapolate != null ? options.extrapolate : config.extrapolate();

        RankingSimilarity<String> similarity = buildSimilarity(options, config, "rbo");
        double score = similarity.rbo(depth, p, extrapolate);

        out.println("First list length: " + similarity.first().size());
        out.println("Second list length: " + similarity.second().size());
        out.println("Depth: " + (depth == RankBiasedOverlap.UNBOUNDED ? "unbounded" : String.valueOf(depth)));
        out.println("Persistence: " + p);
        out.println("Extrapolate: " + extrapolate);
        out.printf(Locale.ROOT, "RBO: %.6f%n", score);
        return 0;
    }

    private static int handleRboExtCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        CommandOptions options = CommandOptions.parse(args, err);
        SimilarityConfig config = loadConfig(options).getConfig();
        double p = options.p != null ? options.p : config.extrapolationPersistence();

        RankingSimilarity<String> similarity = buildSimilarity(options, config, "rbo-ext");
        double score = similarity.rboExt(p);

        out.println("First list length: " + similarity.first().size());
        out.println("Second list length: " + similarity.second().size());
        out.println("Persistence: " + p);
        out.printf(Locale.ROOT, "Extrapolated RBO: %.6f%n", score);
        return 0;
    }

    private static int handleKendallCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        CommandOptions options = CommandOptions.parse(args, err);
        SimilarityConfig config = loadConfig(options).getConfig();

        KendallResult result = buildSimilarity(options, config, "kendall").kendall();

        out.println("The number of common elements is " + result.commonCount());
        out.printf(Locale.ROOT, "The proportion used in the first list is %6.3f%%.%n", result.firstCoverage());
        out.printf(Locale.ROOT, "The proportion used in the second list is %6.3f%%.%n", result.secondCoverage());
        if (result.isDefined()) {
            out.printf(Locale.ROOT, "Kendall tau-b: %.6f%n", result.coefficient());
        } else {
            out.println("Kendall tau-b: undefined (fewer than two common elements)");
        }
        return 0;
    }

    private static int handleServerCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        CommandOptions options = CommandOptions.parse(args, err);
        SimilarityConfigLoader configLoader = loadConfig(options);

        out.println("Starting API server...");
        out.println("Port: " + options.port);
        out.println();
        out.println("Endpoints:");
        out.println("  GET  /health      - Health check");
        out.println("  GET  /api/config  - Active default parameters");
        out.println("  POST /api/rbo     - Fixed-depth RBO");
        out.println("  POST /api/rbo-ext - Extrapolated RBO");
        out.println("  POST /api/kendall - Kendall tau-b over shared items");
        out.println();
        out.println("Press Ctrl+C to stop the server.");

        SimilarityApiServer server = SimilarityApiServer.builder()
            .withConfig(configLoader)
            .withPort(options.port)
            .build();
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            out.println("\nShutting down...");
            server.stop();
        }));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    private static void showUsage(PrintStream out) {
        out.println("Usage: java -jar rank-similarity.jar <command> [options]");
        out.println();
        out.println("Available commands:");
        out.println("  rbo      - Rank-biased overlap to a fixed depth");
        out.println("  rbo-ext  - Extrapolated rank-biased overlap (lists of unequal length)");
        out.println("  kendall  - Kendall tau-b over the items both lists share");
        out.println("  server   - Start the REST API server");
        out.println("  help     - Show this help message");
        out.println();
        out.println("Input options (all comparison commands):");
        out.println("  --first <a,b,c>        First ranking, comma-separated");
        out.println("  --second <a,b,c>       Second ranking, comma-separated");
        out.println("  --first-file <path>    First ranking, one item per line or a JSON array (.json)");
        out.println("  --second-file <path>   Second ranking, one item per line or a JSON array (.json)");
        out.println("  --config <path>        JSON file with default parameters");
        out.println("  --progress             Log progress while computing");
        out.println();
        out.println("RBO command:");
        out.println("  java -jar rank-similarity.jar rbo --first a,b,c,d,e --second e,d,c [--depth <k>] [--p <p>] [--extrapolate]");
        out.println();
        out.println("Extrapolated RBO command:");
        out.println("  java -jar rank-similarity.jar rbo-ext --first-file run1.txt --second-file run2.txt [--p 0.98]");
        out.println();
        out.println("Kendall command:");
        out.println("  java -jar rank-similarity.jar kendall --first a,b,c --second c,b,a");
        out.println();
        out.println("Server command:");
        out.println("  java -jar rank-similarity.jar server [--port <port>] [--config <path>]");
    }
}
