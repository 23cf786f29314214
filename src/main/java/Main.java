import automaton.Automaton;
import automaton.InvalidPatternException;
import health.BatchResult;
import health.BatchRunner;
import health.HealthConfiguration;
import health.InvalidRangeException;
import utilities.HealthInput;
import utilities.HealthInputReader;
import utilities.HealthLogger;
import utilities.MalformedInputException;
import utilities.MemUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Reads genes, weights and strands (from a file or stdin), scores every strand and prints the
 * smallest and largest health as {@code "min max"}.
 */
public final class Main {

    private static final int DEFAULT_THREADS = 1;

    public static void main(String[] args) {
        int status = run(args, System.in, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, InputStream stdin, PrintStream out) {
        try {
            CliOptions options = CliOptions.parse(args);
            HealthInput input = read(options, stdin);
            if (input.queries().isEmpty()) {
                HealthLogger.error("No strands to evaluate");
                return 1;
            }

            Automaton automaton = Automaton.build(input.genes(), input.weights());
            HealthLogger.info("Automaton: " + automaton);
            if (options.memReport) {
                HealthLogger.info(new MemUtil().jolMemoryReport(options.footprint, automaton));
            }

            HealthConfiguration configuration = HealthConfiguration.builder()
                    .parallelism(options.threads)
                    .chunkSize(options.chunkSize)
                    .verify(options.verify)
                    .collectPerQuery(options.perQuery)
                    .build();
            BatchResult result = new BatchRunner(configuration).runDetailed(automaton, input.queries());

            if (options.perQuery) {
                for (long health : result.healths()) {
                    out.println(health);
                }
            }
            out.println(result.range().format());
            return 0;
        } catch (MalformedInputException | InvalidPatternException | InvalidRangeException e) {
            HealthLogger.error(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            HealthLogger.error("Bad arguments: " + e.getMessage());
            return 1;
        } catch (ArithmeticException e) {
            HealthLogger.error("Strand health overflows 64 bits: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            HealthLogger.error("Failed to read input: " + e.getMessage(), e);
            return 1;
        }
    }

    private static HealthInput read(CliOptions options, InputStream stdin) throws IOException {
        if (options.inputFile != null) {
            HealthLogger.debug("Reading " + options.inputFile);
            return HealthInputReader.read(options.inputFile);
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        return HealthInputReader.read(reader);
    }

    static final class CliOptions {
        final Path inputFile;
        final int threads;
        final int chunkSize;
        final boolean verify;
        final boolean perQuery;
        final boolean memReport;
        final boolean footprint;

        private CliOptions(Path inputFile, int threads, int chunkSize, boolean verify, boolean perQuery,
                           boolean memReport, boolean footprint) {
            this.inputFile = inputFile;
            this.threads = threads;
            this.chunkSize = chunkSize;
            this.verify = verify;
            this.perQuery = perQuery;
            this.memReport = memReport;
            this.footprint = footprint;
        }

        static CliOptions parse(String[] args) {
            Path input = null;
            int threads = DEFAULT_THREADS;
            int chunk = HealthConfiguration.DEFAULT_CHUNK_SIZE;
            boolean verify = false;
            boolean perQuery = false;
            boolean mem = false;
            boolean footprint = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key;
                String value = null;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                }
                switch (key) {
                    case "verify" -> verify = true;
                    case "per-query" -> perQuery = true;
                    case "mem" -> mem = true;
                    // Implies --mem and adds JOL's per-class table.
                    case "footprint" -> {
                        mem = true;
                        footprint = true;
                    }
                    case "input", "threads", "chunk" -> {
                        if (value == null) {
                            if (i + 1 >= args.length) {
                                throw new IllegalArgumentException("Missing value for option --" + key);
                            }
                            value = args[++i];
                        }
                        switch (key) {
                            case "input" -> input = Path.of(value);
                            case "threads" -> threads = parsePositive(key, value);
                            default -> chunk = parsePositive(key, value);
                        }
                    }
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }
            return new CliOptions(input, threads, chunk, verify, perQuery, mem, footprint);
        }

        private static int parsePositive(String key, String value) {
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + key + " expects an integer, got " + value, e);
            }
            if (parsed <= 0) {
                throw new IllegalArgumentException("--" + key + " must be positive");
            }
            return parsed;
        }
    }
}
