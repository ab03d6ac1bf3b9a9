package dumb.afsolve;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.afsolve.LabellingSearch.BranchOrder;
import dumb.afsolve.io.ApxParser;
import dumb.afsolve.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Command-line front end: reads an APX file, answers one problem and prints {@code YES} or
 * {@code NO}.
 * <pre>
 * java dumb.afsolve.AfSolve -f framework.apx -p DC-CO -a a1
 * java dumb.afsolve.AfSolve -f framework.apx -p VE-ST -a a1,a2,a3
 * </pre>
 */
public class AfSolve {

    public static final String YES = "YES";
    public static final String NO = "NO";
    static final long DEFAULT_TIMEOUT_MILLIS = 0;
    static final BranchOrder DEFAULT_BRANCH_ORDER = BranchOrder.INSERTION;
    static final boolean DEFAULT_LOG_STATS = false;
    private static final Logger logger = LoggerFactory.getLogger(AfSolve.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** @return the process exit code: 0 when an answer was printed, 1 otherwise */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        String file = null, problemCode = null, argumentList = null, configFile = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-f", "--file" -> file = args[++i];
                    case "-p", "--problem" -> problemCode = args[++i];
                    case "-c", "--config" -> configFile = args[++i];
                    case "-a", "--arguments" -> {
                        if (i + 1 < args.length && !args[i + 1].startsWith("-")) argumentList = args[++i];
                        else argumentList = "";
                    }
                    case "-h", "--help" -> {
                        printUsage(out);
                        return 0;
                    }
                    default -> {
                        err.println("Error: Unknown option: " + args[i]);
                        printUsage(err);
                        return 1;
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                err.println("Error: Missing value for " + args[i - 1]);
                printUsage(err);
                return 1;
            }
        }

        if (file == null || problemCode == null) {
            err.println("Error: Both a file (-f) and a problem (-p) are required.");
            printUsage(err);
            return 1;
        }

        var problem = Problem.fromCode(problemCode).orElse(null);
        if (problem == null) {
            err.println("Error: Unknown problem '" + problemCode + "'. Please choose one of these: " + Problem.codes() + ".");
            return 1;
        }

        var target = splitArguments(argumentList);
        if (!target.stream().allMatch(ApxParser::isArgumentName)) {
            err.println("Error: Unaccepted argument(s). The name of an argument can be any sequence of letters "
                    + "(upper case or lower case), numbers, or the underscore symbol _, except the "
                    + "words 'arg' and 'att' which are reserved for defining the lines.");
            return 1;
        }

        Configuration config;
        try {
            config = configFile != null ? Configuration.load(Path.of(configFile)) : new Configuration();
        } catch (IOException e) {
            logger.debug("Configuration load failed", e);
            err.println("Error: Cannot read configuration " + configFile + ": " + e.getMessage());
            return 1;
        }

        var path = Path.of(file);
        if (!Files.exists(path)) {
            err.println("The file " + file + " does not exist.");
            return 1;
        }

        try {
            var framework = ApxParser.parse(path);
            var answer = Solver.of(config).evaluate(framework, problem, target);
            out.println(answer ? YES : NO);
            return 0;
        } catch (ApxParser.ParseException | AfException e) {
            logger.debug("{} on {} failed", problem.code(), file, e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Failed to read {}: {}", file, e.getMessage(), e);
            err.println("Error: Cannot read " + file + ": " + e.getMessage());
            return 1;
        }
    }

    /** Comma-separated names; null or blank gives the empty set. */
    static Set<String> splitArguments(@Nullable String list) {
        if (list == null || list.isBlank()) return Set.of();
        return new LinkedHashSet<>(Arrays.asList(list.split(",", -1)));
    }

    private static void printUsage(PrintStream s) {
        s.printf("Usage: java %s -f <file.apx> -p <problem> [-a ARG1,ARG2,...] [-c config.json]%n", AfSolve.class.getName());
        s.println("Problems: " + Problem.codes());
        s.println("VE-XX problems take a set of arguments (omit -a for the empty set); DC-XX and DS-XX take exactly one.");
    }

    public record Configuration(
            @JsonProperty("timeoutMillis") long timeoutMillis,
            @JsonProperty("branchOrder") BranchOrder branchOrder,
            @JsonProperty("logStats") boolean logStats
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("timeoutMillis") Long timeoutMillis,
                @JsonProperty("branchOrder") BranchOrder branchOrder,
                @JsonProperty("logStats") Boolean logStats
        ) {
            this(
                    timeoutMillis != null ? timeoutMillis : DEFAULT_TIMEOUT_MILLIS,
                    branchOrder != null ? branchOrder : DEFAULT_BRANCH_ORDER,
                    logStats != null ? logStats : DEFAULT_LOG_STATS
            );
        }

        public Configuration() {
            this(DEFAULT_TIMEOUT_MILLIS, DEFAULT_BRANCH_ORDER, DEFAULT_LOG_STATS);
        }

        public Configuration {
            if (timeoutMillis < 0) throw new IllegalArgumentException("timeoutMillis must be >= 0");
        }

        public static Configuration load(Path file) throws IOException {
            var config = Json.obj(file, Configuration.class);
            logger.debug("Loaded configuration from {}:\n{}", file, Json.str(config));
            return config;
        }
    }
}
