package org.carball.aql.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.aql.AqlClient;
import org.carball.aql.cache.QueryCacheAdmin;
import org.carball.aql.config.ClientConfig;
import org.carball.aql.config.ConfigurationLoader;
import org.carball.aql.cursor.Cursor;
import org.carball.aql.exception.AqlClientException;
import org.carball.aql.exception.AqlServerException;
import org.carball.aql.model.cache.CacheMode;
import org.carball.aql.model.cache.CacheProperties;
import org.carball.aql.model.query.ExplainOptions;
import org.carball.aql.model.query.QueryOptions;
import org.carball.aql.model.query.TrackingProperties;
import org.carball.aql.query.QueryService;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class AqlCLI {

    private static final String VERSION = "1.0.0";

    private static final Set<String> VALUE_OPTIONS = Set.of(
            "--host", "--database", "--username", "--password",
            "--connect-timeout", "--read-timeout", "--lock-timeout", "--config",
            "--bind", "--batch-size", "--ttl", "--max-plans", "--rules", "--memory-limit",
            "--max-warnings", "--read", "--write",
            "--mode", "--limit",
            "--enabled", "--max-slow-queries", "--slow-query-threshold",
            "--max-query-string-length", "--track-bind-vars", "--track-slow-queries");

    private static final Set<String> FLAGS = Set.of(
            "--count", "--full-count", "--all-plans", "--profile", "--cache", "--fail-on-warning",
            "--group", "--ignore-missing", "--verbose", "-v", "--help", "-h");

    private static final ObjectMapper OUTPUT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Parsed command line: the command, its positional arguments, options with values
     * and bare flags.
     */
    record CliCommand(String name, List<String> arguments, Map<String, List<String>> options, Set<String> flags) {

        String option(String key) {
            List<String> values = options.get(key);
            return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
        }

        List<String> optionValues(String key) {
            return options.getOrDefault(key, List.of());
        }

        boolean flag(String key) {
            return flags.contains(key);
        }

        String argument(int index, String description) {
            if (arguments.size() <= index) {
                throw new IllegalArgumentException(description + " not specified");
            }
            return arguments.get(index);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage(out);
            return args.length == 0 ? 1 : 0;
        }

        try {
            CliCommand command = parseArgs(args);
            if (command.flag("--verbose") || command.flag("-v")) {
                enableVerboseLogging();
            }
            ClientConfig config = new ConfigurationLoader().loadConfiguration(args);

            try (AqlClient client = new AqlClient(config)) {
                Object result = dispatch(command, client);
                out.println(OUTPUT_MAPPER.writeValueAsString(result));
            }
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (AqlServerException e) {
            err.println("Server error: " + e.getMessage());
            log.debug("Server error details", e);
            return 1;
        } catch (AqlClientException | JsonProcessingException e) {
            err.println("Client error: " + e.getMessage());
            log.debug("Client error details", e);
            return 1;
        }
    }

    static CliCommand parseArgs(String[] args) {
        String name = args[0];
        List<String> arguments = new ArrayList<>();
        Map<String, List<String>> options = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (VALUE_OPTIONS.contains(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Value for " + arg + " not specified");
                }
                options.computeIfAbsent(arg, k -> new ArrayList<>()).add(args[++i]);
            } else if (FLAGS.contains(arg)) {
                flags.add(arg);
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else {
                arguments.add(arg);
            }
        }
        return new CliCommand(name, arguments, options, flags);
    }

    static Object dispatch(CliCommand command, AqlClient client) {
        QueryService query = client.query();
        QueryCacheAdmin cache = client.queryCache();

        switch (command.name()) {
            case "explain":
                return query.explain(command.argument(0, "Query"), buildExplainOptions(command));
            case "validate":
                return query.validate(command.argument(0, "Query"));
            case "execute":
                return execute(command, client);
            case "kill":
                return query.kill(command.argument(0, "Query ID"));
            case "queries":
                return query.queries();
            case "slow-queries":
                return query.slowQueries();
            case "clear-slow-queries":
                return query.clearSlowQueries();
            case "tracking":
                return query.tracking();
            case "set-tracking":
                return query.setTracking(buildTrackingUpdate(command));
            case "functions":
                return query.functions();
            case "create-function":
                return query.createFunction(command.argument(0, "Function name"),
                        command.argument(1, "Function code"));
            case "delete-function":
                return query.deleteFunction(command.argument(0, "Function name"),
                                command.flag("--group"), command.flag("--ignore-missing"))
                        .map(Object.class::cast)
                        .orElse(false);
            case "cache-properties":
                return cache.properties();
            case "cache-configure":
                return cache.configure(buildCacheUpdate(command));
            case "cache-entries":
                return cache.entries();
            case "cache-clear":
                return cache.clear();
            default:
                throw new IllegalArgumentException("Unknown command: " + command.name());
        }
    }

    static ExplainOptions buildExplainOptions(CliCommand command) {
        ExplainOptions.ExplainOptionsBuilder builder = ExplainOptions.builder()
                .allPlans(command.flag("--all-plans"));
        if (command.option("--max-plans") != null) {
            builder.maxPlans(parseInt("--max-plans", command.option("--max-plans")));
        }
        if (command.option("--rules") != null) {
            builder.optimizerRules(splitList(command.option("--rules")));
        }
        return builder.build();
    }

    static QueryOptions buildQueryOptions(CliCommand command) {
        QueryOptions.QueryOptionsBuilder builder = QueryOptions.builder()
                .count(command.flag("--count"));
        if (!command.optionValues("--bind").isEmpty()) {
            builder.bindVars(parseBindVars(command.optionValues("--bind")));
        }
        if (command.option("--batch-size") != null) {
            builder.batchSize(parseInt("--batch-size", command.option("--batch-size")));
        }
        if (command.option("--ttl") != null) {
            builder.ttl(parseInt("--ttl", command.option("--ttl")));
        }
        if (command.option("--memory-limit") != null) {
            builder.memoryLimit(parseLong("--memory-limit", command.option("--memory-limit")));
        }
        if (command.option("--max-plans") != null) {
            builder.maxPlans(parseInt("--max-plans", command.option("--max-plans")));
        }
        if (command.option("--max-warnings") != null) {
            builder.maxWarningCount(parseInt("--max-warnings", command.option("--max-warnings")));
        }
        if (command.option("--rules") != null) {
            builder.optimizerRules(splitList(command.option("--rules")));
        }
        if (command.flag("--full-count")) {
            builder.fullCount(true);
        }
        if (command.flag("--profile")) {
            builder.profile(true);
        }
        if (command.flag("--cache")) {
            builder.cache(true);
        }
        if (command.flag("--fail-on-warning")) {
            builder.failOnWarning(true);
        }
        if (command.option("--read") != null) {
            builder.readCollections(splitList(command.option("--read")));
        }
        if (command.option("--write") != null) {
            builder.writeCollections(splitList(command.option("--write")));
        }
        return builder.build();
    }

    static TrackingProperties buildTrackingUpdate(CliCommand command) {
        TrackingProperties.TrackingPropertiesBuilder builder = TrackingProperties.builder();
        if (command.option("--enabled") != null) {
            builder.enabled(Boolean.parseBoolean(command.option("--enabled")));
        }
        if (command.option("--max-slow-queries") != null) {
            builder.maxSlowQueries(parseInt("--max-slow-queries", command.option("--max-slow-queries")));
        }
        if (command.option("--slow-query-threshold") != null) {
            builder.slowQueryThreshold(parseDouble("--slow-query-threshold", command.option("--slow-query-threshold")));
        }
        if (command.option("--max-query-string-length") != null) {
            builder.maxQueryStringLength(
                    parseInt("--max-query-string-length", command.option("--max-query-string-length")));
        }
        if (command.option("--track-bind-vars") != null) {
            builder.trackBindVars(Boolean.parseBoolean(command.option("--track-bind-vars")));
        }
        if (command.option("--track-slow-queries") != null) {
            builder.trackSlowQueries(Boolean.parseBoolean(command.option("--track-slow-queries")));
        }
        return builder.build();
    }

    static CacheProperties buildCacheUpdate(CliCommand command) {
        CacheProperties.CachePropertiesBuilder builder = CacheProperties.builder();
        if (command.option("--mode") != null) {
            builder.mode(CacheMode.fromValue(command.option("--mode")));
        }
        if (command.option("--limit") != null) {
            builder.limit(parseLong("--limit", command.option("--limit")));
        }
        return builder.build();
    }

    private static List<Object> execute(CliCommand command, AqlClient client) {
        QueryOptions options = buildQueryOptions(command);
        boolean transactional = options.getReadCollections() != null || options.getWriteCollections() != null;
        QueryService query = transactional
                ? client.transaction(options.getReadCollections(), options.getWriteCollections())
                : client.query();

        try (Cursor cursor = query.execute(command.argument(0, "Query"), options)) {
            return new ArrayList<>(cursor.toList());
        }
    }

    private static Map<String, Object> parseBindVars(List<String> bindings) {
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Object> bindVars = new HashMap<>();
        for (String binding : bindings) {
            int separator = binding.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Invalid bind parameter, expected name=value: " + binding);
            }
            String name = binding.substring(0, separator);
            String value = binding.substring(separator + 1);
            try {
                bindVars.put(name, mapper.readValue(value, Object.class));
            } catch (JsonProcessingException e) {
                // not JSON, bind it as a plain string
                bindVars.put(name, value);
            }
        }
        return bindVars;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    private static long parseLong(String option, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    private static double parseDouble(String option, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    private static void enableVerboseLogging() {
        Logger clientLogger = (Logger) LoggerFactory.getLogger("org.carball.aql");
        clientLogger.setLevel(Level.DEBUG);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("AQL client v" + VERSION);
        out.println();
        out.println("Usage: java -jar aql-client.jar <command> [arguments] [options]");
        out.println();
        out.println("Queries:");
        out.println("  explain <query>              Show the execution plan (--all-plans, --max-plans, --rules)");
        out.println("  validate <query>             Parse the query without running it");
        out.println("  execute <query>              Run the query and print every result");
        out.println("  kill <query-id>              Send a kill signal to a running query");
        out.println("  queries                      List running queries");
        out.println("  slow-queries                 List slow queries");
        out.println("  clear-slow-queries           Clear the slow query log");
        out.println("  tracking                     Show query tracking settings");
        out.println("  set-tracking                 Change query tracking settings");
        out.println();
        out.println("Functions:");
        out.println("  functions                    List user-defined functions");
        out.println("  create-function <name> <code>");
        out.println("  delete-function <name>       Delete a function (--group, --ignore-missing)");
        out.println();
        out.println("Query cache:");
        out.println("  cache-properties             Show query cache settings");
        out.println("  cache-configure              Change query cache settings (--mode off|on|demand, --limit)");
        out.println("  cache-entries                List cached results");
        out.println("  cache-clear                  Clear the query cache");
        out.println();
        out.println("Execute options:");
        out.println("  --bind <name=value>          Bind parameter, value parsed as JSON when possible (repeatable)");
        out.println("  --count                      Include the total result count");
        out.println("  --batch-size <n>             Results per round trip");
        out.println("  --ttl <seconds>              Cursor time-to-live");
        out.println("  --memory-limit <bytes>       Memory limit, 0 for none");
        out.println("  --full-count                 Count matches before the last LIMIT");
        out.println("  --profile                    Return profiling details");
        out.println("  --cache                      Use the query cache");
        out.println("  --fail-on-warning            Fail instead of returning warnings");
        out.println("  --max-warnings <n>           Maximum number of warnings returned");
        out.println("  --read <c1,c2>               Run as a transaction reading these collections");
        out.println("  --write <c1,c2>              Run as a transaction writing these collections");
        out.println();
        out.println("Other options:");
        out.println("  --verbose, -v                Log every request");
        out.println("  --help, -h                   Show this help message");
        out.println();
        out.println("Tracking options:");
        out.println("  --enabled <true|false>  --max-slow-queries <n>  --slow-query-threshold <seconds>");
        out.println("  --max-query-string-length <n>  --track-bind-vars <true|false>  --track-slow-queries <true|false>");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
    }
}
