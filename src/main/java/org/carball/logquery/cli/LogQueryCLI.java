package org.carball.logquery.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.logquery.builder.HistogramInterval;
import org.carball.logquery.builder.QueryCompiler;
import org.carball.logquery.builder.QuerySpec;
import org.carball.logquery.config.CompilerSettings;
import org.carball.logquery.config.ConfigurationLoader;
import org.carball.logquery.error.QueryBuildException;
import org.carball.logquery.model.filter.FilterGroup;
import org.carball.logquery.model.query.Query;
import org.carball.logquery.model.query.QueryOptions;
import org.carball.logquery.model.query.SortOptions;
import org.carball.logquery.model.query.SortOrder;
import org.carball.logquery.model.request.QueryMode;
import org.carball.logquery.output.CompiledQueryReport;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
public class LogQueryCLI {

    private static final String VERSION = "1.0.0";

    private final Map<String, String> environment;
    private final QueryCompiler compiler = new QueryCompiler();

    public LogQueryCLI() {
        this(System.getenv());
    }

    public LogQueryCLI(Map<String, String> environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        int exitCode = new LogQueryCLI().run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Compiles the query described by {@code args} and prints it as JSON.
     *
     * @return the process exit code
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage(out);
            return args.length == 0 ? 1 : 0;
        }

        try {
            CliArguments arguments = parseArgs(args);
            CompilerSettings settings = new ConfigurationLoader(environment)
                    .loadConfiguration(arguments.getConfigPath(), args);

            QueryOptions options = toOptions(arguments, settings);
            Query query = compile(arguments, options);

            String mode = arguments.isHistogram() ? "histogram" : arguments.getMode().getValue();
            out.println(new CompiledQueryReport(mode, options.getTableName(), query).toJson());
            return 0;

        } catch (QueryBuildException e) {
            err.println("Query error: " + e.getMessage());
            log.debug("Query error details", e);
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private Query compile(CliArguments arguments, QueryOptions options) throws QueryBuildException, IOException {
        if (arguments.isHistogram()) {
            String dslFilter = arguments.getMode() == QueryMode.DSL ? arguments.getQueryText() : null;
            return compiler.histogram(options, arguments.getHistogramInterval(), dslFilter).build();
        }

        QuerySpec spec = switch (arguments.getMode()) {
            case SQL -> QuerySpec.rawSql(arguments.getQueryText());
            case DSL -> QuerySpec.dsl(arguments.getQueryText());
            case FILTERS -> QuerySpec.filters(readFilterGroups(arguments));
        };
        return compiler.compile(spec, options);
    }

    private List<FilterGroup> readFilterGroups(CliArguments arguments) throws IOException {
        if (!Files.exists(arguments.getFiltersFile())) {
            throw new IOException("Filters file not found: " + arguments.getFiltersFile());
        }
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(arguments.getFiltersFile().toFile(), new TypeReference<List<FilterGroup>>() {
        });
    }

    private QueryOptions toOptions(CliArguments arguments, CompilerSettings settings) {
        String table = arguments.getTable() != null ? arguments.getTable() : settings.getDefaultTable();
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Table not specified. Use --table or --settings.table");
        }

        long limit = arguments.getLimit() != null ? arguments.getLimit() : settings.getDefaultLimit();
        if (limit > settings.getMaxLimit()) {
            throw new IllegalArgumentException("Limit " + limit + " exceeds the maximum of " + settings.getMaxLimit());
        }

        return QueryOptions.builder()
                .tableName(table)
                .startTime(arguments.getFrom())
                .endTime(arguments.getTo())
                .limit(limit)
                .sort(arguments.getSort())
                .timestampField(settings.getTimestampField())
                .build();
    }

    static CliArguments parseArgs(String[] args) {
        CliArguments arguments = new CliArguments();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--table":
                case "-t":
                    arguments.setTable(requireValue(args, i++, "Table"));
                    break;

                case "--dsl":
                    setQuery(arguments, QueryMode.DSL, requireValue(args, i++, "DSL query"));
                    break;

                case "--sql":
                    setQuery(arguments, QueryMode.SQL, requireValue(args, i++, "SQL query"));
                    break;

                case "--filters":
                    setQuery(arguments, QueryMode.FILTERS, null);
                    arguments.setFiltersFile(Paths.get(requireValue(args, i++, "Filters file")));
                    break;

                case "--from":
                    arguments.setFrom(parseInstant("--from", requireValue(args, i++, "Start time")));
                    break;

                case "--to":
                    arguments.setTo(parseInstant("--to", requireValue(args, i++, "End time")));
                    break;

                case "--limit":
                case "-l":
                    arguments.setLimit(parseLimit(requireValue(args, i++, "Limit")));
                    break;

                case "--sort":
                    arguments.setSort(parseSort(requireValue(args, i++, "Sort")));
                    break;

                case "--histogram":
                    arguments.setHistogram(true);
                    String interval = requireValue(args, i++, "Histogram interval");
                    arguments.setHistogramInterval("auto".equalsIgnoreCase(interval)
                            ? null
                            : HistogramInterval.fromName(interval));
                    break;

                case "--config":
                    arguments.setConfigPath(requireValue(args, i++, "Config file"));
                    break;

                default:
                    if (arg.startsWith("--settings.")) {
                        // Read by ConfigurationLoader
                        requireValue(args, i++, arg);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (arguments.getMode() == null && !arguments.isHistogram()) {
            throw new IllegalArgumentException("Specify one of --dsl, --sql or --filters");
        }
        if (arguments.isHistogram() && arguments.getMode() != null && arguments.getMode() != QueryMode.DSL) {
            throw new IllegalArgumentException("--histogram only accepts a --dsl filter");
        }
        return arguments;
    }

    private static void setQuery(CliArguments arguments, QueryMode mode, String text) {
        if (arguments.getMode() != null) {
            throw new IllegalArgumentException("Only one of --dsl, --sql or --filters may be given");
        }
        arguments.setMode(mode);
        arguments.setQueryText(text);
    }

    private static String requireValue(String[] args, int index, String name) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(name + " not specified");
        }
        return args[index + 1];
    }

    private static Instant parseInstant(String option, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + option + " time '" + value
                    + "'. Use ISO-8601, e.g. 2024-01-01T00:00:00Z");
        }
    }

    private static long parseLimit(String value) {
        try {
            long limit = Long.parseLong(value);
            if (limit <= 0) {
                throw new IllegalArgumentException("Limit must be greater than 0");
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid limit: " + value);
        }
    }

    private static SortOptions parseSort(String value) {
        int separator = value.lastIndexOf(':');
        if (separator < 0) {
            return SortOptions.ascending(value);
        }
        return new SortOptions(value.substring(0, separator), SortOrder.fromString(value.substring(separator + 1)));
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h");
    }

    private static void printUsage(PrintStream out) {
        out.println("Log Query Compiler v" + VERSION);
        out.println();
        out.println("Usage: java -jar log-query-compiler.jar --table <db.table> (--dsl <query> | --sql <query> | --filters <file.json>) [options]");
        out.println();
        out.println("Query input (exactly one):");
        out.println("  --dsl <query>         LogchefQL-style filter, e.g. service='api';status>=500");
        out.println("  --sql <query>         Raw SELECT against the configured table");
        out.println("  --filters <file>      JSON array of filter groups");
        out.println();
        out.println("Options:");
        out.println("  --table, -t           Table to query (or --settings.table / LOGQUERY_TABLE)");
        out.println("  --from <instant>      Start of time range, ISO-8601");
        out.println("  --to <instant>        End of time range, ISO-8601");
        out.println("  --limit, -l <num>     Maximum rows (default: 100)");
        out.println("  --sort <field[:dir]>  Sort field with optional asc|desc");
        out.println("  --histogram <bucket>  Count rows per bucket: minute|five_minutes|fifteen_minutes|hour|day|auto");
        out.println("  --config <file>       YAML settings file");
        out.println("  --help, -h            Show this help message");
        out.println();
        out.println(ConfigurationLoader.getSettingsHelp());
        out.println("Examples:");
        out.println("  java -jar log-query-compiler.jar --table logs --dsl \"service_name='api';severity_text='error'\"");
        out.println("  java -jar log-query-compiler.jar --table logs --sql \"SELECT * FROM logs WHERE level = 'error'\"");
        out.println("  java -jar log-query-compiler.jar --table logs --filters filters.json --from 2024-01-01T00:00:00Z --to 2024-01-02T00:00:00Z");
    }
}
