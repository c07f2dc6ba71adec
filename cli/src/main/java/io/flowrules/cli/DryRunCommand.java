package io.flowrules.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.flowrules.cli.config.ConfigLoadException;
import io.flowrules.cli.config.ConfigLoader;
import io.flowrules.cli.config.RulesConfig;
import io.flowrules.cli.logging.LogbackConfigurator;
import io.flowrules.core.catalog.FlowCatalog;
import io.flowrules.core.catalog.FlowCatalogParser;
import io.flowrules.core.engine.FlowRules;
import io.flowrules.core.error.FlowLoadException;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Flow;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.spi.RuleEventListener;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a flow's visibility rules against a set of answers and prints
 * the resulting {@code qid -> {state, required}} mapping as sorted, indented
 * JSON. A debugging aid for flow authors.
 *
 * <p>
 * Exit codes: {@link #EXIT_OK}, {@link #EXIT_STARTUP} for configuration or
 * catalog failures, {@link #EXIT_USAGE} for bad arguments or answers.
 */
public final class DryRunCommand {

    private static final Logger LOG = LoggerFactory.getLogger(DryRunCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = "usage: flow-rules-dry-run <answers> [--flow NAME] [--flows PATH] [--config PATH]"
            + " [--engine strict|legacy] [--validate]\n"
            + "  <answers>  JSON object of answers, or @path to read it from a file";

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final boolean configureLogging;

    public DryRunCommand(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this(out, err, envLookup, true);
    }

    DryRunCommand(PrintStream out, PrintStream err, Function<String, String> envLookup, boolean configureLogging) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
        this.configureLogging = configureLogging;
    }

    /** Parsed command line. */
    record Arguments(
            String answers, String flow, String flowsFile, Path configPath, String engine, boolean validate) {}

    /** Runs the command and returns its exit code. */
    public int run(String[] args) {
        Arguments arguments;
        try {
            arguments = parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        RulesConfig config;
        try {
            config = applyOverrides(ConfigLoader.resolve(arguments.configPath(), envLookup), arguments);
        } catch (ConfigLoadException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_STARTUP;
        }
        if (configureLogging) {
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        }

        FlowCatalog catalog;
        try {
            catalog = new FlowCatalogParser().parse(Path.of(config.flowsFile()));
        } catch (FlowLoadException e) {
            err.println("Flow catalog error: " + e.getMessage() + " (" + e.source() + ")");
            return EXIT_STARTUP;
        }

        String flowName = arguments.flow() != null ? arguments.flow() : config.defaultFlow();
        Optional<Flow> flow = catalog.flow(flowName);
        if (flow.isEmpty()) {
            err.println("Unknown flow '" + flowName + "'; available: " + catalog.names());
            return EXIT_USAGE;
        }

        AnswerBag answers;
        try {
            answers = loadAnswers(arguments.answers());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        String engine = config.engine();
        FlowRules rules = FlowRules.withBuiltinEngines(() -> engine, config.parseCache(), RuleEventListener.NOOP);
        List<Question> questions = flow.get().questions();
        LOG.info("dry_run.start flow={} engine={} questions={}", flowName, engine, questions.size());

        VisibilityMap visibility = rules.evaluateVisibility(questions, answers);
        try {
            out.println(JSON.writeValueAsString(visibility.toJson()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render visibility mapping", e);
        }

        if (arguments.validate()) {
            List<String> issues = rules.validate(questions);
            for (String issue : issues) {
                err.println(issue);
            }
            LOG.info("dry_run.validate flow={} issues={}", flowName, issues.size());
        }
        return EXIT_OK;
    }

    static Arguments parseArguments(String[] args) {
        String answers = null;
        String flow = null;
        String flowsFile = null;
        Path configPath = null;
        String engine = null;
        boolean validate = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--flow" -> flow = requireValue(args, ++i, arg);
                case "--flows" -> flowsFile = requireValue(args, ++i, arg);
                case "--config" -> configPath = Path.of(requireValue(args, ++i, arg));
                case "--engine" -> {
                    engine = requireValue(args, ++i, arg);
                    if (!RulesConfig.ENGINE_STRICT.equals(engine) && !RulesConfig.ENGINE_LEGACY.equals(engine)) {
                        throw new IllegalArgumentException("--engine must be 'strict' or 'legacy'");
                    }
                }
                case "--validate" -> validate = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (answers != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    answers = arg;
                }
            }
        }
        if (answers == null) {
            throw new IllegalArgumentException("Missing answers argument");
        }
        return new Arguments(answers, flow, flowsFile, configPath, engine, validate);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static RulesConfig applyOverrides(RulesConfig config, Arguments arguments) {
        RulesConfig.Builder builder = config.toBuilder();
        if (arguments.engine() != null) builder.engine(arguments.engine());
        if (arguments.flowsFile() != null) builder.flowsFile(arguments.flowsFile());
        return builder.build();
    }

    /**
     * Reads answers from inline JSON or {@code @path}.
     *
     * @throws IllegalArgumentException if the file is unreadable, the JSON is
     *                                  invalid, or it is not an object
     */
    static AnswerBag loadAnswers(String argument) {
        String text;
        if (argument.startsWith("@")) {
            Path path = Path.of(argument.substring(1));
            try {
                text = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read answers file " + path + ": " + e.getMessage(), e);
            }
        } else {
            text = argument;
        }
        JsonNode node;
        try {
            node = JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid answers payload: " + e.getOriginalMessage(), e);
        }
        return AnswerBag.fromJson(node);
    }
}
