package ai.jira.adapter.cli;

import ai.jira.adapter.adf.AdfDocument;
import ai.jira.adapter.adf.AdfJsonWriter;
import ai.jira.adapter.config.Config;
import ai.jira.adapter.config.ConfigLoader;
import ai.jira.adapter.config.ConfigurationException;
import ai.jira.adapter.config.SystemEnvironmentReader;
import ai.jira.adapter.logging.LoggingConfigurator;
import ai.jira.adapter.markdown.MarkdownToAdfConverter;
import ai.jira.adapter.tools.JiraTools;
import ai.jira.adapter.tools.ToolResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the issue operations.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    private static final String STDIN = "-";

    private final ConfigLoader configLoader;
    private final Function<Config, JiraTools> toolsFactory;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), JiraTools::new, System.in, System.out, System.err);
    }

    CliApplication(ConfigLoader configLoader,
                   Function<Config, JiraTools> toolsFactory,
                   InputStream in,
                   PrintStream out,
                   PrintStream err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.toolsFactory = Objects.requireNonNull(toolsFactory, "toolsFactory");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        int invalidInput = commandLine.getCommandSpec().exitCodeOnInvalidInput();

        CommandLine.ParseResult parseResult;
        try {
            parseResult = commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            ex.getCommandLine().usage(commandLine.getErr());
            return invalidInput;
        }

        if (CommandLine.printHelpIfRequested(parseResult)) {
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (!parseResult.hasSubcommand()) {
            commandLine.getErr().println("Missing command");
            commandLine.usage(commandLine.getErr());
            return invalidInput;
        }
        Object command = parseResult.subcommand().commandSpec().userObject();

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.logLevel());
            config.loadedConfigPath().ifPresent(path -> LOGGER.debug("Configuration loaded from {}", path));

            if (command instanceof ConvertCommand convert) {
                return convert(convert, config);
            }
            JiraTools tools = toolsFactory.apply(config);
            ToolResponse response;
            if (command instanceof CreateCommand create) {
                response = tools.createJiraIssue(create.project(), create.summary(),
                        markdown(create.description(), create.descriptionFile(), "--description"),
                        create.issueType(), cliArguments.site(), create.assignee(), fields(create.fields()));
            } else if (command instanceof UpdateCommand update) {
                response = tools.updateJiraIssue(update.issue(), update.summary(),
                        markdown(update.description(), update.descriptionFile(), "--description"),
                        update.issueType(), cliArguments.site(), update.assignee(), fields(update.fields()));
            } else if (command instanceof SearchCommand search) {
                response = tools.searchJiraIssues(search.jql(), cliArguments.site(), search.maxResults());
            } else if (command instanceof CommentCommand comment) {
                String body = markdown(comment.body(), comment.bodyFile(), "--body");
                if (body == null) {
                    throw new UsageException("Either --body or --body-file must be provided");
                }
                response = tools.addJiraComment(comment.issue(), body, cliArguments.site());
            } else {
                throw new IllegalStateException("Unsupported command " + command.getClass().getSimpleName());
            }
            return report(response);
        } catch (UsageException ex) {
            err.println(ex.getMessage());
            return invalidInput;
        } catch (ConfigurationException | IllegalArgumentException ex) {
            LOGGER.error("Configuration error: {}", ex.getMessage());
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOGGER.error("Failed to read input", ex);
            err.println("Error: failed to read input: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int convert(ConvertCommand command, Config config) throws IOException {
        String markdown = read(command.input() == null ? STDIN : command.input());
        AdfDocument document = new MarkdownToAdfConverter(config.converterOptions()).convert(markdown);
        AdfJsonWriter writer = new AdfJsonWriter(objectMapper);
        out.println(command.compact() ? writer.write(document) : writer.writePretty(document));
        return EXIT_OK;
    }

    private int report(ToolResponse response) {
        if (response.error()) {
            err.println(response.text());
            return EXIT_FAILURE;
        }
        out.println(response.text());
        return EXIT_OK;
    }

    /**
     * Inline markdown or the contents of {@code file}; null when neither was given.
     */
    private String markdown(String inline, String file, String optionName) throws IOException {
        if (inline != null && file != null) {
            throw new UsageException(optionName + " and " + optionName + "-file are mutually exclusive");
        }
        if (file != null) {
            return read(file);
        }
        return inline;
    }

    private String read(String source) throws IOException {
        if (STDIN.equals(source)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(source), StandardCharsets.UTF_8);
    }

    private Map<String, Object> fields(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException ex) {
            throw new UsageException("--fields must be a JSON object: " + ex.getOriginalMessage());
        }
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
