package ai.jira.adapter.cli;

import ai.jira.adapter.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "jira-adapter", mixinStandardHelpOptions = true,
        description = "Creates, updates, searches and comments on issues using markdown for rich text",
        subcommands = {
                CreateCommand.class,
                UpdateCommand.class,
                SearchCommand.class,
                CommentCommand.class,
                ConvertCommand.class
        })
public class CliArguments {

    @CommandLine.Option(names = "--config", description = "Path to the YAML configuration file", paramLabel = "PATH")
    private Path configPath;

    @CommandLine.Option(names = "--site", description = "Alias of the configured site to use", paramLabel = "ALIAS")
    private String site;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--log-level", description = "Root log level (TRACE, DEBUG, INFO, WARN, ERROR, OFF)", paramLabel = "LEVEL")
    private String logLevel;

    public Path configPath() {
        return configPath;
    }

    public String site() {
        return site;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String logLevel() {
        return logLevel;
    }
}
