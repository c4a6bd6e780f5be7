package ai.jira.adapter.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "create", mixinStandardHelpOptions = true, description = "Create an issue")
public class CreateCommand {

    @CommandLine.Option(names = "--project", required = true, description = "Project key", paramLabel = "KEY")
    private String project;

    @CommandLine.Option(names = "--summary", required = true, description = "Issue summary")
    private String summary;

    @CommandLine.Option(names = "--description", description = "Description in markdown", paramLabel = "MARKDOWN")
    private String description;

    @CommandLine.Option(names = "--description-file", description = "File holding the markdown description; - reads stdin", paramLabel = "PATH")
    private String descriptionFile;

    @CommandLine.Option(names = "--type", defaultValue = "Task", description = "Issue type (default: ${DEFAULT-VALUE})")
    private String issueType;

    @CommandLine.Option(names = "--assignee", description = "Account id or e-mail address of the assignee")
    private String assignee;

    @CommandLine.Option(names = "--fields", description = "JSON object merged into the issue fields", paramLabel = "JSON")
    private String fields;

    public String project() {
        return project;
    }

    public String summary() {
        return summary;
    }

    public String description() {
        return description;
    }

    public String descriptionFile() {
        return descriptionFile;
    }

    public String issueType() {
        return issueType;
    }

    public String assignee() {
        return assignee;
    }

    public String fields() {
        return fields;
    }
}
