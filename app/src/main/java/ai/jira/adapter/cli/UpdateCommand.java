package ai.jira.adapter.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "update", mixinStandardHelpOptions = true, description = "Update fields of an existing issue")
public class UpdateCommand {

    @CommandLine.Option(names = "--issue", required = true, description = "Issue key", paramLabel = "KEY")
    private String issue;

    @CommandLine.Option(names = "--summary", description = "New summary")
    private String summary;

    @CommandLine.Option(names = "--description", description = "New description in markdown", paramLabel = "MARKDOWN")
    private String description;

    @CommandLine.Option(names = "--description-file", description = "File holding the markdown description; - reads stdin", paramLabel = "PATH")
    private String descriptionFile;

    @CommandLine.Option(names = "--type", description = "New issue type")
    private String issueType;

    @CommandLine.Option(names = "--assignee", description = "Account id or e-mail address of the assignee")
    private String assignee;

    @CommandLine.Option(names = "--fields", description = "JSON object merged into the issue fields", paramLabel = "JSON")
    private String fields;

    public String issue() {
        return issue;
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
