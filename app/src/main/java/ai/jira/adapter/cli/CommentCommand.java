package ai.jira.adapter.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "comment", mixinStandardHelpOptions = true, description = "Add a markdown comment to an issue")
public class CommentCommand {

    @CommandLine.Option(names = "--issue", required = true, description = "Issue key", paramLabel = "KEY")
    private String issue;

    @CommandLine.Option(names = "--body", description = "Comment in markdown", paramLabel = "MARKDOWN")
    private String body;

    @CommandLine.Option(names = "--body-file", description = "File holding the markdown comment; - reads stdin", paramLabel = "PATH")
    private String bodyFile;

    public String issue() {
        return issue;
    }

    public String body() {
        return body;
    }

    public String bodyFile() {
        return bodyFile;
    }
}
