package ai.jira.adapter.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "convert", mixinStandardHelpOptions = true, description = "Print the ADF JSON for a markdown document")
public class ConvertCommand {

    @CommandLine.Option(names = "--input", description = "Markdown file; stdin when omitted or -", paramLabel = "PATH")
    private String input;

    @CommandLine.Option(names = "--compact", description = "Print JSON on a single line")
    private boolean compact;

    public String input() {
        return input;
    }

    public boolean compact() {
        return compact;
    }
}
