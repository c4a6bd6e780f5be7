package ai.jira.adapter.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "search", mixinStandardHelpOptions = true, description = "Search issues with JQL")
public class SearchCommand {

    @CommandLine.Option(names = "--jql", required = true, description = "JQL query", paramLabel = "QUERY")
    private String jql;

    @CommandLine.Option(names = "--max-results", defaultValue = "50", description = "Maximum number of issues (default: ${DEFAULT-VALUE})", paramLabel = "COUNT")
    private int maxResults;

    public String jql() {
        return jql;
    }

    public int maxResults() {
        return maxResults;
    }
}
