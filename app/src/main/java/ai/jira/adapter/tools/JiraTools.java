package ai.jira.adapter.tools;

import ai.jira.adapter.config.Config;
import ai.jira.adapter.config.ConfigurationException;
import ai.jira.adapter.config.JiraSiteConfig;
import ai.jira.adapter.jira.CreatedComment;
import ai.jira.adapter.jira.CreatedIssue;
import ai.jira.adapter.jira.IssueDraft;
import ai.jira.adapter.jira.IssueSummary;
import ai.jira.adapter.jira.IssueUpdate;
import ai.jira.adapter.jira.JiraClient;
import ai.jira.adapter.jira.JiraServiceException;
import ai.jira.adapter.jira.UpdatedIssue;
import ai.jira.adapter.markdown.MarkdownToAdfConverter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * The named issue-tracker operations: create, update, search and comment. Each resolves the target site, calls the
 * client and reports the outcome as text; no exception escapes to the caller.
 */
public class JiraTools {

    private static final Logger LOGGER = LoggerFactory.getLogger(JiraTools.class);

    public static final int DEFAULT_MAX_RESULTS = 50;

    private final Config config;
    private final Function<JiraSiteConfig, JiraClient> clientFactory;
    private final SearchResultFormatter formatter;

    public JiraTools(Config config) {
        this(config, defaultClientFactory(config));
    }

    public JiraTools(Config config, Function<JiraSiteConfig, JiraClient> clientFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.formatter = new SearchResultFormatter();
    }

    private static Function<JiraSiteConfig, JiraClient> defaultClientFactory(Config config) {
        MarkdownToAdfConverter converter = new MarkdownToAdfConverter(config.converterOptions());
        return site -> new JiraClient(site, config.http(), converter);
    }

    public ToolResponse createJiraIssue(String project,
                                        String summary,
                                        String description,
                                        String issueType,
                                        String siteAlias,
                                        String assignee,
                                        Map<String, Object> additionalFields) {
        LOGGER.debug("create_jira_issue: project={}, issueType={}, site={}, assignee={}, additionalFields={}",
                project, issueType, siteAlias, assignee, additionalFields != null);
        return invoke("create_jira_issue", "creating", () -> {
            IssueDraft draft = new IssueDraft(project, summary, description, issueType,
                    Optional.ofNullable(assignee), additionalFields);
            CreatedIssue created = client(siteAlias).createIssue(draft);
            return "Successfully created JIRA issue: " + created.key() + " (ID: " + created.id() + "). URL: "
                    + created.url();
        });
    }

    public ToolResponse updateJiraIssue(String issueKey,
                                        String summary,
                                        String description,
                                        String issueType,
                                        String siteAlias,
                                        String assignee,
                                        Map<String, Object> additionalFields) {
        LOGGER.debug("update_jira_issue: issue={}, site={}", issueKey, siteAlias);
        return invoke("update_jira_issue", "updating", () -> {
            IssueUpdate update = new IssueUpdate(Optional.ofNullable(summary), Optional.ofNullable(description),
                    Optional.ofNullable(issueType), Optional.ofNullable(assignee), additionalFields);
            UpdatedIssue updated = client(siteAlias).updateIssue(issueKey, update);
            return "Successfully updated JIRA issue: " + updated.key() + ". Updated fields: "
                    + String.join(", ", updated.updatedFields()) + ". URL: " + updated.url();
        });
    }

    public ToolResponse searchJiraIssues(String query, String siteAlias, Integer maxResults) {
        int limit = maxResults == null ? DEFAULT_MAX_RESULTS : maxResults;
        LOGGER.debug("search_jira_issues: query={}, site={}, maxResults={}", query, siteAlias, limit);
        return invoke("search_jira_issues", "searching", () -> {
            List<IssueSummary> issues = client(siteAlias).searchIssues(query, limit);
            LOGGER.info("Search found {} issues", issues.size());
            return formatter.format(query, issues);
        });
    }

    public ToolResponse addJiraComment(String issueKey, String body, String siteAlias) {
        LOGGER.debug("add_jira_comment: issue={}, site={}", issueKey, siteAlias);
        return invoke("add_jira_comment", "commenting on", () -> {
            CreatedComment comment = client(siteAlias).addComment(issueKey, body);
            return "Successfully added comment " + comment.id() + " to JIRA issue: " + comment.issueKey()
                    + ". URL: " + comment.url();
        });
    }

    private JiraClient client(String siteAlias) {
        JiraSiteConfig site = config.activeSite(Optional.ofNullable(siteAlias));
        return clientFactory.apply(site);
    }

    private static ToolResponse invoke(String name, String verb, Supplier<String> operation) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("operation", name)) {
            try {
                return ToolResponse.success(operation.get());
            } catch (JiraServiceException | ConfigurationException ex) {
                LOGGER.error("Error {} JIRA issue: {}", verb, ex.getMessage(), ex);
                return ToolResponse.failure("Error " + verb + " JIRA issue: " + ex.getMessage());
            } catch (RuntimeException ex) {
                LOGGER.error("Unexpected error {} JIRA issue: {}", verb, ex.getMessage(), ex);
                return ToolResponse.failure("An unexpected error occurred: " + ex.getMessage());
            }
        }
    }
}
