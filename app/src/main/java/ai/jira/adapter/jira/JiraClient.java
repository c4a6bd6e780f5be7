package ai.jira.adapter.jira;

import ai.jira.adapter.adf.AdfJsonWriter;
import ai.jira.adapter.adf.AdfText;
import ai.jira.adapter.config.HttpSettings;
import ai.jira.adapter.config.JiraSiteConfig;
import ai.jira.adapter.markdown.MarkdownToAdfConverter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking client for the issue tracker's REST API (v3) of one site.
 *
 * <p>Rich-text values (descriptions, comment bodies) are accepted as markdown and sent as ADF.
 */
public class JiraClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JiraClient.class);

    static final List<String> SEARCH_FIELDS = List.of(
            "summary", "status", "assignee", "priority", "issuetype", "project", "created", "updated", "description");

    private final JiraSiteConfig site;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MarkdownToAdfConverter converter;
    private final AdfJsonWriter adfWriter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Duration timeout;
    private final String authorization;

    public JiraClient(JiraSiteConfig site, HttpSettings settings, MarkdownToAdfConverter converter) {
        this(site, HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(settings.timeout())
                        .build(),
                new ObjectMapper(), converter, RetryPolicy.from(settings), Sleeper.THREAD, settings.timeout());
    }

    JiraClient(JiraSiteConfig site,
               HttpClient httpClient,
               ObjectMapper objectMapper,
               MarkdownToAdfConverter converter,
               RetryPolicy retryPolicy,
               Sleeper sleeper,
               Duration timeout) {
        this.site = Objects.requireNonNull(site, "site");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.adfWriter = new AdfJsonWriter(objectMapper);
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        String credentials = site.email() + ":" + site.apiToken();
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    public JiraSiteConfig site() {
        return site;
    }

    public CreatedIssue createIssue(IssueDraft draft) {
        Objects.requireNonNull(draft, "draft");
        ObjectNode fields = objectMapper.createObjectNode();
        fields.putObject("project").put("key", draft.projectKey());
        fields.put("summary", draft.summary());
        if (!draft.description().isBlank()) {
            fields.set("description", adf(draft.description()));
        }
        fields.putObject("issuetype").put("name", draft.issueType());
        if (draft.assignee().isPresent()) {
            fields.putObject("assignee").put("accountId", resolveAccountId(draft.assignee().get()));
        }
        mergeAdditionalFields(fields, draft.additionalFields());

        HttpResponse<String> response = execute("create issue", post("/rest/api/3/issue", wrapFields(fields)));
        if (response.statusCode() != 201) {
            throw failure("create issue", response);
        }
        JsonNode body = parse("create issue", response.body());
        String key = body.path("key").asText("");
        if (key.isEmpty()) {
            throw new JiraServiceException("Issue created, but no 'key' found in the response");
        }
        CreatedIssue created = new CreatedIssue(body.path("id").asText(""), key, site.browseUrl(key));
        LOGGER.info("Created issue {} on site {}", key, site.alias());
        return created;
    }

    public UpdatedIssue updateIssue(String issueKey, IssueUpdate update) {
        String key = requireIssueKey(issueKey);
        Objects.requireNonNull(update, "update");
        if (update.isEmpty()) {
            throw new JiraServiceException("No fields provided to update for issue " + key);
        }
        ObjectNode fields = objectMapper.createObjectNode();
        List<String> updated = new ArrayList<>();
        update.summary().ifPresent(summary -> {
            fields.put("summary", summary);
            updated.add("summary");
        });
        update.description().ifPresent(description -> {
            fields.set("description", adf(description));
            updated.add("description");
        });
        update.issueType().ifPresent(type -> {
            fields.putObject("issuetype").put("name", type);
            updated.add("issuetype");
        });
        if (update.assignee().isPresent()) {
            fields.putObject("assignee").put("accountId", resolveAccountId(update.assignee().get()));
            updated.add("assignee");
        }
        mergeAdditionalFields(fields, update.additionalFields());
        update.additionalFields().keySet().stream()
                .filter(name -> !updated.contains(name))
                .forEach(updated::add);

        HttpResponse<String> response = execute("update issue", put("/rest/api/3/issue/" + key, wrapFields(fields)));
        if (!isSuccess(response.statusCode())) {
            throw failure("update issue", response);
        }
        LOGGER.info("Updated issue {} on site {}: {}", key, site.alias(), updated);
        return new UpdatedIssue(key, updated, site.browseUrl(key));
    }

    public List<IssueSummary> searchIssues(String jql, int maxResults) {
        if (jql == null || jql.isBlank()) {
            throw new IllegalArgumentException("jql must not be blank");
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("jql", jql);
        payload.put("maxResults", maxResults);
        ArrayNode fields = payload.putArray("fields");
        SEARCH_FIELDS.forEach(fields::add);

        HttpResponse<String> response = execute("search issues", post("/rest/api/3/search/jql", payload));
        if (response.statusCode() != 200) {
            throw failure("search issues", response);
        }
        List<IssueSummary> results = new ArrayList<>();
        for (JsonNode issue : parse("search issues", response.body()).path("issues")) {
            results.add(toSummary(issue));
        }
        LOGGER.debug("Search on site {} returned {} issues", site.alias(), results.size());
        return results;
    }

    public CreatedComment addComment(String issueKey, String markdown) {
        String key = requireIssueKey(issueKey);
        if (markdown == null || markdown.isBlank()) {
            throw new IllegalArgumentException("comment body must not be blank");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("body", adf(markdown));

        HttpResponse<String> response = execute("add comment",
                post("/rest/api/3/issue/" + key + "/comment", payload));
        if (response.statusCode() != 201) {
            throw failure("add comment", response);
        }
        String id = parse("add comment", response.body()).path("id").asText("");
        LOGGER.info("Added comment {} to issue {} on site {}", id, key, site.alias());
        return new CreatedComment(id, key, site.browseUrl(key));
    }

    /**
     * Values containing {@code @} are looked up as e-mail addresses; anything else is taken as an account id.
     */
    public String resolveAccountId(String assignee) {
        if (assignee == null || assignee.isBlank()) {
            throw new IllegalArgumentException("assignee must not be blank");
        }
        String value = assignee.trim();
        if (!value.contains("@")) {
            return value;
        }
        String path = "/rest/api/3/user/search?query=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
        HttpResponse<String> response = execute("look up user", request(path).GET().build());
        if (response.statusCode() != 200) {
            throw failure("look up user", response);
        }
        for (JsonNode user : parse("look up user", response.body())) {
            String accountId = user.path("accountId").asText("");
            if (!accountId.isEmpty()) {
                return accountId;
            }
        }
        throw new JiraServiceException("No Jira user found for " + value);
    }

    private HttpResponse<String> execute(String operation, HttpRequest request) {
        for (int attempt = 0; ; attempt++) {
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (IOException ex) {
                throw new JiraServiceException("Network error while trying to " + operation + ": " + ex.getMessage(), ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new JiraServiceException("Interrupted while trying to " + operation, ex);
            }
            Optional<Duration> delay = retryPolicy.delayBeforeRetry(attempt, response.statusCode(),
                    response.headers().firstValue("Retry-After"));
            if (delay.isEmpty()) {
                if (retryPolicy.isRetryable(response.statusCode())) {
                    LOGGER.error("Jira throttled {} on site {}; max attempts ({}) exceeded",
                            operation, site.alias(), retryPolicy.maxAttempts());
                }
                return response;
            }
            LOGGER.warn("Jira returned {} for {}; retrying in {} ms (attempt {}/{})",
                    response.statusCode(), operation, delay.get().toMillis(), attempt + 1, retryPolicy.maxAttempts());
            try {
                sleeper.sleep(delay.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new JiraServiceException("Interrupted while waiting to retry " + operation, ex);
            }
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(site.baseUrl() + path))
                .timeout(timeout)
                .header("Authorization", authorization)
                .header("Accept", "application/json");
    }

    private HttpRequest post(String path, JsonNode payload) {
        return request(path)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(write(payload), StandardCharsets.UTF_8))
                .build();
    }

    private HttpRequest put(String path, JsonNode payload) {
        return request(path)
                .header("Content-Type", "application/json; charset=utf-8")
                .PUT(HttpRequest.BodyPublishers.ofString(write(payload), StandardCharsets.UTF_8))
                .build();
    }

    private ObjectNode adf(String markdown) {
        return adfWriter.toJson(converter.convert(markdown));
    }

    private ObjectNode wrapFields(ObjectNode fields) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("fields", fields);
        return payload;
    }

    private void mergeAdditionalFields(ObjectNode fields, Map<String, Object> additionalFields) {
        additionalFields.forEach((name, value) -> fields.set(name, objectMapper.valueToTree(value)));
    }

    private IssueSummary toSummary(JsonNode issue) {
        String key = issue.path("key").asText("");
        JsonNode fields = issue.path("fields");
        Optional<String> assignee = Optional.of(fields.path("assignee").path("displayName").asText(""))
                .filter(value -> !value.isBlank());
        Optional<String> description = Optional.of(AdfText.plainText(fields.get("description")))
                .filter(value -> !value.isBlank());
        return new IssueSummary(
                key,
                fields.path("summary").asText(""),
                fields.path("project").path("key").asText(""),
                fields.path("issuetype").path("name").asText(""),
                fields.path("status").path("name").asText(""),
                fields.path("priority").path("name").asText(""),
                assignee,
                fields.path("created").asText(""),
                fields.path("updated").asText(""),
                description,
                site.browseUrl(key));
    }

    private String write(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new JiraServiceException("Failed to serialize request payload", ex);
        }
    }

    private JsonNode parse(String operation, String body) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException ex) {
            throw new JiraServiceException("Failed to " + operation + ": unreadable response body", ex);
        }
    }

    private static JiraServiceException failure(String operation, HttpResponse<String> response) {
        return new JiraServiceException("Failed to " + operation + ": " + response.statusCode() + " - " + response.body(),
                response.statusCode());
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static String requireIssueKey(String issueKey) {
        if (issueKey == null || issueKey.isBlank()) {
            throw new IllegalArgumentException("issue key must not be blank");
        }
        return issueKey.trim();
    }
}
