package ai.jira.adapter.tools;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;

import ai.jira.adapter.config.Config;
import ai.jira.adapter.config.HttpSettings;
import ai.jira.adapter.config.JiraSiteConfig;
import ai.jira.adapter.config.LogFormat;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@WireMockTest
class JiraToolsTest {

    private String baseUrl;
    private JiraTools tools;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wireMock) {
        baseUrl = wireMock.getHttpBaseUrl();
        JiraSiteConfig site = new JiraSiteConfig("test", URI.create(baseUrl), "me@example.com", "token");
        HttpSettings http = new HttpSettings(1, Duration.ZERO, Duration.ZERO, Duration.ofSeconds(5), 0.0);
        Config config = new Config("test", Map.of("test", site), Optional.empty(), LogFormat.TEXT, "INFO", 10, http,
                Optional.empty());
        tools = new JiraTools(config);
    }

    @Test
    void reportsCreatedIssue() {
        stubFor(post(urlEqualTo("/rest/api/3/issue")).willReturn(aResponse()
                .withStatus(201)
                .withBody("{\"id\":\"10001\",\"key\":\"KAN-1\"}")));

        ToolResponse response = tools.createJiraIssue("KAN", "Login fails", "# Steps", "Bug", null, null, null);

        assertThat(response.error()).isFalse();
        assertThat(response.text())
                .isEqualTo("Successfully created JIRA issue: KAN-1 (ID: 10001). URL: " + baseUrl + "/browse/KAN-1");
        verify(postRequestedFor(urlEqualTo("/rest/api/3/issue"))
                .withRequestBody(matchingJsonPath("$.fields.description.content[0].type", equalTo("heading"))));
    }

    @Test
    void reportsRejectedCreate() {
        stubFor(post(urlEqualTo("/rest/api/3/issue")).willReturn(aResponse().withStatus(400).withBody("bad")));

        ToolResponse response = tools.createJiraIssue("KAN", "x", "", null, null, null, null);

        assertThat(response.error()).isTrue();
        assertThat(response.text()).isEqualTo("Error creating JIRA issue: Failed to create issue: 400 - bad");
    }

    @Test
    void reportsUnknownSiteAlias() {
        ToolResponse response = tools.createJiraIssue("KAN", "x", "", null, "nope", null, null);

        assertThat(response.error()).isTrue();
        assertThat(response.text())
                .isEqualTo("Error creating JIRA issue: Unknown site alias 'nope'. Available sites: test");
    }

    @Test
    void reportsInvalidArgumentsAsUnexpected() {
        ToolResponse response = tools.createJiraIssue(" ", "x", "", null, null, null, null);

        assertThat(response.error()).isTrue();
        assertThat(response.text()).isEqualTo("An unexpected error occurred: projectKey must not be blank");
    }

    @Test
    void reportsUpdatedFields() {
        stubFor(put(urlEqualTo("/rest/api/3/issue/KAN-1")).willReturn(aResponse().withStatus(204)));

        ToolResponse response = tools.updateJiraIssue("KAN-1", "New title", "*body*", null, null, null,
                Map.of("labels", List.of("ui")));

        assertThat(response.text()).isEqualTo("Successfully updated JIRA issue: KAN-1. Updated fields: "
                + "summary, description, labels. URL: " + baseUrl + "/browse/KAN-1");
    }

    @Test
    void reportsEmptyUpdate() {
        ToolResponse response = tools.updateJiraIssue("KAN-1", null, null, null, null, null, null);

        assertThat(response.error()).isTrue();
        assertThat(response.text())
                .isEqualTo("Error updating JIRA issue: No fields provided to update for issue KAN-1");
    }

    @Test
    void searchUsesDefaultLimitAndReportsNoHits() {
        stubFor(post(urlEqualTo("/rest/api/3/search/jql")).willReturn(okJson("{\"issues\":[]}")));

        ToolResponse response = tools.searchJiraIssues("project = EMPTY", null, null);

        assertThat(response.text()).isEqualTo("No issues found for query: project = EMPTY");
        verify(postRequestedFor(urlEqualTo("/rest/api/3/search/jql"))
                .withRequestBody(matchingJsonPath("$.maxResults", equalTo("50"))));
    }

    @Test
    void searchFormatsHits() {
        stubFor(post(urlEqualTo("/rest/api/3/search/jql")).willReturn(okJson(
                "{\"issues\":[{\"key\":\"KAN-9\",\"fields\":{\"summary\":\"Crash\",\"status\":{\"name\":\"Done\"}}}]}")));

        ToolResponse response = tools.searchJiraIssues("key = KAN-9", "test", 5);

        assertThat(response.error()).isFalse();
        assertThat(response.text())
                .startsWith("Found 1 issues:\n\n**KAN-9**: Crash\n")
                .contains("  - **Status**: Done\n", "  - **Assignee**: Unassigned\n")
                .endsWith("  - **URL**: " + baseUrl + "/browse/KAN-9");
    }

    @Test
    void reportsAddedComment() {
        stubFor(post(urlEqualTo("/rest/api/3/issue/KAN-1/comment"))
                .willReturn(aResponse().withStatus(201).withBody("{\"id\":\"10100\"}")));

        ToolResponse response = tools.addJiraComment("KAN-1", "Looks good", null);

        assertThat(response.text()).isEqualTo(
                "Successfully added comment 10100 to JIRA issue: KAN-1. URL: " + baseUrl + "/browse/KAN-1");
    }

    @Test
    void reportsCommentFailure() {
        stubFor(post(urlEqualTo("/rest/api/3/issue/KAN-404/comment"))
                .willReturn(aResponse().withStatus(404).withBody("Issue does not exist")));

        ToolResponse response = tools.addJiraComment("KAN-404", "hello", null);

        assertThat(response.error()).isTrue();
        assertThat(response.text())
                .isEqualTo("Error commenting on JIRA issue: Failed to add comment: 404 - Issue does not exist");
    }
}
