package ai.jira.adapter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.jira.adapter.config.Config;
import ai.jira.adapter.config.ConfigLoader;
import ai.jira.adapter.config.ConfigurationException;
import ai.jira.adapter.config.HttpSettings;
import ai.jira.adapter.config.LogFormat;
import ai.jira.adapter.tools.JiraTools;
import ai.jira.adapter.tools.ToolResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final Config CONFIG = new Config("test", Map.of(), Optional.empty(), LogFormat.TEXT, "WARN", 10,
            HttpSettings.defaults(), Optional.empty());

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final RecordingJiraTools tools = new RecordingJiraTools();

    @TempDir
    Path tempDir;

    @Test
    void convertPrintsAdfForStdin() throws IOException {
        int exitCode = application("# Hello\n\nworld").run(new String[] {"convert"});

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertThat(json.path("version").asInt()).isEqualTo(1);
        assertThat(json.at("/content/0/type").asText()).isEqualTo("heading");
        assertThat(json.at("/content/1/content/0/text").asText()).isEqualTo("world");
    }

    @Test
    void convertReadsFileAndPrintsCompactJson() throws IOException {
        Path input = tempDir.resolve("notes.md");
        Files.writeString(input, "- one\n- two\n");

        int exitCode = application("").run(new String[] {"convert", "--input", input.toString(), "--compact"});

        assertThat(exitCode).isZero();
        String printed = out.toString(StandardCharsets.UTF_8).strip();
        assertThat(printed).doesNotContain("\n");
        assertThat(printed).startsWith("{\"version\":1,\"type\":\"doc\",\"content\":[{\"type\":\"bulletList\"");
    }

    @Test
    void createPassesOptionsToTools() {
        int exitCode = application("Steps from stdin").run(new String[] {
                "--site", "work",
                "create",
                "--project", "KAN",
                "--summary", "Login fails",
                "--description-file", "-",
                "--assignee", "dev@example.com",
                "--fields", "{\"labels\":[\"ui\"]}"
        });

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("created");
        assertThat(tools.calls).containsExactly("create KAN|Login fails|Steps from stdin|Task|work|dev@example.com|{labels=[ui]}");
    }

    @Test
    void updateAndSearchAndCommentAreDispatched() {
        CliApplication application = application("");

        assertThat(application.run(new String[] {"update", "--issue", "KAN-1", "--summary", "New"})).isZero();
        assertThat(application.run(new String[] {"search", "--jql", "project = KAN"})).isZero();
        assertThat(application.run(new String[] {"comment", "--issue", "KAN-1", "--body", "done"})).isZero();

        assertThat(tools.calls).containsExactly(
                "update KAN-1|New|null|null|null|null|{}",
                "search project = KAN|null|50",
                "comment KAN-1|done|null");
    }

    @Test
    void toolFailureExitsWithOne() {
        tools.failNext = true;

        int exitCode = application("").run(new String[] {"comment", "--issue", "KAN-1", "--body", "x"});

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Error commenting on JIRA issue: boom");
    }

    @Test
    void missingCommandPrintsUsage() {
        int exitCode = application("").run(new String[] {});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Missing command", "Usage: jira-adapter");
    }

    @Test
    void missingRequiredOptionIsUsageError() {
        int exitCode = application("").run(new String[] {"create", "--project", "KAN"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("--summary");
        assertThat(tools.calls).isEmpty();
    }

    @Test
    void helpExitsWithZero() {
        int exitCode = application("").run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("create", "convert");
    }

    @Test
    void conflictingDescriptionOptionsAreRejected() {
        int exitCode = application("").run(new String[] {
                "create", "--project", "KAN", "--summary", "S", "--description", "a", "--description-file", "-"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("mutually exclusive");
    }

    @Test
    void invalidFieldsJsonIsRejected() {
        int exitCode = application("").run(new String[] {
                "create", "--project", "KAN", "--summary", "S", "--fields", "[1, 2]"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("--fields must be a JSON object");
    }

    @Test
    void commentWithoutBodyIsRejected() {
        int exitCode = application("").run(new String[] {"comment", "--issue", "KAN-1"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("--body");
    }

    @Test
    void configurationErrorExitsWithOne() {
        ConfigLoader failingLoader = new ConfigLoader(key -> Optional.empty()) {
            @Override
            public Config load(CliArguments arguments) {
                throw new ConfigurationException("Configuration file not found: missing.yaml");
            }
        };
        CliApplication application = new CliApplication(failingLoader, config -> tools,
                new ByteArrayInputStream(new byte[0]), new PrintStream(out, true), new PrintStream(err, true));

        int exitCode = application.run(new String[] {"convert"});

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Error: Configuration file not found: missing.yaml");
    }

    private CliApplication application(String stdin) {
        return new CliApplication(new FixedConfigLoader(CONFIG), config -> tools,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static final class RecordingJiraTools extends JiraTools {

        private final List<String> calls = new ArrayList<>();
        private boolean failNext;

        RecordingJiraTools() {
            super(CONFIG, site -> {
                throw new IllegalStateException("no client expected");
            });
        }

        @Override
        public ToolResponse createJiraIssue(String project, String summary, String description, String issueType,
                                            String siteAlias, String assignee, Map<String, Object> additionalFields) {
            calls.add("create " + String.join("|", project, summary, description, issueType, siteAlias, assignee,
                    String.valueOf(additionalFields)));
            return respond("created");
        }

        @Override
        public ToolResponse updateJiraIssue(String issueKey, String summary, String description, String issueType,
                                            String siteAlias, String assignee, Map<String, Object> additionalFields) {
            calls.add("update " + issueKey + "|" + summary + "|" + description + "|" + issueType + "|" + siteAlias
                    + "|" + assignee + "|" + additionalFields);
            return respond("updated");
        }

        @Override
        public ToolResponse searchJiraIssues(String query, String siteAlias, Integer maxResults) {
            calls.add("search " + query + "|" + siteAlias + "|" + maxResults);
            return respond("found");
        }

        @Override
        public ToolResponse addJiraComment(String issueKey, String body, String siteAlias) {
            calls.add("comment " + issueKey + "|" + body + "|" + siteAlias);
            return failNext ? ToolResponse.failure("Error commenting on JIRA issue: boom") : respond("commented");
        }

        private ToolResponse respond(String text) {
            return ToolResponse.success(text);
        }
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        private final Config config;

        FixedConfigLoader(Config config) {
            super(key -> Optional.empty());
            this.config = config;
        }

        @Override
        public Config load(CliArguments arguments) {
            return config;
        }
    }
}
