package ai.jira.adapter.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "created KAN-1");

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"created KAN-1\"");
        assertThat(json).contains("\"logger\":\"ai.jira.adapter.jira.JiraClient\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"stack\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesStackTraceOfAttachedException() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "request failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"error_type\":\"java.lang.IllegalStateException\"");
        assertThat(json).contains("\"error\":\"boom\"");
        assertThat(json).contains("\"stack\":\"java.lang.IllegalStateException: boom\\n");
        assertThat(json.strip()).doesNotContain("\n");
    }

    @Test
    void promotesMdcEntriesToTopLevelFields() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "searching");
        event.setMDCPropertyMap(Map.of("operation", "search_jira_issues", "level", "ignored"));

        String json = layout.doLayout(event);

        assertThat(json).contains(",\"operation\":\"search_jira_issues\"");
        assertThat(json).contains("\"level\":\"INFO\"").doesNotContain("ignored");
    }

    @Test
    void escapesControlCharactersAndQuotes() {
        assertThat(SimpleJsonLayout.quote("say \"hi\"\tnow\\\u0001"))
                .isEqualTo("\"say \\\"hi\\\"\\tnow\\\\\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }

    private static SimpleJsonLayout startedLayout(LoggerContext context) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("ai.jira.adapter.jira.JiraClient");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
