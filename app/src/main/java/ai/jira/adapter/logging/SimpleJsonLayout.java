package ai.jira.adapter.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes each event as a single-line JSON object. MDC entries such as the tool {@code operation} become top-level
 * fields; an attached throwable is split into {@code error_type}, {@code error} and {@code stack}.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final Set<String> RESERVED = Set.of("timestamp", "level", "logger", "thread", "message",
            "error_type", "error", "stack");

    @Override
    public String doLayout(ILoggingEvent event) {
        Line line = new Line();
        line.field("timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)))
                .field("level", event.getLevel().toString())
                .field("logger", event.getLoggerName())
                .field("thread", event.getThreadName())
                .field("message", event.getFormattedMessage());

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null) {
            new TreeMap<>(mdc).forEach((key, value) -> {
                if (!RESERVED.contains(key)) {
                    line.field(key, value);
                }
            });
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            line.field("error_type", throwable.getClassName())
                    .field("error", throwable.getMessage())
                    .field("stack", ThrowableProxyUtil.asString(throwable));
        }
        return line.close() + System.lineSeparator();
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16).append('"');
        value.chars().forEach(ch -> {
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", ch));
                    } else {
                        escaped.append((char) ch);
                    }
                }
            }
        });
        return escaped.append('"').toString();
    }

    private static final class Line {
        private final StringBuilder json = new StringBuilder(256).append('{');

        Line field(String name, String value) {
            if (json.length() > 1) {
                json.append(',');
            }
            json.append(quote(name)).append(':').append(quote(value));
            return this;
        }

        String close() {
            return json.append('}').toString();
        }
    }
}
