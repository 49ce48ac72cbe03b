package ai.formula.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private LoggerContext context;
    private SimpleJsonLayout layout;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.start();
        layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
    }

    @Test
    void formatsEventAsJson() {
        LoggingEvent event = event("hello \"world\"");

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).contains("\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void writesCellFromMdcAndExceptionDetails() {
        LoggingEvent event = event("Cannot tokenize formula");
        event.setMDCPropertyMap(Map.of("cell", "Sheet1!A2", "message", "shadowed"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"cell\":\"Sheet1!A2\"");
        assertThat(json).doesNotContain("shadowed");
        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException\"");
        assertThat(json).contains("\"exceptionMessage\":\"boom\"");
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
