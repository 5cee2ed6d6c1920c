package in.fxsignal.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Env lookups backed by JVM system properties.
 *
 * Tests:
 * - Numeric values parse after trimming
 * - Malformed numbers fall back to the default with a WARN naming key and raw value
 * - Lists drop blank entries
 */
class EnvTest {

    private static final List<String> KEYS = List.of(
        "FXSIGNAL_TEST_INT", "FXSIGNAL_TEST_LONG", "FXSIGNAL_TEST_DOUBLE", "FXSIGNAL_TEST_LIST");

    private Logger envLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        envLogger = (Logger) LoggerFactory.getLogger(Env.class);
        appender = new ListAppender<>();
        appender.start();
        envLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        envLogger.detachAppender(appender);
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void testValidNumbersParse() {
        System.setProperty("FXSIGNAL_TEST_INT", " 42 ");
        System.setProperty("FXSIGNAL_TEST_DOUBLE", "0.25");

        assertEquals(42, Env.getInt("FXSIGNAL_TEST_INT", 7));
        assertEquals(0.25, Env.getDouble("FXSIGNAL_TEST_DOUBLE", 1.0), 1e-12);
        assertEquals(9L, Env.getLong("FXSIGNAL_TEST_LONG", 9L), "Unset key uses the default");
        assertTrue(appender.list.isEmpty(), "No warnings for valid or unset values");
    }

    @Test
    void testMalformedIntWarnsAndFallsBack() {
        System.setProperty("FXSIGNAL_TEST_INT", "sixty");

        assertEquals(60, Env.getInt("FXSIGNAL_TEST_INT", 60));

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("FXSIGNAL_TEST_INT"), event.getFormattedMessage());
        assertTrue(event.getFormattedMessage().contains("'sixty'"), event.getFormattedMessage());
    }

    @Test
    void testMalformedDoubleAndLongWarn() {
        System.setProperty("FXSIGNAL_TEST_DOUBLE", "1,5");
        System.setProperty("FXSIGNAL_TEST_LONG", "3s");

        assertEquals(2.0, Env.getDouble("FXSIGNAL_TEST_DOUBLE", 2.0), 1e-12);
        assertEquals(5L, Env.getLong("FXSIGNAL_TEST_LONG", 5L));

        assertEquals(2, appender.list.size());
        assertTrue(appender.list.stream().allMatch(e -> e.getLevel() == Level.WARN));
        assertTrue(appender.list.get(0).getFormattedMessage().contains("'1,5'"));
        assertTrue(appender.list.get(1).getFormattedMessage().contains("FXSIGNAL_TEST_LONG"));
    }

    @Test
    void testListDropsBlanks() {
        System.setProperty("FXSIGNAL_TEST_LIST", "EUR_USD, ,GBP_JPY,");

        assertEquals(List.of("EUR_USD", "GBP_JPY"), Env.getList("FXSIGNAL_TEST_LIST", List.of()));
    }
}
