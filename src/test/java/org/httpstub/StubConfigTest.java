package org.httpstub;

import org.httpstub.config.StubConfig;
import org.httpstub.util.RandomPortSelector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StubConfigTest {

    private static final String[] KEYS = {
            "httpstub.host", "httpstub.minPort", "httpstub.maxPort",
            "httpstub.bindAttempts", "httpstub.readTimeoutMs", "httpstub.shutdownTimeoutMs"
    };

    @AfterEach
    void clearProperties() {
        for (String k : KEYS) System.clearProperty(k);
    }

    @Test
    void defaultsMatchEphemeralRange() {
        StubConfig c = StubConfig.defaults();
        assertEquals("localhost", c.host());
        assertEquals(49152, c.minPort());
        assertEquals(65534, c.maxPort());
        assertEquals(5, c.maxBindAttempts());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("httpstub.host", "127.0.0.1");
        System.setProperty("httpstub.minPort", "50000");
        System.setProperty("httpstub.maxPort", "50010");
        System.setProperty("httpstub.bindAttempts", "3");
        System.setProperty("httpstub.readTimeoutMs", "250");

        StubConfig c = StubConfig.fromSystemProperties();
        assertEquals("127.0.0.1", c.host());
        assertEquals(50000, c.minPort());
        assertEquals(50010, c.maxPort());
        assertEquals(3, c.maxBindAttempts());
        assertEquals(250, c.readTimeoutMs());
        assertEquals(StubConfig.DEFAULT_SHUTDOWN_TIMEOUT_MS, c.shutdownTimeoutMs());
    }

    @Test
    void unparseableNumbersFallBackToDefaults() {
        System.setProperty("httpstub.bindAttempts", "many");
        assertEquals(StubConfig.defaults(), StubConfig.fromSystemProperties());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> StubConfig.defaults().withPortRange(60000, 50000));
        assertThrows(IllegalArgumentException.class, () -> StubConfig.defaults().withPortRange(0, 10));
        assertThrows(IllegalArgumentException.class, () -> StubConfig.defaults().withPortRange(1, 70000));
        assertThrows(IllegalArgumentException.class, () -> StubConfig.defaults().withMaxBindAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> StubConfig.defaults().withReadTimeoutMs(-1));
        assertThrows(IllegalArgumentException.class,
                () -> new StubConfig(" ", 1, 2, 1, 0, 0L));
    }

    @Test
    void randomSelectorStaysInRange() {
        RandomPortSelector selector = new RandomPortSelector();
        for (int i = 0; i < 1_000; i++) {
            int p = selector.nextPort(49152, 65534);
            assertTrue(p >= 49152 && p <= 65534, "port " + p);
        }
        assertEquals(50000, selector.nextPort(50000, 50000));
        assertThrows(IllegalArgumentException.class, () -> selector.nextPort(2, 1));
    }
}
