package io.organise.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrganiseConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("organise.validation.logLimit");
        System.clearProperty("organise.http.attempts");
    }

    @Test
    void defaultsWhenNothingIsSet() {
        OrganiseConfig config = OrganiseConfig.from(Map.of());
        assertEquals(OrganiseConfig.defaults(), config);
        assertEquals(25, config.validationLogLimit());
    }

    @Test
    void environmentIsUsedWhenNoPropertyIsSet() {
        OrganiseConfig config = OrganiseConfig.from(Map.of("ORGANISE_VALIDATION_LOG_LIMIT", "5", "ORGANISE_HTTP_ATTEMPTS", "1"));
        assertEquals(5, config.validationLogLimit());
        assertEquals(1, config.httpAttempts());
    }

    @Test
    void systemPropertyWinsOverEnvironment() {
        System.setProperty("organise.validation.logLimit", "7");
        OrganiseConfig config = OrganiseConfig.from(Map.of("ORGANISE_VALIDATION_LOG_LIMIT", "5"));
        assertEquals(7, config.validationLogLimit());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new OrganiseConfig(-1, 30, 3, 250));
        assertThrows(IllegalArgumentException.class, () -> OrganiseConfig.from(Map.of("ORGANISE_HTTP_ATTEMPTS", "0")));
        assertThrows(NumberFormatException.class, () -> OrganiseConfig.from(Map.of("ORGANISE_HTTP_ATTEMPTS", "many")));
    }
}
