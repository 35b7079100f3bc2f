package com.sidr;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SidrConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SidrConfig.VERIFY_CHECKSUMS_PROPERTY);
        System.clearProperty(SidrConfig.FALLBACK_HOSTNAME_PROPERTY);
    }

    @Test
    void defaults() {
        var config = SidrConfig.fromSystemProperties();

        assertTrue(config.isVerifyChecksums());
        assertEquals(SidrConfig.DEFAULT_HOSTNAME, config.getFallbackHostname());
        assertEquals(SidrConfig.defaults(), config);
    }

    @Test
    void overrides() {
        System.setProperty(SidrConfig.VERIFY_CHECKSUMS_PROPERTY, "false");
        System.setProperty(SidrConfig.FALLBACK_HOSTNAME_PROPERTY, " CASE-17 ");

        var config = SidrConfig.fromSystemProperties();

        assertFalse(config.isVerifyChecksums());
        assertEquals("CASE-17", config.getFallbackHostname());
    }

    @Test
    void blankHostnameFallsBack() {
        System.setProperty(SidrConfig.FALLBACK_HOSTNAME_PROPERTY, "   ");

        assertEquals(SidrConfig.DEFAULT_HOSTNAME, SidrConfig.fromSystemProperties().getFallbackHostname());
    }
}
