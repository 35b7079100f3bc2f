package com.sidr;

import lombok.Value;

/**
 * Settings read from JVM system properties.
 * <ul>
 *   <li>{@code sidr.verify.checksums}: verify page checksums while reading (default true);
 *   {@code false} reads databases whose checksums no longer match, such as dirty copies</li>
 *   <li>{@code sidr.fallback.hostname}: host name used in report names when the store has none
 *   (default {@code Unknown})</li>
 * </ul>
 */
@Value
public class SidrConfig {
    public static final String VERIFY_CHECKSUMS_PROPERTY = "sidr.verify.checksums";
    public static final String FALLBACK_HOSTNAME_PROPERTY = "sidr.fallback.hostname";
    public static final String DEFAULT_HOSTNAME = "Unknown";

    boolean verifyChecksums;
    String fallbackHostname;

    public static SidrConfig defaults() {
        return new SidrConfig(true, DEFAULT_HOSTNAME);
    }

    public static SidrConfig fromSystemProperties() {
        var hostname = System.getProperty(FALLBACK_HOSTNAME_PROPERTY, DEFAULT_HOSTNAME).trim();
        return new SidrConfig(Boolean.parseBoolean(System.getProperty(VERIFY_CHECKSUMS_PROPERTY, "true")),
                hostname.isEmpty() ? DEFAULT_HOSTNAME : hostname);
    }
}
