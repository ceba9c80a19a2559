package com.dubbi.hostmaster.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Portal status code texts, {@code portal.error.codes.<n>=<text>}.
 */
@ConfigurationProperties(prefix = "portal.error")
public record ErrorCodeProperties(Map<Integer, String> codes) {
    public ErrorCodeProperties {
        codes = codes == null ? Map.of() : Map.copyOf(codes);
    }
}
