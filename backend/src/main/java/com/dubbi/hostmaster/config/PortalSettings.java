package com.dubbi.hostmaster.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable portal connection settings bound from {@code portal.*}.
 */
public record PortalSettings(
        String baseUrl,
        String menuPath,
        String transactionPath,
        Path pfxPath,
        String pfxPassword,
        Path caPath,
        String userAgent,
        String charset,
        Duration requestInterval,
        Duration timeout,
        Duration workflowTimeout
) {
    @Override
    public String toString() {
        return "PortalSettings[baseUrl=" + baseUrl + ", menuPath=" + menuPath + ", pfxPath=" + pfxPath
                + ", caPath=" + caPath + ", charset=" + charset + ", requestInterval=" + requestInterval + "]";
    }
}
