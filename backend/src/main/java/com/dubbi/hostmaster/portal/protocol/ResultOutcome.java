package com.dubbi.hostmaster.portal.protocol;

import com.dubbi.hostmaster.portal.error.ApplicationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoded reply of a transactional endpoint.
 * {@code overallCode "00"} always means {@code topLevelError == null}.
 */
public record ResultOutcome(
        String recepNo,
        String adminHandle,
        String tech1Handle,
        String tech2Handle,
        String overallCode,
        String topLevelError,
        List<RetCodeError> interfaceErrors
) {
    public static final String OK = "00";

    public ResultOutcome {
        interfaceErrors = List.copyOf(interfaceErrors);
    }

    public boolean isSuccess() {
        return topLevelError == null && interfaceErrors.isEmpty();
    }

    public List<String> messages() {
        List<String> out = new ArrayList<>();
        if (topLevelError != null) out.add(topLevelError);
        interfaceErrors.forEach(e -> out.add(e.message()));
        return out;
    }

    public ResultOutcome orThrow() {
        if (!isSuccess()) throw new ApplicationException(messages());
        return this;
    }
}
