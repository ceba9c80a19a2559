package com.dubbi.hostmaster.portal.error;

/**
 * The caller-supplied deadline expired at a request or at a rate-limit wait.
 */
public class PortalTimeoutException extends TransportException {
    public PortalTimeoutException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "TIMEOUT";
    }
}
