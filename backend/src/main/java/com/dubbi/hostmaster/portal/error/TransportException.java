package com.dubbi.hostmaster.portal.error;

/**
 * Network, TLS or HTTP status failure talking to the portal.
 */
public class TransportException extends PortalException {
    private final Integer status;

    public TransportException(String message) {
        this(message, null, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TransportException(String message, Integer status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP status returned by the portal, or null when the request never got a response.
     */
    public Integer getStatus() {
        return status;
    }

    @Override
    public String kind() {
        return "TRANSPORT";
    }
}
