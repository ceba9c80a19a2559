package com.dubbi.hostmaster.portal.error;

/**
 * Text could not be converted to or from the portal's legacy charset without loss.
 */
public class EncodingException extends PortalException {
    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "ENCODING";
    }
}
