package com.dubbi.hostmaster.portal.error;

/**
 * Client certificate bundle or CA material could not be loaded. Fatal.
 */
public class CredentialException extends PortalException {
    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "CREDENTIAL";
    }
}
