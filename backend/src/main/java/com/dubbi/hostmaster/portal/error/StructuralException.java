package com.dubbi.hostmaster.portal.error;

/**
 * An expected menu, form or table element is missing from a portal page.
 * Usually means the portal layout changed or the session is no longer logged in.
 */
public class StructuralException extends PortalException {
    public StructuralException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "STRUCTURE";
    }
}
