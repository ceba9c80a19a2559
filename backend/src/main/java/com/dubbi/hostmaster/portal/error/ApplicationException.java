package com.dubbi.hostmaster.portal.error;

import java.util.List;

/**
 * Business-level rejection reported by the portal, either as decoded result codes
 * or as the highlighted error text of a confirmation page.
 */
public class ApplicationException extends PortalException {
    private final List<String> messages;

    public ApplicationException(String message) {
        this(List.of(message));
    }

    public ApplicationException(List<String> messages) {
        super(String.join("; ", messages));
        this.messages = List.copyOf(messages);
    }

    public List<String> getMessages() {
        return messages;
    }

    @Override
    public String kind() {
        return "APPLICATION";
    }
}
