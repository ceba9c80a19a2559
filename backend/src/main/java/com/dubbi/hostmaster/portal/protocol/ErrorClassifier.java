package com.dubbi.hostmaster.portal.protocol;

/**
 * Turns raw numeric code segments into messages through the injected {@link ErrorStatusText}.
 */
public class ErrorClassifier {
    private final ErrorStatusText statusText;

    public ErrorClassifier(ErrorStatusText statusText) {
        this.statusText = statusText;
    }

    /**
     * Classified text of a numeric segment such as {@code "012"} or {@code "4"}.
     */
    public String classify(String rawCode) {
        String trimmed = rawCode.trim();
        try {
            return statusText.text(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            return "unrecognised status code '" + trimmed + "'";
        }
    }

    /**
     * {@code "<code>: <text>"}, the form used for top-level and interface errors.
     */
    public String describe(String rawCode) {
        return rawCode + ": " + classify(rawCode);
    }
}
