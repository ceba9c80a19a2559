package com.dubbi.hostmaster.portal.protocol;

import java.util.Map;

/**
 * Lookup backed by the {@code portal.error.codes} configuration map.
 */
public class ConfiguredErrorStatusText implements ErrorStatusText {
    private final Map<Integer, String> texts;

    public ConfiguredErrorStatusText(Map<Integer, String> texts) {
        this.texts = Map.copyOf(texts);
    }

    @Override
    public String text(int code) {
        String text = texts.get(code);
        return text != null ? text : "unknown status code " + code;
    }
}
