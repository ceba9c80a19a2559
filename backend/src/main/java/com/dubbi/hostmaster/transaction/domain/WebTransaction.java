package com.dubbi.hostmaster.transaction.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 트랜잭션 엔드포인트로 보내는 신청 본문. 필드 순서가 그대로 줄 순서가 된다.
 */
public final class WebTransaction {
    private final Map<String, String> fields;

    private WebTransaction(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static WebTransaction of(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("transaction has no fields");
        }
        for (Map.Entry<String, String> e : fields.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isBlank() || key.indexOf('=') >= 0 || hasLineBreak(key)) {
                throw new IllegalArgumentException("invalid transaction key '" + key + "'");
            }
            if (e.getValue() != null && hasLineBreak(e.getValue())) {
                throw new IllegalArgumentException("value of " + key + " contains a line break");
            }
        }
        return new WebTransaction(fields);
    }

    public Map<String, String> fields() {
        return fields;
    }

    public String marshal() {
        List<String> lines = new ArrayList<>(fields.size());
        fields.forEach((k, v) -> lines.add(k + "=" + (v == null ? "" : v)));
        return String.join("\n", lines);
    }

    private static boolean hasLineBreak(String s) {
        return s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0;
    }

    @Override
    public String toString() {
        return "WebTransaction" + fields.keySet();
    }
}
