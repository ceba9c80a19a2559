package com.dubbi.hostmaster.portal.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ErrorClassifierTest {
    private final ErrorClassifier classifier = new ErrorClassifier(new ConfiguredErrorStatusText(Map.of(12, "handle not found")));

    @Test
    void leadingZerosDoNotMatter() {
        assertEquals("handle not found", classifier.classify("012"));
        assertEquals("012: handle not found", classifier.describe("012"));
    }

    @Test
    void nonNumericCodeIsDescribedNotThrown() {
        assertEquals("unrecognised status code 'A1'", classifier.classify("A1"));
    }
}
