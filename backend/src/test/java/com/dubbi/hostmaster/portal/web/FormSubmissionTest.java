package com.dubbi.hostmaster.portal.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;

class FormSubmissionTest {

    @Test
    void rendersFieldsInOrderWithoutEscaping() {
        String body = FormSubmission.create()
                .add("destdisp", "D104")
                .add("ipaddr", "")
                .add("resceAdmSnm", "例ネット")
                .add("action", "%81%40%8C%9F%8D%F5%81%40")
                .render();
        assertEquals("destdisp=D104&ipaddr=&resceAdmSnm=例ネット&action=%81%40%8C%9F%8D%F5%81%40", body);
    }

    @Test
    void nullValueIsEmptyAndFlagsRenderAsOn() {
        String body = FormSubmission.create().add("a", null).flag("b", true).flag("c", false).render();
        assertEquals("a=&b=on&c=", body);
    }

    @Test
    void toStringHidesValues() {
        String text = FormSubmission.create().add("email", "taro@example.jp").toString();
        assertFalse(text.contains("taro"), text);
    }
}
