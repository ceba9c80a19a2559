package com.dubbi.hostmaster.portal.web;

import com.dubbi.hostmaster.portal.error.StructuralException;
import java.util.Map;

/**
 * Hidden control fields of one portal form plus its absolute submit URL.
 */
public record FormTokens(
        String actionUrl,
        Map<String, String> hidden,
        Map<String, String> controls,
        String firstInputValue
) {
    public static final String STRUTS_TOKEN = "org.apache.struts.taglib.html.TOKEN";
    public static final String DEST_DISP = "destdisp";
    public static final String APLY_ID = "aplyid";
    public static final String PREV_DISP_ID = "prevDispId";

    public String token() {
        return value(STRUTS_TOKEN);
    }

    public String destDisp() {
        return value(DEST_DISP);
    }

    public String aplyId() {
        return value(APLY_ID);
    }

    public String prevDispId() {
        return value(PREV_DISP_ID);
    }

    /**
     * Hidden value, or empty when the form does not carry it.
     */
    public String value(String name) {
        return hidden.getOrDefault(name, "");
    }

    /**
     * Value pre-filled by the portal in any named control of the form.
     */
    public String prefilled(String name) {
        String v = controls.get(name);
        if (v == null) {
            throw new StructuralException("form " + actionUrl + " has no pre-filled '" + name + "' field");
        }
        return v;
    }

    /**
     * Dispatch id of search forms: the {@code destdisp} hidden field, falling back to the first input's value.
     */
    public String dispatchId() {
        String dest = hidden.get(DEST_DISP);
        if (dest != null) return dest;
        if (firstInputValue == null) {
            throw new StructuralException("form " + actionUrl + " carries no dispatch id");
        }
        return firstInputValue;
    }
}
