package com.dubbi.hostmaster.common.dto;

/**
 * Request values are written into portal form bodies verbatim, so separators are rejected up front.
 */
public final class FormConstraints {
    private FormConstraints() {}

    public static final String FORM_SAFE = "[^&=\\r\\n]*";
    public static final String FORM_SAFE_MESSAGE = "must not contain '&', '=' or line breaks";
}
