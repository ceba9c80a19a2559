package com.dubbi.hostmaster.handle.api.dto;

import static com.dubbi.hostmaster.common.dto.FormConstraints.FORM_SAFE;
import static com.dubbi.hostmaster.common.dto.FormConstraints.FORM_SAFE_MESSAGE;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public final class HandleDtos {
    private HandleDtos() {}

    public record ContactChangeRequest(
            boolean person,
            @Pattern(regexp = "[A-Za-z0-9-]*", message = "must be a portal handle") String handle,
            @NotBlank @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String name,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String nameEn,
            @Email @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String email,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String org,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String orgEn,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String zipCode,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String address,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String addressEn,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String division,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String divisionEn,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String title,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String titleEn,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String tel,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String fax,
            @Email @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String notifyMail,
            @NotBlank @Email @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String applyMail
    ) {}

    public record ContactChangeResponse(boolean ok, String recepNo) {}
}
