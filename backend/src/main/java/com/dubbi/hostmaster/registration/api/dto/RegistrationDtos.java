package com.dubbi.hostmaster.registration.api.dto;

import static com.dubbi.hostmaster.common.dto.FormConstraints.FORM_SAFE;
import static com.dubbi.hostmaster.common.dto.FormConstraints.FORM_SAFE_MESSAGE;

import jakarta.validation.constraints.Pattern;
import java.util.List;

public final class RegistrationDtos {
    private RegistrationDtos() {}

    public record Ipv4SearchRequest(
            boolean myself,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String ipAddress,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String sizeStart,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String sizeEnd,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String networkName,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String regDateStart,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String regDateEnd,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String returnDateStart,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String returnDateEnd,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String orgName,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String resourceAdminShortName,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String recepNo,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String deliNo,
            boolean pa,
            boolean allocate,
            boolean assignInfra,
            boolean assignUser,
            boolean subAllocate,
            boolean historicalPi,
            boolean specialPi,
            boolean detail,
            List<String> knownHandles
    ) {}

    public record Ipv6SearchRequest(
            boolean myself,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String ipAddress,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String sizeStart,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String sizeEnd,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String networkName,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String regDateStart,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String regDateEnd,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String returnDateStart,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String returnDateEnd,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String orgName,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String resourceAdminShortName,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String recepNo,
            @Pattern(regexp = FORM_SAFE, message = FORM_SAFE_MESSAGE) String deliNo,
            boolean allocate,
            boolean assignInfra,
            boolean assignUser,
            boolean subAllocate,
            boolean detail,
            List<String> knownHandles
    ) {}
}
