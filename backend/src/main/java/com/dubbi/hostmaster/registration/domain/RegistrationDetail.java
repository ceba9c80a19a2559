package com.dubbi.hostmaster.registration.domain;

/**
 * Detail page of one registered network. Contact handles carry the link to their own detail page.
 */
public record RegistrationDetail(
        String ipAddress,
        String resourceAdminShortName,
        String addressType,
        String infraUserKind,
        String networkName,
        String org,
        String orgEn,
        String postCode,
        String address,
        String addressEn,
        String adminHandle,
        String adminHandleLink,
        String techHandle,
        String techHandleLink,
        String nameServer,
        String dsRecord,
        String notifyAddress,
        String deliNo,
        String recepNo,
        String assignDate,
        String returnDate,
        String updateDate
) {}
