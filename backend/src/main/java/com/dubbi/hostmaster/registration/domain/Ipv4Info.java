package com.dubbi.hostmaster.registration.domain;

/**
 * One row of the IPv4 registration listing. {@code detail} is only filled when the search asked for it.
 */
public record Ipv4Info(
        String ipAddress,
        String detailLink,
        String size,
        String networkName,
        String assignDate,
        String returnDate,
        String orgName,
        String resourceAdminShortName,
        String recepNo,
        String deliNo,
        String type,
        String kindId,
        RegistrationDetail detail
) {
    public Ipv4Info withDetail(RegistrationDetail detail) {
        return new Ipv4Info(ipAddress, detailLink, size, networkName, assignDate, returnDate, orgName,
                resourceAdminShortName, recepNo, deliNo, type, kindId, detail);
    }
}
