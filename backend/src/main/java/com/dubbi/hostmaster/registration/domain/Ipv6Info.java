package com.dubbi.hostmaster.registration.domain;

public record Ipv6Info(
        String ipAddress,
        String detailLink,
        String networkName,
        String assignDate,
        String returnDate,
        String orgName,
        String resourceAdminShortName,
        String recepNo,
        String deliNo,
        String kindId,
        RegistrationDetail detail
) {
    public Ipv6Info withDetail(RegistrationDetail detail) {
        return new Ipv6Info(ipAddress, detailLink, networkName, assignDate, returnDate, orgName,
                resourceAdminShortName, recepNo, deliNo, kindId, detail);
    }
}
