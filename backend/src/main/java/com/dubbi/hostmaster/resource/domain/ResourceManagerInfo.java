package com.dubbi.hostmaster.resource.domain;

public record ResourceManagerInfo(
        String resourceManagerNo,
        String shortName,
        String org,
        String orgEn,
        String zipCode,
        String address,
        String addressEn,
        String tel,
        String fax,
        String resourceManagementManager,
        String contactPerson,
        String inquiry,
        String notifyMail,
        String assignmentWindowSize,
        String managementStartDate,
        String managementEndDate,
        String updateDate
) {}
