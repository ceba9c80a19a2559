package com.dubbi.hostmaster.resource.domain;

/**
 * 자원관리자에게 할당된 CIDR 블록 하나와 그 이용률.
 */
public record CidrBlock(
        String address,
        String url,
        String assignDate,
        long usedAddress,
        long allAddress,
        double utilizationRatio
) {}
