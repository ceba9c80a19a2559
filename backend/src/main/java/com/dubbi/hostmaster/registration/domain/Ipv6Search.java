package com.dubbi.hostmaster.registration.domain;

import java.util.List;

/**
 * IPv6 登録情報検索 조건. IPv4와 달리 PA/PI 구분 플래그가 없다.
 */
public record Ipv6Search(
        boolean myself,
        String ipAddress,
        String sizeStart,
        String sizeEnd,
        String networkName,
        String regDateStart,
        String regDateEnd,
        String returnDateStart,
        String returnDateEnd,
        String orgName,
        String resourceAdminShortName,
        String recepNo,
        String deliNo,
        boolean allocate,
        boolean assignInfra,
        boolean assignUser,
        boolean subAllocate,
        boolean detail,
        List<String> knownHandles
) {
    public Ipv6Search {
        knownHandles = knownHandles == null ? List.of() : List.copyOf(knownHandles);
    }

    public static Ipv6Search mine(boolean detail) {
        return new Ipv6Search(true, null, null, null, null, null, null, null, null, null, null, null, null,
                false, false, false, false, detail, List.of());
    }
}
