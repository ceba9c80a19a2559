package com.dubbi.hostmaster.registration.domain;

import java.util.List;

/**
 * IPv4 登録情報検索 조건.
 * {@code myself}가 켜지면 포털이 미리 채워 둔 자기 자원관리자 약칭으로 검색한다.
 * {@code knownHandles}는 이미 알고 있는 핸들로, 상세 순회 시 다시 가져오지 않는다.
 */
public record Ipv4Search(
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
        boolean pa,
        boolean allocate,
        boolean assignInfra,
        boolean assignUser,
        boolean subAllocate,
        boolean historicalPi,
        boolean specialPi,
        boolean detail,
        List<String> knownHandles
) {
    public Ipv4Search {
        knownHandles = knownHandles == null ? List.of() : List.copyOf(knownHandles);
    }

    public static Ipv4Search mine(boolean detail) {
        return new Ipv4Search(true, null, null, null, null, null, null, null, null, null, null, null, null,
                false, false, false, false, false, false, false, detail, List.of());
    }
}
