package com.dubbi.hostmaster.resource.domain;

import java.util.List;

/**
 * 資源管理者情報 페이지 전체. {@code html}은 디코딩된 원본 페이지다.
 */
public record ResourceInfo(
        ResourceManagerInfo manager,
        long usedAddress,
        long allAddress,
        double utilizationRatio,
        double adRatio,
        List<CidrBlock> cidrBlocks,
        String html
) {
    public ResourceInfo {
        cidrBlocks = List.copyOf(cidrBlocks);
    }
}
