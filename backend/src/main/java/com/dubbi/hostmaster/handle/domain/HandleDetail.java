package com.dubbi.hostmaster.handle.domain;

/**
 * JPNIC 핸들(개인) 또는 그룹 핸들의 등록 정보.
 */
public record HandleDetail(
        boolean person,
        String handle,
        String name,
        String nameEn,
        String email,
        String org,
        String orgEn,
        String division,
        String divisionEn,
        String title,
        String titleEn,
        String tel,
        String fax,
        String notifyAddress,
        String updateDate
) {}
