package com.dubbi.hostmaster.handle.domain;

/**
 * 担当グループ（担当者）情報登録・変更 신청 내용.
 * {@code handle}이 비어 있으면 신규 등록, 있으면 해당 핸들의 변경이다.
 */
public record ContactChange(
        boolean person,
        String handle,
        String name,
        String nameEn,
        String email,
        String org,
        String orgEn,
        String zipCode,
        String address,
        String addressEn,
        String division,
        String divisionEn,
        String title,
        String titleEn,
        String tel,
        String fax,
        String notifyMail,
        String applyMail
) {
    public String kind() {
        return person ? "person" : "group";
    }
}
