package com.dubbi.hostmaster.registration.service;

import com.dubbi.hostmaster.portal.web.DetailSchema;
import com.dubbi.hostmaster.portal.web.RecordSchema;

/**
 * Listing and detail layouts of the registration search pages.
 */
final class RegistrationSchemas {
    static final String DATA_ROW_CLASS = "dataRow_mnt04";

    static final RecordSchema IPV4_LISTING = RecordSchema.builder("ipv4-listing")
            .rowClass(DATA_ROW_CLASS)
            .textWithLink("ipAddress")
            .text("size")
            .text("networkName")
            .text("assignDate")
            .text("returnDate")
            .text("orgName")
            .text("resourceAdminShortName")
            .text("recepNo")
            .text("deliNo")
            .text("type")
            .text("kindId")
            .build();

    static final RecordSchema IPV6_LISTING = RecordSchema.builder("ipv6-listing")
            .rowClass(DATA_ROW_CLASS)
            .textWithLink("ipAddress")
            .text("networkName")
            .text("assignDate")
            .text("returnDate")
            .text("orgName")
            .text("resourceAdminShortName")
            .text("recepNo")
            .text("deliNo")
            .text("kindId")
            .build();

    static final DetailSchema DETAIL = DetailSchema.builder("registration-detail", 4)
            .text("ipAddress", "IPネットワークアドレス")
            .text("resourceAdminShortName", "資源管理者略称")
            .text("addressType", "アドレス種別")
            .text("infraUserKind", "インフラ・ユーザ区分")
            .text("networkName", "ネットワーク名")
            .text("org", "組織名")
            .text("orgEn", "Organization")
            .text("postCode", "郵便番号")
            .text("address", "住所")
            .text("addressEn", "Address")
            .textWithLink("adminHandle", "管理者連絡窓口")
            .textWithLink("techHandle", "技術連絡担当者")
            .text("nameServer", "ネームサーバ")
            .text("dsRecord", "DSレコード")
            .text("notifyAddress", "通知アドレス")
            .text("deliNo", "審議番号")
            .text("recepNo", "受付番号")
            .text("assignDate", "割当年月日")
            .text("returnDate", "返却年月日")
            .text("updateDate", "最終更新")
            .build();

    private RegistrationSchemas() {}
}
