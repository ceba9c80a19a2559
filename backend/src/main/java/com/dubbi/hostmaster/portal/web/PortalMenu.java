package com.dubbi.hostmaster.portal.web;

/**
 * 포털 상단 메뉴의 표시 문자열. 포털 화면과 정확히 일치해야 한다.
 */
public enum PortalMenu {
    IPV4_SEARCH("登録情報検索(IPv4)"),
    IPV6_SEARCH("登録情報検索(IPv6)"),
    HANDLE_SEARCH("担当グループ・JPNICハンドル検索／変換"),
    CONTACT_CHANGE("担当グループ（担当者）情報登録・変更"),
    REQUEST_LIST("申請一覧"),
    RESOURCE_MANAGER("資源管理者情報");

    private final String label;

    PortalMenu(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
