package com.dubbi.hostmaster.request.domain;

/**
 * 申請一覧의 한 행.
 */
public record RequestInfo(
        String recepNo,
        String deliNo,
        String applyKind,
        String applyClass,
        String applicant,
        String applyDate,
        String completeDate,
        String status
) {}
