package com.dubbi.hostmaster.portal.protocol;

/**
 * One non-zero {@code RET_CODE} entry. Segments that were zero are empty strings.
 */
public record RetCodeError(String rawCode, String interfaceCode, String genreCode, String message) {}
