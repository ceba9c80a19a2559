package com.dubbi.hostmaster.portal.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * 트랜잭션 응답의 줄 단위 제어 프로토콜 파서.
 * {@code RET=}, {@code RET_CODE=}(반복 가능), {@code RECEP_NO=}, 핸들 필드를 각각 독립적으로 읽는다.
 *
 * RET_CODE 값은 8자리 복합 코드다: 4~6번째 자리는 인터페이스 오류 코드, 7번째 자리부터는 오류 장르 코드.
 */
public class ResultLineParser {
    static final String RET = "RET=";
    static final String RET_CODE = "RET_CODE=";
    static final String RECEP_NO = "RECEP_NO=";
    static final String ADMIN_HANDLE = "ADM_JPNIC_HDL=";
    static final String TECH1_HANDLE = "TECH1_JPNIC_HDL=";
    static final String TECH2_HANDLE = "TECH2_JPNIC_HDL=";

    private static final int COMPOSITE_LENGTH = 8;

    private final ErrorClassifier classifier;

    public ResultLineParser(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    public ResultOutcome parse(List<String> lines) {
        String ret = ResultOutcome.OK;
        String recepNo = "";
        String admin = "";
        String tech1 = "";
        String tech2 = "";
        List<String> retCodes = new ArrayList<>();

        for (String raw : lines) {
            String line = stripCr(raw);
            if (line.startsWith(RET)) ret = line.substring(RET.length());
            if (line.startsWith(RET_CODE)) retCodes.add(line.substring(RET_CODE.length()));
            if (line.startsWith(RECEP_NO)) recepNo = line.substring(RECEP_NO.length());
            if (line.startsWith(ADMIN_HANDLE)) admin = line.substring(ADMIN_HANDLE.length());
            if (line.startsWith(TECH1_HANDLE)) tech1 = line.substring(TECH1_HANDLE.length());
            if (line.startsWith(TECH2_HANDLE)) tech2 = line.substring(TECH2_HANDLE.length());
        }

        String topLevel = ResultOutcome.OK.equals(ret) ? null : classifier.describe(ret);

        List<RetCodeError> errors = new ArrayList<>();
        for (String code : retCodes) {
            RetCodeError error = decode(code);
            if (error != null) errors.add(error);
        }
        return new ResultOutcome(recepNo, admin, tech1, tech2, ret, topLevel, errors);
    }

    /**
     * Decodes one composite code; null when both segments are zero.
     */
    RetCodeError decode(String code) {
        if (code.length() < COMPOSITE_LENGTH) {
            return new RetCodeError(code, "", "", "malformed RET_CODE '" + code + "'");
        }
        String iface = code.substring(4, 7);
        String genre = code.substring(7);
        StringBuilder message = new StringBuilder();
        String ifaceCode = "";
        String genreCode = "";
        if (!"000".equals(iface)) {
            ifaceCode = iface;
            message.append(classifier.describe(iface));
        }
        if (!"0".equals(genre)) {
            genreCode = genre;
            message.append('_').append(classifier.classify(genre));
        }
        if (message.length() == 0) return null;
        return new RetCodeError(code, ifaceCode, genreCode, message.toString());
    }

    private static String stripCr(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
