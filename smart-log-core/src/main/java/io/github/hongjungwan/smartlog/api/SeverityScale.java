package io.github.hongjungwan.smartlog.api;

import io.github.hongjungwan.smartlog.api.exception.UnknownSeverityException;

import java.util.Locale;

/**
 * 심각도 이름과 rank 간 변환. 대소문자 무시 prefix 매칭 지원 ("err" → error).
 *
 * <p>매칭은 rank 0부터 순서대로 스캔하며 처음 일치한 항목이 이긴다.
 * 따라서 "e"는 error가 아니라 emergency로, 빈 문자열은 모든 이름의 prefix이므로 emergency로 해석된다.</p>
 */
public final class SeverityScale {

    /** 로깅 비활성화 센티널. 파일 생성, 회전, 삭제까지 모두 막는다. */
    public static final int OFF = -1;

    private static final String OFF_NAME = "off";

    private SeverityScale() {}

    /** rank는 검증 후 그대로 반환 */
    public static int ordinal(int rank) {
        if (rank < OFF || rank >= Severity.count()) {
            throw new IllegalArgumentException("Severity rank out of range: " + rank);
        }
        return rank;
    }

    /** prefix 매칭으로 rank 해석. 일치 항목이 없으면 UnknownSeverityException */
    public static int ordinal(String input) {
        return severity(input).rank();
    }

    public static Severity severity(String input) {
        if (input == null) {
            throw new UnknownSeverityException("null");
        }
        String prefix = input.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : Severity.values()) {
            if (severity.label().startsWith(prefix)) {
                return severity;
            }
        }
        throw new UnknownSeverityException(input);
    }

    /** 설정용: "off"는 OFF, 나머지는 prefix 매칭 */
    public static int threshold(String input) {
        if (input != null && OFF_NAME.equals(input.trim().toLowerCase(Locale.ROOT))) {
            return OFF;
        }
        return ordinal(input);
    }

    /** rank의 고정 이름. OFF 포함 범위 밖 입력은 실패 */
    public static String label(int rank) {
        return Severity.fromRank(rank).label();
    }

    public static boolean isOff(int threshold) {
        return threshold == OFF;
    }
}
