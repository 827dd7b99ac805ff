package io.github.hongjungwan.smartlog.api;

import java.util.Locale;

/**
 * RFC 5424 기반 심각도. rank 0이 가장 심각, 7이 가장 상세.
 */
public enum Severity {

    /** 시스템 전체 장애 */
    EMERGENCY,
    /** 주 시스템 장애, 즉시 조치 필요 */
    ALERT,
    /** 보조 시스템 장애 */
    CRITICAL,
    /** 긴급하지 않은 실패 */
    ERROR,
    /** 조치하지 않으면 실패로 이어질 상황 */
    WARNING,
    /** 평소와 다른 이벤트 */
    NOTICE,
    /** 정상 동작 이벤트 */
    INFORMATIONAL,
    /** 개발자용 상세 메시지 */
    DEBUG;

    private static final Severity[] BY_RANK = values();

    public int rank() {
        return ordinal();
    }

    /** 소문자 이름 (prefix 매칭 테이블의 키) */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** CSV에 기록되는 대문자 이름 */
    public String upperLabel() {
        return name();
    }

    /** rank가 threshold 이하(같거나 더 심각)인지 */
    public boolean isAtLeastAsSevereAs(int thresholdRank) {
        return rank() <= thresholdRank;
    }

    public static Severity fromRank(int rank) {
        if (rank < 0 || rank >= BY_RANK.length) {
            throw new IllegalArgumentException("Severity rank out of range: " + rank);
        }
        return BY_RANK[rank];
    }

    public static int count() {
        return BY_RANK.length;
    }
}
