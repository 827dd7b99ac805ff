package io.github.hongjungwan.smartlog.api;

/**
 * "데이터 없음" 센티널. null은 기록해야 하는 유효한 값이므로 구분한다.
 */
public enum NoData {
    INSTANCE;

    @Override
    public String toString() {
        return "SmartLogger.NO_DATA";
    }
}
