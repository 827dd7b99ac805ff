package io.github.hongjungwan.smartlog.spi;

/**
 * 로그 호출 위치. file/function은 null 가능, line은 알 수 없으면 0 이하.
 */
public record CallSite(String file, int line, String function) {

    private static final CallSite UNKNOWN = new CallSite(null, 0, null);

    public static CallSite unknown() {
        return UNKNOWN;
    }

    public static CallSite of(String file, int line) {
        return new CallSite(file, line, null);
    }

    /** CSV location 컬럼 형식: {@code file(line)} */
    public String toLocation() {
        return (file == null ? "" : file) + "(" + (line > 0 ? String.valueOf(line) : "") + ")";
    }
}
