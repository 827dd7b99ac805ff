package io.github.hongjungwan.smartlog.core.file;

/**
 * 로그 파일에서 읽은 CSV 한 행. 빈 컬럼은 빈 문자열.
 */
public record LogRow(String timestamp, String severity, String message, String location, String trace, String data) {

    public boolean hasTrace() {
        return !trace.isEmpty();
    }

    public boolean hasData() {
        return !data.isEmpty();
    }

    static LogRow of(String[] columns) {
        return new LogRow(
                column(columns, 0),
                column(columns, 1),
                column(columns, 2),
                column(columns, 3),
                column(columns, 4),
                column(columns, 5));
    }

    private static String column(String[] columns, int index) {
        return index < columns.length && columns[index] != null ? columns[index] : "";
    }
}
