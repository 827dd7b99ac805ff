package io.github.hongjungwan.smartlog.core.internal;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.github.hongjungwan.smartlog.api.domain.LogRecord;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * LogRecord → CSV 행 직렬화. 구분자/따옴표/개행이 있는 필드만 따옴표로 감싼다.
 */
public class CsvLogWriter {

    private final ObjectWriter rowWriter;

    public CsvLogWriter() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
        CsvSchema schema = mapper.schemaFor(CsvRow.class).withoutHeader();
        this.rowWriter = mapper.writer(schema);
    }

    public String toCsv(LogRecord record) {
        try {
            return rowWriter.writeValueAsString(CsvRow.of(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to format log record #" + record.getSequence(), e);
        }
    }

    /** 레코드 묶음을 한 번의 append로 쓸 수 있는 바이트 배열로 변환 */
    public byte[] toCsv(List<LogRecord> records) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(records.size() * 128);
        for (LogRecord record : records) {
            rowWriter.writeValue(out, CsvRow.of(record));
        }
        return out.toByteArray();
    }

    @JsonPropertyOrder({"timestamp", "severity", "message", "location", "trace", "data"})
    record CsvRow(String timestamp, String severity, String message, String location, String trace, String data) {

        static CsvRow of(LogRecord record) {
            return new CsvRow(
                    record.getTimestamp(),
                    record.getSeverity().upperLabel(),
                    record.getMessage(),
                    record.getLocation(),
                    record.getTrace(),
                    record.getData());
        }
    }
}
