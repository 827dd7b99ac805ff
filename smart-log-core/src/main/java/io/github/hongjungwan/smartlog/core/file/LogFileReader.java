package io.github.hongjungwan.smartlog.core.file;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.github.hongjungwan.smartlog.core.internal.LogFileManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 기록된 CSV 로그 파일 읽기. 여러 줄 필드(트레이스)도 하나의 행으로 읽는다.
 */
public class LogFileReader {

    private final ObjectReader rowReader;

    public LogFileReader() {
        CsvMapper mapper = new CsvMapper();
        this.rowReader = mapper.readerFor(String[].class).with(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    public List<LogRow> read(Path file) throws IOException {
        List<LogRow> rows = new ArrayList<>();
        if (!Files.exists(file) || Files.size(file) == 0) {
            return rows;
        }
        try (MappingIterator<String[]> iterator = rowReader.readValues(file.toFile())) {
            while (iterator.hasNextValue()) {
                rows.add(LogRow.of(iterator.nextValue()));
            }
        }
        return rows;
    }

    /** 디렉토리의 모든 로그 파일을 파일명 순으로 읽어 합친다 */
    public List<LogRow> readDirectory(Path directory) throws IOException {
        List<LogRow> rows = new ArrayList<>();
        for (Path file : listLogFiles(directory)) {
            rows.addAll(read(file));
        }
        return rows;
    }

    public static List<Path> listLogFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(path -> LogFileManager.parseDate(path.getFileName().toString()).isPresent())
                    .sorted()
                    .toList();
        }
    }
}
