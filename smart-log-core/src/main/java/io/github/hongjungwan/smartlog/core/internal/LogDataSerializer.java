package io.github.hongjungwan.smartlog.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.smartlog.api.NoData;
import lombok.extern.slf4j.Slf4j;

/**
 * 부가 데이터 직렬화 (JSON). null은 "null"로 기록하고, NO_DATA만 빈 컬럼이 된다.
 */
@Slf4j
public class LogDataSerializer {

    private final ObjectMapper objectMapper;

    public LogDataSerializer() {
        this.objectMapper = createObjectMapper();
    }

    private ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }

    /** 데이터 없음이면 null 반환 */
    public String serialize(Object data) {
        if (data == NoData.INSTANCE) {
            return null;
        }
        if (data instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.debug("Failed to serialize log data of type {}, using toString(): {}",
                    data.getClass().getName(), e.getMessage());
            return String.valueOf(data);
        }
    }
}
