package io.github.hongjungwan.smartlog.api.domain;

import io.github.hongjungwan.smartlog.api.Severity;
import lombok.Builder;
import lombok.Getter;

/**
 * 대기 중인 로그 한 건. 생성 후 불변.
 *
 * <p>sequence는 로거 인스턴스 내에서 단조 증가하며, 타임스탬프 정밀도가 겹칠 수 있으므로
 * flush 시 정렬 키로 쓰인다.</p>
 */
@Getter
@Builder
public class LogRecord {

    /** 로거 내 순번 */
    private final long sequence;

    /** dateFormat으로 포맷된 시각 */
    private final String timestamp;

    private final Severity severity;

    /** 호출한 함수 (선택) */
    private final String context;

    /** 메시지 또는 "예외타입: 메시지" */
    private final String message;

    /** 예외 스택 트레이스 (선택) */
    private final String trace;

    /** 직렬화된 부가 데이터. 데이터가 없으면 null */
    private final String data;

    /** {@code file(line)} */
    private final String location;
}
