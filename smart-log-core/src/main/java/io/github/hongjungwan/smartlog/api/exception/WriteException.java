package io.github.hongjungwan.smartlog.api.exception;

import lombok.Getter;

/**
 * flush 중 로그 파일 쓰기 실패. 잠금 해제 후 전파되며, 해당 배치는 재시도하지 않는다.
 */
@Getter
public class WriteException extends SmartLogException {

    /** 유실된 레코드 수 */
    private final int lostRecords;

    public WriteException(String message, int lostRecords, Throwable cause) {
        super(message, cause);
        this.lostRecords = lostRecords;
    }
}
