package io.github.hongjungwan.smartlog.api.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 사전 쓰기 권한 검사 실패. 이미 존재하는 로그/잠금 파일에 쓸 수 없는 경우.
 */
@Getter
public class LogPermissionException extends ConstructionException {

    private final transient Path path;

    public LogPermissionException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }
}
