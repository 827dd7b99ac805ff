package io.github.hongjungwan.smartlog.core.internal;

import io.github.hongjungwan.smartlog.spi.CallSite;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 예외를 로그 컬럼으로 변환. 메시지는 "타입: 메시지", 트레이스는 번호 붙은 프레임 목록.
 *
 * <pre>
 * #0 OrderService.java(42): com.example.OrderService.place()
 * #1 Main.java(10): com.example.Main.main()
 * #2 {main}
 * </pre>
 */
public final class ThrowableFormatter {

    private ThrowableFormatter() {}

    public static String message(Throwable throwable) {
        String text = throwable.getMessage();
        return throwable.getClass().getName() + ": " + (text == null ? "" : text);
    }

    /** 예외가 발생한 위치 (최상위 프레임) */
    public static CallSite origin(Throwable throwable) {
        StackTraceElement[] frames = throwable.getStackTrace();
        if (frames.length == 0) {
            return CallSite.unknown();
        }
        StackTraceElement top = frames[0];
        return new CallSite(top.getFileName(), top.getLineNumber(), top.getClassName() + "." + top.getMethodName());
    }

    public static String trace(Throwable throwable) {
        StringBuilder sb = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(throwable);
        appendFrames(sb, throwable);

        Throwable cause = throwable.getCause();
        while (cause != null && seen.add(cause)) {
            sb.append('\n').append("Caused by: ").append(message(cause)).append('\n');
            appendFrames(sb, cause);
            cause = cause.getCause();
        }
        return sb.toString();
    }

    private static void appendFrames(StringBuilder sb, Throwable throwable) {
        StackTraceElement[] frames = throwable.getStackTrace();
        int index = 0;
        for (StackTraceElement frame : frames) {
            sb.append('#').append(index++).append(' ')
                    .append(frame.getFileName() == null ? "" : frame.getFileName())
                    .append('(').append(frame.getLineNumber() > 0 ? String.valueOf(frame.getLineNumber()) : "").append("): ")
                    .append(frame.getClassName()).append('.').append(frame.getMethodName()).append("()")
                    .append('\n');
        }
        sb.append('#').append(index).append(" {main}");
    }
}
