package io.github.hongjungwan.smartlog.core.internal;

import io.github.hongjungwan.smartlog.spi.CallSite;
import io.github.hongjungwan.smartlog.spi.CallSiteResolver;

import java.util.Collection;
import java.util.List;

/**
 * StackWalker 기반 호출 위치 해석. 건너뛸 프레임 목록에 해당하지 않는 첫 프레임을 사용.
 *
 * <p>목록 항목이 '.'으로 끝나면 패키지 접두사, 아니면 클래스 이름(중첩 클래스 포함)으로 매칭한다.
 * 로거를 자체 파사드로 감싸는 호스트는 파사드 클래스를 목록에 추가하면 된다.</p>
 */
public final class StackWalkingCallSiteResolver implements CallSiteResolver {

    private static final String SDK_PACKAGE = "io.github.hongjungwan.smartlog.";

    public static final StackWalkingCallSiteResolver INSTANCE = new StackWalkingCallSiteResolver(List.of(SDK_PACKAGE));

    private final StackWalker walker = StackWalker.getInstance();
    private final List<String> skipped;

    public StackWalkingCallSiteResolver(Collection<String> skipped) {
        this.skipped = List.copyOf(skipped);
    }

    @Override
    public CallSite resolve() {
        return walker.walk(frames -> frames
                .filter(frame -> !isSkipped(frame.getClassName()))
                .findFirst()
                .map(frame -> new CallSite(frame.getFileName(), frame.getLineNumber(),
                        frame.getClassName() + "." + frame.getMethodName()))
                .orElse(CallSite.unknown()));
    }

    boolean isSkipped(String className) {
        for (String entry : skipped) {
            if (entry.endsWith(".")) {
                if (className.startsWith(entry)) {
                    return true;
                }
            } else if (className.equals(entry) || className.startsWith(entry + "$")) {
                return true;
            }
        }
        return false;
    }
}
