package io.github.hongjungwan.smartlog.core.bridge;

import io.github.hongjungwan.smartlog.api.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorCategory 테스트")
class ErrorCategoryTest {

    @Test
    @DisplayName("오류 종류별 고정 심각도를 가져야 한다")
    void shouldMapToFixedSeverity() {
        assertThat(ErrorCategory.CORE.severity()).isEqualTo(Severity.EMERGENCY);
        assertThat(ErrorCategory.ERROR.severity()).isEqualTo(Severity.ALERT);
        assertThat(ErrorCategory.WARNING.severity()).isEqualTo(Severity.WARNING);
        assertThat(ErrorCategory.NOTICE.severity()).isEqualTo(Severity.NOTICE);
    }

    @Test
    @DisplayName("이름은 대소문자를 무시하고 찾아야 한다")
    void shouldFindByName() {
        assertThat(ErrorCategory.find("Warning")).contains(ErrorCategory.WARNING);
        assertThat(ErrorCategory.find("deprecated")).isEmpty();
        assertThat(ErrorCategory.find(null)).isEmpty();
    }

    @Test
    @DisplayName("VirtualMachineError만 CORE로 분류해야 한다")
    void shouldClassifyThrowables() {
        assertThat(ErrorCategory.classify(new OutOfMemoryError())).isEqualTo(ErrorCategory.CORE);
        assertThat(ErrorCategory.classify(new AssertionError())).isEqualTo(ErrorCategory.ERROR);
        assertThat(ErrorCategory.classify(new RuntimeException())).isEqualTo(ErrorCategory.ERROR);
    }
}
