package io.github.hongjungwan.smartlog.api;

import io.github.hongjungwan.smartlog.api.exception.UnknownSeverityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SeverityScale 테스트")
class SeverityScaleTest {

    @Nested
    @DisplayName("이름 해석")
    class NameResolutionTests {

        @ParameterizedTest
        @CsvSource({
                "emergency, 0",
                "alert, 1",
                "critical, 2",
                "error, 3",
                "warning, 4",
                "notice, 5",
                "informational, 6",
                "debug, 7"
        })
        @DisplayName("전체 이름은 고정 rank로 해석되어야 한다")
        void shouldResolveFullNames(String name, int rank) {
            assertThat(SeverityScale.ordinal(name)).isEqualTo(rank);
        }

        @Test
        @DisplayName("prefix로 해석되어야 한다")
        void shouldResolvePrefix() {
            assertThat(SeverityScale.ordinal("err")).isEqualTo(3);
            assertThat(SeverityScale.ordinal("info")).isEqualTo(6);
            assertThat(SeverityScale.ordinal("warn")).isEqualTo(4);
        }

        @Test
        @DisplayName("모호한 prefix는 가장 심각한 항목이 이겨야 한다")
        void shouldPreferMostSevereOnAmbiguousPrefix() {
            assertThat(SeverityScale.ordinal("e")).isEqualTo(0);
            assertThat(SeverityScale.ordinal("c")).isEqualTo(2);
        }

        @Test
        @DisplayName("대소문자를 구분하지 않아야 한다")
        void shouldIgnoreCase() {
            assertThat(SeverityScale.severity("DeBuG")).isEqualTo(Severity.DEBUG);
            assertThat(SeverityScale.severity("ALERT")).isEqualTo(Severity.ALERT);
        }

        @Test
        @DisplayName("알 수 없는 이름은 UnknownSeverityException을 던져야 한다")
        void shouldRejectUnknownName() {
            assertThatThrownBy(() -> SeverityScale.ordinal("bogus"))
                    .isInstanceOf(UnknownSeverityException.class)
                    .hasMessageContaining("bogus");
        }

        @Test
        @DisplayName("빈 문자열은 첫 항목인 emergency와 일치해야 한다")
        void shouldMatchEmptyToFirstEntry() {
            assertThat(SeverityScale.ordinal("")).isZero();
            assertThat(SeverityScale.severity("  ")).isEqualTo(Severity.EMERGENCY);
        }

        @Test
        @DisplayName("null은 거부되어야 한다")
        void shouldRejectNull() {
            assertThatThrownBy(() -> SeverityScale.ordinal((String) null))
                    .isInstanceOf(UnknownSeverityException.class);
        }
    }

    @Nested
    @DisplayName("rank 검증")
    class RankTests {

        @Test
        @DisplayName("범위 안의 rank는 그대로 반환해야 한다")
        void shouldPassThroughValidRank() {
            assertThat(SeverityScale.ordinal(3)).isEqualTo(3);
            assertThat(SeverityScale.ordinal(SeverityScale.OFF)).isEqualTo(SeverityScale.OFF);
        }

        @Test
        @DisplayName("범위 밖 rank는 거부해야 한다")
        void shouldRejectOutOfRange() {
            assertThatThrownBy(() -> SeverityScale.ordinal(8))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> SeverityScale.ordinal(-2))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("threshold는 off를 OFF로 해석해야 한다")
        void shouldResolveOffThreshold() {
            assertThat(SeverityScale.threshold("off")).isEqualTo(SeverityScale.OFF);
            assertThat(SeverityScale.threshold(" OFF ")).isEqualTo(SeverityScale.OFF);
            assertThat(SeverityScale.threshold("notice")).isEqualTo(5);
        }

        @Test
        @DisplayName("label은 소문자 이름을 반환해야 한다")
        void shouldReturnLabel() {
            assertThat(SeverityScale.label(6)).isEqualTo("informational");
            assertThat(Severity.INFORMATIONAL.upperLabel()).isEqualTo("INFORMATIONAL");
        }
    }
}
