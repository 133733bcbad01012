package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.DateWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RangeSplitter Tests")
class RangeSplitterTest {

    @Test
    @DisplayName("Splits Jan 1 to Apr 15 into 100-day windows")
    void testSplitsLongRange() {
        List<DateWindow> windows = RangeSplitter.split(
            LocalDate.of(2023, 1, 1), LocalDate.of(2023, 4, 15), 100);

        assertThat(windows).containsExactly(
            new DateWindow(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 4, 10)),
            new DateWindow(LocalDate.of(2023, 4, 11), LocalDate.of(2023, 4, 15)));
    }

    @Test
    @DisplayName("Windows are contiguous, bounded and cover the range")
    void testCoverage() {
        LocalDate from = LocalDate.of(2020, 2, 29);
        LocalDate to = LocalDate.of(2024, 12, 31);

        List<DateWindow> windows = RangeSplitter.split(from, to, 366);

        assertThat(windows.get(0).from()).isEqualTo(from);
        assertThat(windows.get(windows.size() - 1).to()).isEqualTo(to);
        for (int i = 0; i < windows.size(); i++) {
            assertThat(windows.get(i).days()).isBetween(1L, 366L);
            if (i > 0) {
                assertThat(windows.get(i).from()).isEqualTo(windows.get(i - 1).to().plusDays(1));
            }
        }
        long covered = windows.stream().mapToLong(DateWindow::days).sum();
        assertThat(covered).isEqualTo(ChronoUnit.DAYS.between(from, to) + 1);
    }

    @Test
    @DisplayName("Single day yields one window")
    void testSingleDay() {
        LocalDate day = LocalDate.of(2023, 6, 1);

        assertThat(RangeSplitter.split(day, day, 100)).containsExactly(new DateWindow(day, day));
    }

    @Test
    @DisplayName("Inverted range yields nothing")
    void testInvertedRange() {
        assertThat(RangeSplitter.split(LocalDate.of(2023, 6, 2), LocalDate.of(2023, 6, 1), 100)).isEmpty();
    }

    @Test
    @DisplayName("Non-positive window size is rejected")
    void testInvalidWindowSize() {
        assertThatThrownBy(() -> RangeSplitter.split(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 1, 2), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
