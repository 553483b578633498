package com.university.clashfree.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeGridTest {

    private final TimeGrid grid = new TimeGrid(List.of("Mon", "Tue"), 5, List.of(2));

    @Test
    void rangesNeverTouchABreak() {
        assertThat(grid.ranges(2)).containsExactly(
                new SlotRange(0, 0, 2), new SlotRange(0, 3, 2),
                new SlotRange(1, 0, 2), new SlotRange(1, 3, 2));
        assertThat(grid.ranges(1)).hasSize(8);
    }

    @Test
    void noRangesLongerThanADay() {
        assertThat(grid.ranges(6)).isEmpty();
        assertThat(grid.ranges(3)).isEmpty();
    }

    @Test
    void fitsChecksBoundsAndBreaks() {
        assertThat(grid.fits(new SlotRange(1, 3, 2))).isTrue();
        assertThat(grid.fits(new SlotRange(1, 4, 2))).isFalse();
        assertThat(grid.fits(new SlotRange(2, 0, 1))).isFalse();
        assertThat(grid.fits(new SlotRange(0, 1, 2))).isFalse();
    }

    @Test
    void looksUpDaysByLabel() {
        assertThat(grid.dayIndex("Tue")).isEqualTo(1);
        assertThat(grid.dayIndex("Sun")).isEqualTo(-1);
        assertThat(grid.dayName(0)).isEqualTo("Mon");
        assertThat(grid.describe(new SlotRange(1, 3, 2))).isEqualTo("Tue P4-P5");
        assertThat(grid.contains(new TimeSlot(1, 4))).isTrue();
        assertThat(grid.contains(new TimeSlot(1, 5))).isFalse();
    }

    @Test
    void rejectsMalformedGrids() {
        assertThatThrownBy(() -> new TimeGrid(List.of(), 4)).isInstanceOf(ModelException.class);
        assertThatThrownBy(() -> new TimeGrid(List.of("Mon"), 0)).isInstanceOf(ModelException.class);
        assertThatThrownBy(() -> new TimeGrid(List.of("Mon", "Mon"), 4))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("unique");
        assertThatThrownBy(() -> new TimeGrid(List.of("Mon"), 4, List.of(4)))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("Break period 4");
    }
}
