package com.appointments.booking.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SlotCatalog and DateLabels")
class SlotCatalogTest {

    @Test
    @DisplayName("Catalog has thirteen ordered slots with a lunch gap")
    void slots_AreOrderedWithLunchGap() {
        assertThat(SlotCatalog.slots())
                .hasSize(13)
                .startsWith("09:00", "09:30")
                .endsWith("16:30", "17:00")
                .contains("11:30", "14:00")
                .doesNotContain("12:00", "12:30", "13:00", "13:30")
                .isSorted();
    }

    @Test
    @DisplayName("Membership rejects unknown and null times")
    void contains_RejectsUnknown() {
        assertThat(SlotCatalog.contains("10:30")).isTrue();
        assertThat(SlotCatalog.contains("10:15")).isFalse();
        assertThat(SlotCatalog.contains("9:00")).isFalse();
        assertThat(SlotCatalog.contains(null)).isFalse();
    }

    @Test
    @DisplayName("Label uses Italian abbreviations and a two digit day")
    void shortLabel_Italian() {
        assertThat(DateLabels.shortLabel(LocalDate.of(2025, 3, 3))).isEqualTo("lun 03 mar");
        assertThat(DateLabels.shortLabel(LocalDate.of(2025, 3, 10))).isEqualTo("lun 10 mar");
        assertThat(DateLabels.shortLabel(LocalDate.of(2024, 12, 29))).isEqualTo("dom 29 dic");
        assertThat(DateLabels.shortLabel(LocalDate.of(2026, 8, 15))).isEqualTo("sab 15 ago");
    }
}
