package com.exitdebt.backend.enums;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CadenceTest {

    private static final List<LocalDate> ANCHORS = List.of(
            LocalDate.of(2024, 1, 15),
            LocalDate.of(2024, 1, 31),
            LocalDate.of(2023, 8, 31),
            LocalDate.of(2024, 2, 29),
            LocalDate.of(2023, 12, 30)
    );

    @Test
    void advance_weekly_addsSevenDaysPerPeriod() {
        LocalDate t = LocalDate.of(2024, 3, 1);

        assertEquals(LocalDate.of(2024, 3, 8), Cadence.WEEKLY.advance(t, 1));
        assertEquals(LocalDate.of(2024, 3, 15), Cadence.WEEKLY.advance(t, 2));
        assertEquals(LocalDate.of(2024, 3, 22), Cadence.WEEKLY.advance(t, 3));
        assertEquals(LocalDate.of(2024, 3, 29), Cadence.BIWEEKLY.advance(t, 2));
    }

    @Test
    @DisplayName("Fim de mês é ajustado sem acumular deslocamento")
    void advance_monthly_clampsEndOfMonthFromAnchor() {
        LocalDate anchor = LocalDate.of(2024, 1, 31);

        assertEquals(LocalDate.of(2024, 2, 29), Cadence.MONTHLY.advance(anchor, 1));
        assertEquals(LocalDate.of(2024, 3, 31), Cadence.MONTHLY.advance(anchor, 2));
        assertEquals(LocalDate.of(2024, 4, 30), Cadence.MONTHLY.advance(anchor, 3));
        assertEquals(LocalDate.of(2024, 4, 30), Cadence.QUARTERLY.advance(anchor, 1));
        assertEquals(LocalDate.of(2025, 2, 28), Cadence.YEARLY.advance(LocalDate.of(2024, 2, 29), 1));
    }

    @Test
    void advance_negativePeriods_throws() {
        assertThrows(IllegalArgumentException.class, () -> Cadence.MONTHLY.advance(LocalDate.of(2024, 1, 1), -1));
    }

    @Test
    void wholePeriodsBetween_countsOnlyCompletePeriods() {
        LocalDate anchor = LocalDate.of(2024, 1, 15);

        assertEquals(2, Cadence.WEEKLY.wholePeriodsBetween(anchor, anchor.plusDays(20)));
        assertEquals(3, Cadence.WEEKLY.wholePeriodsBetween(anchor, anchor.plusDays(21)));
        assertEquals(0, Cadence.MONTHLY.wholePeriodsBetween(anchor, LocalDate.of(2024, 2, 14)));
        assertEquals(1, Cadence.MONTHLY.wholePeriodsBetween(anchor, LocalDate.of(2024, 2, 15)));
        assertEquals(1, Cadence.QUARTERLY.wholePeriodsBetween(anchor, LocalDate.of(2024, 7, 14)));
        assertEquals(1, Cadence.YEARLY.wholePeriodsBetween(anchor, LocalDate.of(2026, 1, 14)));
    }

    @Test
    void wholePeriodsBetween_endOfMonthAnchor_countsClampedMonth() {
        // 31/01 + 1 mês = 29/02; a data ajustada conta como período completo
        assertEquals(1, Cadence.MONTHLY.wholePeriodsBetween(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 29)));
        assertEquals(0, Cadence.MONTHLY.wholePeriodsBetween(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 28)));
    }

    @Test
    void wholePeriodsBetween_targetNotAfterAnchor_returnsZero() {
        LocalDate anchor = LocalDate.of(2024, 1, 15);

        assertEquals(0, Cadence.MONTHLY.wholePeriodsBetween(anchor, anchor));
        assertEquals(0, Cadence.WEEKLY.wholePeriodsBetween(anchor, anchor.minusDays(30)));
    }

    @Test
    @DisplayName("advance e wholePeriodsBetween são inversos para toda cadência recorrente")
    void wholePeriodsBetween_isInverseOfAdvance() {
        for (Cadence cadence : Cadence.values()) {
            if (!cadence.isRecurring()) continue;
            for (LocalDate anchor : ANCHORS) {
                for (int n = 1; n <= 60; n++) {
                    LocalDate due = cadence.advance(anchor, n);
                    assertEquals(n, cadence.wholePeriodsBetween(anchor, due),
                            cadence + " a partir de " + anchor + " com " + n + " períodos");
                }
            }
        }
    }

    @Test
    void isRecurring_onlyOneTimeIsNot() {
        assertFalse(Cadence.ONE_TIME.isRecurring());
        assertTrue(Cadence.WEEKLY.isRecurring());
        assertTrue(Cadence.YEARLY.isRecurring());
    }
}
