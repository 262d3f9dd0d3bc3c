package io.pricelake.financial.enrich;

import io.pricelake.error.DataQualityException;
import io.pricelake.financial.model.EnrichedRow;
import io.pricelake.financial.model.PriceRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static io.pricelake.financial.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

class MetricsCalculatorTest {
    private static final double EPS = 1e-9;

    @Test
    void returnsAndVolatilityForThreeCloses() {
        List<EnrichedRow> out = new MetricsCalculator().compute(List.of(
                row("X", "2024-01-02", 100), row("X", "2024-01-03", 110), row("X", "2024-01-04", 99)));

        assertNull(out.get(0).dailyReturn());
        assertEquals(10.0, out.get(1).dailyReturn(), EPS);
        assertEquals(-10.0, out.get(2).dailyReturn(), EPS);

        assertNotNull(out.get(0).rollingVol());
        assertEquals(0.0, out.get(0).rollingVol(), EPS);
        assertEquals(0.0, out.get(1).rollingVol(), EPS);
        assertEquals(Math.sqrt(200.0), out.get(2).rollingVol(), EPS);
    }

    @Test
    void sortsByDateBeforeComputing() {
        List<EnrichedRow> out = new MetricsCalculator().compute(List.of(
                row("X", "2024-01-04", 99), row("X", "2024-01-02", 100), row("X", "2024-01-03", 110)));
        assertEquals(LocalDate.parse("2024-01-02"), out.get(0).date());
        assertEquals(-10.0, out.get(2).dailyReturn(), EPS);
    }

    @Test
    void zeroPriorCloseIsADataError() {
        MetricsCalculator calc = new MetricsCalculator();
        DataQualityException e = assertThrows(DataQualityException.class,
                () -> calc.compute(List.of(row("X", "2024-01-02", 0), row("X", "2024-01-03", 10))));
        assertTrue(e.getMessage().contains("Zero prior close"));
    }

    @Test
    void missingPriorCloseGivesNullReturn() {
        PriceRow noClose = new PriceRow("X", LocalDate.parse("2024-01-03"), 1, 1, 1, Double.NaN, 0, null);
        List<EnrichedRow> out = new MetricsCalculator().compute(List.of(
                row("X", "2024-01-02", 100), noClose, row("X", "2024-01-04", 110)));
        assertNull(out.get(1).dailyReturn());
        assertNull(out.get(2).dailyReturn());
    }

    @Test
    void rollingWindowOnlyUsesTrailingObservations() {
        List<PriceRow> rows = new ArrayList<>();
        LocalDate d = LocalDate.of(2024, 1, 1);
        double close = 100;
        for (int i = 0; i < 10; i++) {
            rows.add(row("X", d.plusDays(i), close));
            close *= i < 5 ? 1.10 : 1.01;
        }
        List<EnrichedRow> out = new MetricsCalculator(3).compute(rows);
        // the last three observations all rose by 1%
        assertEquals(0.0, out.get(9).rollingVol(), 1e-6);
        assertTrue(out.get(6).rollingVol() > 1.0);
    }

    @Test
    void instrumentsNeverShareAWindow() {
        List<EnrichedRow> out = new MetricsCalculator().compute(List.of(
                row("A", "2024-01-02", 100), row("B", "2024-01-02", 10),
                row("A", "2024-01-03", 110), row("B", "2024-01-03", 20)));

        EnrichedRow firstB = out.stream().filter(r -> r.instrument().equals("B")).findFirst().orElseThrow();
        assertNull(firstB.dailyReturn());
        EnrichedRow secondB = out.stream().filter(r -> r.instrument().equals("B") && r.date().getDayOfMonth() == 3).findFirst().orElseThrow();
        assertEquals(100.0, secondB.dailyReturn(), EPS);
    }

    @Test
    void historySeedsFirstReturnButIsNotEmitted() {
        List<EnrichedRow> out = new MetricsCalculator().compute(
                List.of(row("X", "2023-12-28", 90), row("X", "2023-12-29", 100)),
                List.of(row("X", "2024-01-02", 110)));
        assertEquals(1, out.size());
        assertEquals(10.0, out.get(0).dailyReturn(), EPS);
        double r1 = 100.0 * 10 / 90;
        double mean = (r1 + 10.0) / 2;
        double expected = Math.sqrt((r1 - mean) * (r1 - mean) + (10.0 - mean) * (10.0 - mean));
        assertEquals(expected, out.get(0).rollingVol(), EPS);
    }
}
