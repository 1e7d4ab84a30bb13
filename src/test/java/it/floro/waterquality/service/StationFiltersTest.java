package it.floro.waterquality.service;

import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.service.StationFilters.FilterParams;
import it.floro.waterquality.service.StationFilters.Period;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static it.floro.waterquality.service.SampleFixtures.clean;
import static it.floro.waterquality.service.SampleFixtures.polluted;
import static org.junit.jupiter.api.Assertions.*;

public class StationFiltersTest {

    private static final LocalDate MIN = LocalDate.of(2022, 1, 1);
    private static final LocalDate MAX = LocalDate.of(2024, 6, 15);

    private final StationFilters filters = new StationFilters();

    private FilterParams resolve(String period, Integer year, Integer month, Integer quarter) {
        return filters.fromRequest(null, null, null, null, null, period, year, month, quarter, MIN, MAX);
    }

    @Test
    void testPeriodAliases() {
        assertEquals(Period.MONTH, Period.ofNullable("mese"));
        assertEquals(Period.QUARTER, Period.ofNullable(" Quarterly "));
        assertEquals(Period.YEAR, Period.ofNullable("anno"));
        assertEquals(Period.DAY, Period.ofNullable("giorno"));
        assertEquals(Period.CUSTOM, Period.ofNullable(null));
        assertEquals(Period.CUSTOM, Period.ofNullable("settimana"));
    }

    @Test
    void testYearPeriod() {
        FilterParams p = resolve("anno", 2023, null, null);
        assertEquals(LocalDate.of(2023, 1, 1), p.start());
        assertEquals(LocalDate.of(2023, 12, 31), p.end());
    }

    @Test
    void testMonthPeriodHandlesLeapYear() {
        FilterParams p = resolve("mese", 2024, 2, null);
        assertEquals(LocalDate.of(2024, 2, 1), p.start());
        assertEquals(LocalDate.of(2024, 2, 29), p.end());
    }

    @Test
    void testQuarterPeriod() {
        FilterParams p = resolve("trimestre", 2023, null, 3);
        assertEquals(LocalDate.of(2023, 7, 1), p.start());
        assertEquals(LocalDate.of(2023, 9, 30), p.end());
    }

    @Test
    void testDefaultsComeFromMaxDate() {
        FilterParams day = resolve("giorno", null, null, null);
        assertEquals(MAX, day.start());
        assertEquals(MAX, day.end());

        FilterParams month = resolve("mese", null, null, null);
        assertEquals(LocalDate.of(2024, 6, 1), month.start());
        assertEquals(LocalDate.of(2024, 6, 30), month.end());

        FilterParams custom = resolve(null, null, null, null);
        assertEquals(MIN, custom.start());
        assertEquals(MAX, custom.end());
    }

    @Test
    void testInvertedRangeIsSwapped() {
        FilterParams p = filters.fromRequest(null, null, null,
                LocalDate.of(2024, 5, 10), LocalDate.of(2024, 5, 1), null, null, null, null, MIN, MAX);
        assertEquals(LocalDate.of(2024, 5, 1), p.start());
        assertEquals(LocalDate.of(2024, 5, 10), p.end());
    }

    @Test
    void testBlankStringsBecomeNull() {
        FilterParams p = filters.fromRequest("  ", " Lake ", "", null, null, null, null, null, null, MIN, MAX);
        assertNull(p.district());
        assertEquals("Lake", p.waterBodyType());
        assertNull(p.stationId());
    }

    @Test
    void testPredicateIsCaseAndAccentInsensitive() {
        List<StationSample> all = List.of(
                clean(LocalDate.of(2024, 5, 2), "Pune", "MH-001"),
                polluted(LocalDate.of(2024, 5, 2), "Mumbai", "MH-002")
        );

        FilterParams byDistrict = filters.fromRequest("PÙNE", null, null,
                null, null, null, null, null, null, MIN, MAX);
        assertEquals(List.of("MH-001"), ids(filters.apply(all, byDistrict)));

        FilterParams byStation = filters.fromRequest(null, null, "mh 002",
                null, null, null, null, null, null, MIN, MAX);
        assertEquals(List.of("MH-002"), ids(filters.apply(all, byStation)));

        FilterParams byType = filters.fromRequest(null, "lake", null,
                null, null, null, null, null, null, MIN, MAX);
        assertEquals(List.of("MH-002"), ids(filters.apply(all, byType)));
    }

    @Test
    void testDateRangeIsInclusive() {
        List<StationSample> all = List.of(
                clean(LocalDate.of(2024, 4, 30), "Pune", "MH-001"),
                clean(LocalDate.of(2024, 5, 1), "Pune", "MH-001"),
                clean(LocalDate.of(2024, 5, 31), "Pune", "MH-001"),
                clean(LocalDate.of(2024, 6, 1), "Pune", "MH-001")
        );
        FilterParams may = resolve("mese", 2024, 5, null);
        assertEquals(2, filters.apply(all, may).size());
    }

    @Test
    void testDistinctValues() {
        List<StationSample> all = List.of(
                clean(MAX, "Pune", "MH-001"),
                polluted(MAX, "Mumbai", "MH-002"),
                clean(MAX, "Pune", "MH-003")
        );
        assertEquals(List.of("Mumbai", "Pune"), filters.districtsFrom(all));
        assertEquals(List.of("Lake", "River"), filters.waterBodyTypesFrom(all));
    }

    @Test
    void testNormalization() {
        assertEquals("mh 001", StationFilters.normalizeNullable(" MH-001 "));
        assertEquals("citta", StationFilters.normalizeNullable("Città"));
        assertNull(StationFilters.normalizeNullable(null));
    }

    private static List<String> ids(List<StationSample> samples) {
        return samples.stream().map(StationSample::stationId).toList();
    }
}
