package it.floro.waterquality.service;

import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.web.dto.StationSummary;
import it.floro.waterquality.wqi.WaterQualityClass;
import it.floro.waterquality.wqi.WqiCalculator;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static it.floro.waterquality.service.SampleFixtures.clean;
import static it.floro.waterquality.service.SampleFixtures.polluted;
import static it.floro.waterquality.service.SampleFixtures.sample;
import static org.junit.jupiter.api.Assertions.*;

public class WqiKpiServiceTest {

    private static final LocalDate D1 = LocalDate.of(2023, 12, 31);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 1);

    private final WqiKpiService kpiService = new WqiKpiService(new WqiCalculator());

    @Test
    void testAverageWqi() {
        List<StationSample> samples = List.of(clean(D1, "Pune", "MH-001"), polluted(D1, "Mumbai", "MH-002"));
        assertEquals((83.1731 + 12.5796) / 2, kpiService.averageWqi(samples), 0.01);
    }

    @Test
    void testAverageOfEmptyDatasetIsZero() {
        assertEquals(0.0, kpiService.averageWqi(List.of()));
        assertEquals(0.0, kpiService.averageSubIndex(List.of(), "ph"));
        assertTrue(kpiService.dailyWqiSeries(List.of()).isEmpty());
    }

    @Test
    void testInvalidSamplesAreSkipped() {
        StationSample invalid = sample(D1, "Pune", "MH-003", "River", 7.0, 2.0, 6.0, 0.0);
        List<StationSample> samples = List.of(clean(D1, "Pune", "MH-001"), invalid);

        assertEquals(83.17, kpiService.averageWqi(samples), 0.01);
        assertEquals(1, kpiService.stationSummaries(samples).size());
    }

    @Test
    void testAverageSubIndex() {
        List<StationSample> samples = List.of(clean(D1, "Pune", "MH-001"));
        assertEquals(90.10, kpiService.averageSubIndex(samples, "ph"), 0.01);
        assertEquals(85.45, kpiService.averageSubIndex(samples, "dissolvedOxygen"), 0.01);
        assertThrows(IllegalArgumentException.class, () -> kpiService.averageSubIndex(samples, "turbidity"));
    }

    @Test
    void testSeriesAreSortedByKey() {
        List<StationSample> samples = List.of(
                polluted(D2, "Pune", "MH-001"),
                clean(D1, "Pune", "MH-001"),
                clean(D2, "Pune", "MH-002")
        );

        Map<LocalDate, Double> daily = kpiService.dailyWqiSeries(samples);
        assertEquals(List.of(D1, D2), List.copyOf(daily.keySet()));
        assertEquals(83.17, daily.get(D1), 0.01);
        assertEquals((83.1731 + 12.5796) / 2, daily.get(D2), 0.01);

        Map<Integer, Double> annual = kpiService.annualWqiSeries(samples);
        assertEquals(List.of(2023, 2024), List.copyOf(annual.keySet()));
    }

    @Test
    void testDisaggregations() {
        List<StationSample> samples = List.of(
                clean(D1, "Pune", "MH-001"),
                polluted(D1, "Mumbai", "MH-002")
        );

        Map<String, Double> byDistrict = kpiService.wqiByDistrict(samples);
        assertEquals(List.of("Mumbai", "Pune"), List.copyOf(byDistrict.keySet()));
        assertEquals(12.58, byDistrict.get("Mumbai"), 0.01);

        Map<String, Double> byType = kpiService.wqiByWaterBodyType(samples);
        assertEquals(83.17, byType.get("River"), 0.01);
        assertEquals(12.58, byType.get("Lake"), 0.01);
    }

    @Test
    void testClassDistributionHasEveryBand() {
        Map<WaterQualityClass, Long> dist = kpiService.classDistribution(List.of(
                clean(D1, "Pune", "MH-001"),
                clean(D2, "Pune", "MH-001"),
                polluted(D1, "Mumbai", "MH-002")
        ));

        assertEquals(4, dist.size());
        assertEquals(2L, dist.get(WaterQualityClass.GOOD_TO_EXCELLENT));
        assertEquals(0L, dist.get(WaterQualityClass.MEDIUM_TO_GOOD));
        assertEquals(0L, dist.get(WaterQualityClass.BAD));
        assertEquals(1L, dist.get(WaterQualityClass.BAD_TO_VERY_BAD));
    }

    @Test
    void testStationSummariesUseLatestSample() {
        List<StationSummary> summaries = kpiService.stationSummaries(List.of(
                clean(D2, "Pune", "MH-001"),
                polluted(D1, "Pune", "MH-001")
        ));

        assertEquals(1, summaries.size());
        assertEquals(D2, summaries.get(0).date());
        assertEquals(WaterQualityClass.GOOD_TO_EXCELLENT, summaries.get(0).result().band());
    }

    @Test
    void testWorstStations() {
        List<StationSample> samples = List.of(
                clean(D1, "Pune", "MH-001"),
                polluted(D1, "Mumbai", "MH-002"),
                sample(D1, "Nagpur", "MH-003", "Reservoir", 8.8, 5.0, 4.5, 300)
        );

        List<StationSummary> worst = kpiService.worstStations(samples, 2);
        assertEquals(List.of("MH-002", "MH-003"), worst.stream().map(StationSummary::stationId).toList());
        assertTrue(kpiService.worstStations(samples, 0).isEmpty());
    }
}
