package it.floro.waterquality.web.api;

import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.service.StationDataService;
import it.floro.waterquality.service.StationFilters;
import it.floro.waterquality.service.StationFilters.FilterParams;
import it.floro.waterquality.service.WqiKpiService;
import it.floro.waterquality.web.BaseStationController;
import it.floro.waterquality.web.StationNotFoundException;
import it.floro.waterquality.web.dto.StationSummary;
import it.floro.waterquality.web.dto.WqiSnapshot;
import it.floro.waterquality.wqi.SubIndices;
import it.floro.waterquality.wqi.WaterQualityClass;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.format.annotation.DateTimeFormat.ISO;

/**
 * Controller REST che espone lo stato delle stazioni di monitoraggio e gli
 * aggregati WQI per il dashboard.
 *
 * Mapping base: /api/stations
 *
 * Tutti gli endpoint accettano gli stessi filtri opzionali:
 * district, waterBodyType, startDate, endDate (ISO yyyy-MM-dd), periodo, year, month, quarter.
 */
@RestController
@RequestMapping("/api/stations")
public class StationController extends BaseStationController {

    /** Numero di stazioni critiche incluse nello snapshot. */
    private static final int WORST_STATIONS = 5;

    private final WqiKpiService kpiService;

    public StationController(StationDataService stationDataService,
                             StationFilters stationFilters,
                             WqiKpiService kpiService) {
        super(stationDataService, stationFilters);
        this.kpiService = kpiService;
    }

    // ========================================================================
    // ENDPOINT 1: ULTIMO STATO DI OGNI STAZIONE
    // ========================================================================

    /**
     * Ultimo campione di ogni stazione nel periodo filtrato, con il relativo WQI.
     * Alimenta la mappa del dashboard.
     */
    @GetMapping
    public List<StationSummary> list(
            @RequestParam(required = false) String district,
            @RequestParam(required = false) String waterBodyType,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String periodo,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer quarter
    ) {
        FilterParams params = resolveFilters(district, waterBodyType, null,
                startDate, endDate, periodo, year, month, quarter);
        return kpiService.stationSummaries(filter(params));
    }

    // ========================================================================
    // ENDPOINT 2: CAMPIONI DI UNA STAZIONE
    // ========================================================================

    /**
     * Campioni di una singola stazione nel periodo filtrato, ordinati per data.
     *
     * @throws StationNotFoundException se la stazione non esiste nel dataset (HTTP 404)
     */
    @GetMapping("/{id}")
    public List<StationSample> station(
            @PathVariable String id,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String periodo,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer quarter
    ) {
        boolean known = stationDataService.latestByStation().stream()
                .anyMatch(s -> s.stationId().equalsIgnoreCase(id.trim()));
        if (!known) {
            throw new StationNotFoundException(id);
        }

        FilterParams params = resolveFilters(null, null, id,
                startDate, endDate, periodo, year, month, quarter);
        return filter(params);
    }

    // ========================================================================
    // ENDPOINT 3: SNAPSHOT AGGREGATO
    // ========================================================================

    /**
     * Snapshot aggregato: WQI medio, sotto-indici medi, disaggregazioni,
     * distribuzione per classe e stazioni peggiori.
     */
    @GetMapping("/snapshot")
    public WqiSnapshot snapshot(
            @RequestParam(required = false) String district,
            @RequestParam(required = false) String waterBodyType,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String periodo,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer quarter
    ) {
        FilterParams params = resolveFilters(district, waterBodyType, null,
                startDate, endDate, periodo, year, month, quarter);
        List<StationSample> filtered = filter(params);

        double averageWqi = kpiService.averageWqi(filtered);

        Map<String, Double> subIndices = new LinkedHashMap<>();
        for (String name : SubIndices.NAMES) {
            subIndices.put(name, kpiService.averageSubIndex(filtered, name));
        }

        Map<String, Long> distribution = new LinkedHashMap<>();
        kpiService.classDistribution(filtered).forEach((c, n) -> distribution.put(c.label(), n));

        return new WqiSnapshot(
                averageWqi,
                filtered.isEmpty() ? null : WaterQualityClass.of(averageWqi).label(),
                subIndices,
                filtered.size(),
                kpiService.wqiByDistrict(filtered),
                kpiService.wqiByWaterBodyType(filtered),
                distribution,
                kpiService.worstStations(filtered, WORST_STATIONS)
        );
    }

    // ========================================================================
    // ENDPOINT 4: SERIE TEMPORALI
    // ========================================================================

    /**
     * Serie del WQI medio.
     *
     * @param granularity "daily" (chiave yyyy-MM-dd) oppure "annual" (chiave anno)
     * @throws IllegalArgumentException per granularità non supportate (HTTP 400)
     */
    @GetMapping("/series")
    public Map<String, Double> series(
            @RequestParam(defaultValue = "daily") String granularity,
            @RequestParam(required = false) String district,
            @RequestParam(required = false) String waterBodyType,
            @RequestParam(required = false) String stationId,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String periodo,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer quarter
    ) {
        FilterParams params = resolveFilters(district, waterBodyType, stationId,
                startDate, endDate, periodo, year, month, quarter);
        List<StationSample> filtered = filter(params);

        Map<String, Double> out = new LinkedHashMap<>();
        switch (granularity.trim().toLowerCase()) {
            case "daily" -> kpiService.dailyWqiSeries(filtered)
                    .forEach((d, v) -> out.put(d.toString(), v));
            case "annual" -> kpiService.annualWqiSeries(filtered)
                    .forEach((y, v) -> out.put(String.valueOf(y), v));
            default -> throw new IllegalArgumentException(
                    "Granularità non supportata: " + granularity + " (ammesse: daily, annual)");
        }
        return out;
    }

    // ========================================================================
    // ENDPOINT 5: VALORI DEI FILTRI
    // ========================================================================

    /**
     * Valori disponibili per i menu di selezione: distretti, tipi di corpo
     * idrico e intervallo di date coperto dal dataset.
     */
    @GetMapping("/filters")
    public Map<String, Object> filterOptions() {
        List<StationSample> all = stationDataService.getAll();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("districts", stationFilters.districtsFrom(all));
        out.put("waterBodyTypes", stationFilters.waterBodyTypesFrom(all));
        out.put("minDate", stationDataService.getMinDate());
        out.put("maxDate", stationDataService.getMaxDate());
        return out;
    }
}
