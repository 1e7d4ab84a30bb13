package it.floro.waterquality.web;

import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.service.StationDataService;
import it.floro.waterquality.service.StationFilters;
import it.floro.waterquality.service.StationFilters.FilterParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Controller astratto che centralizza il flusso comune degli endpoint
 * basati sui campioni delle stazioni.
 *
 * Flusso (resolveFilters + filter):
 * 1. Recupera il dataset completo da StationDataService
 * 2. Costruisce FilterParams dai parametri della richiesta
 * 3. Applica il predicato di StationFilters
 *
 * Sottoclassi concrete: StationController, ExportController.
 */
public abstract class BaseStationController {

    // ========================================================================
    // DIPENDENZE INIETTATE
    // ========================================================================

    protected final StationDataService stationDataService;

    protected final StationFilters stationFilters;

    protected BaseStationController(StationDataService stationDataService, StationFilters stationFilters) {
        this.stationDataService = stationDataService;
        this.stationFilters = stationFilters;
    }

    // ========================================================================
    // FLUSSO STANDARD
    // ========================================================================

    /**
     * Traduce i parametri grezzi in filtri risolti, usando come riferimento
     * l'intervallo di date coperto dal dataset corrente.
     *
     * @param district distretto (nullable, case- e accent-insensitive)
     * @param waterBodyType tipo di corpo idrico (nullable)
     * @param stationId identificativo stazione (nullable)
     * @param periodo "giorno", "mese", "trimestre", "anno", "custom" (o alias inglesi)
     */
    protected FilterParams resolveFilters(
            String district,
            String waterBodyType,
            String stationId,
            LocalDate startDate,
            LocalDate endDate,
            String periodo,
            Integer year,
            Integer month,
            Integer quarter
    ) {
        return stationFilters.fromRequest(
                district, waterBodyType, stationId, startDate, endDate, periodo, year, month, quarter,
                stationDataService.getMinDate(), stationDataService.getMaxDate()
        );
    }

    /**
     * Dataset completo filtrato.
     */
    protected List<StationSample> filter(FilterParams params) {
        return stationFilters.apply(stationDataService.getAll(), params);
    }
}
