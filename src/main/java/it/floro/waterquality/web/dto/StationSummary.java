package it.floro.waterquality.web.dto;

import it.floro.waterquality.wqi.WqiResult;

import java.time.LocalDate;

/**
 * DTO con l'ultimo stato noto di una stazione: anagrafica, data del campione
 * più recente e relativo risultato WQI.
 *
 * Utilizzato dalla mappa del dashboard (marker colorati per classe) e dalla
 * classifica delle stazioni peggiori.
 */
public record StationSummary(
        String stationId,
        String stationName,
        String district,
        String waterBodyType,
        double latitude,
        double longitude,
        LocalDate date,
        WqiResult result
) {}
