package it.floro.waterquality.web.dto;

import java.util.List;
import java.util.Map;

/**
 * DTO che rappresenta uno snapshot aggregato della qualità dell'acqua
 * da esporre al frontend del dashboard.
 *
 * Struttura:
 * - Sezione "Aggregate": WQI medio e sotto-indici medi sul dataset filtrato
 * - Sezione "Disaggregate": WQI medio per distretto e per tipo di corpo idrico
 * - Distribuzione: numero di campioni per classificazione CPCB
 * - Stazioni critiche: le stazioni con il WQI più basso sull'ultimo campione
 * - Timestamp: millisecondi Unix per il controllo di freschezza lato client
 */
public record WqiSnapshot(
        // ====================================================================
        // SEZIONE 1: METRICHE AGGREGATE
        // ====================================================================

        /** WQI medio sui campioni filtrati. */
        double averageWqi,

        /** Classificazione CPCB del WQI medio (es. "Medium to Good"). */
        String averageClassification,

        /** Sotto-indici medi, chiavi: ph, bod, dissolvedOxygen, fecalColiform. */
        Map<String, Double> averageSubIndices,

        /** Numero di campioni considerati. */
        int sampleCount,

        // ====================================================================
        // SEZIONE 2: METRICHE DISAGGREGATE
        // ====================================================================

        Map<String, Double> wqiByDistrict,

        Map<String, Double> wqiByWaterBodyType,

        /**
         * Campioni per classificazione, in ordine dalla banda migliore alla peggiore.
         * Esempio: {"Good to Excellent": 812, "Medium to Good": 301, "Bad": 95, "Bad to Very Bad": 12}
         */
        Map<String, Long> classDistribution,

        // ====================================================================
        // SEZIONE 3: STAZIONI CRITICHE
        // ====================================================================

        List<StationSummary> worstStations,

        long timestamp
) {

    public WqiSnapshot(double averageWqi, String averageClassification, Map<String, Double> averageSubIndices,
                       int sampleCount, Map<String, Double> wqiByDistrict, Map<String, Double> wqiByWaterBodyType,
                       Map<String, Long> classDistribution, List<StationSummary> worstStations) {
        this(averageWqi, averageClassification, averageSubIndices, sampleCount, wqiByDistrict,
                wqiByWaterBodyType, classDistribution, worstStations, System.currentTimeMillis());
    }
}
