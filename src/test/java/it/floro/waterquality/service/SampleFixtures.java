package it.floro.waterquality.service;

import it.floro.waterquality.domain.StationSample;

import java.time.LocalDate;

/**
 * Costruttori di campioni per i test dei service.
 */
final class SampleFixtures {

    private SampleFixtures() {
    }

    static StationSample sample(LocalDate date, String district, String stationId, String type,
                                double ph, double bod, double dissolvedOxygen, double fecalColiform) {
        return sample(date, district, stationId, type, ph, bod, dissolvedOxygen, fecalColiform, 25.0, 1.0);
    }

    static StationSample sample(LocalDate date, String district, String stationId, String type,
                                double ph, double bod, double dissolvedOxygen, double fecalColiform,
                                double waterTemperature, double turbidity) {
        return new StationSample(date, district, stationId, stationId + " " + type, type,
                18.5, 73.8, ph, bod, dissolvedOxygen, fecalColiform, waterTemperature, turbidity);
    }

    /** Lettura di riferimento: WQI ≈ 83.17, Good to Excellent. */
    static StationSample clean(LocalDate date, String district, String stationId) {
        return sample(date, district, stationId, "River", 7.6, 2.2, 5.5, 6);
    }

    /** Lettura fortemente inquinata: WQI ≈ 12.58, Bad to Very Bad. */
    static StationSample polluted(LocalDate date, String district, String stationId) {
        return sample(date, district, stationId, "Lake", 4.0, 40.0, 0.5, 200_000);
    }
}
