package it.floro.waterquality.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configurazione del dataset simulato di stazioni.
 *
 * Chiavi: {@code waterquality.simulation.*} in application.properties.
 */
@Validated
@ConfigurationProperties(prefix = "waterquality.simulation")
public class SimulationProperties {

    /** Seed del dataset storico: stesso seed, stessi dati a ogni avvio. */
    private long seed = 42L;

    /** Numero di stazioni simulate. */
    @Min(1)
    @Max(5000)
    private int stations = 40;

    /** Anni di storico generati a ritroso dal primo gennaio. */
    @Min(0)
    @Max(20)
    private int historyYears = 3;

    /** Intervallo dell'aggiornamento live dei campioni odierni (ms). */
    @Min(1000)
    private long liveRefreshMs = 10_000L;

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getStations() {
        return stations;
    }

    public void setStations(int stations) {
        this.stations = stations;
    }

    public int getHistoryYears() {
        return historyYears;
    }

    public void setHistoryYears(int historyYears) {
        this.historyYears = historyYears;
    }

    public long getLiveRefreshMs() {
        return liveRefreshMs;
    }

    public void setLiveRefreshMs(long liveRefreshMs) {
        this.liveRefreshMs = liveRefreshMs;
    }
}
