package it.floro.waterquality.service;

import it.floro.waterquality.config.SimulationProperties;
import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.simulator.StationSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service che gestisce il dataset di campioni delle stazioni.
 *
 * Responsabilità:
 * - Generazione e caricamento lazy del dataset storico (anni configurabili)
 * - Caching thread-safe dei campioni in memoria (volatile + sync)
 * - Aggiornamento periodico con campioni "live" simulati per la giornata odierna
 * - Gestione dei limiti temporali del dataset (minDate, maxDate); maxDate avanza
 *   con il primo aggiornamento live di un nuovo giorno
 *
 * Architettura:
 * - Lazy initialization con double-checked locking
 * - Live update schedulato: i campioni odierni vengono rimossi e sostituiti
 * - La cache viene sostituita in blocco (scrittura volatile), mai modificata in place
 */
@Service
public class StationDataService {

    private static final Logger logger = LoggerFactory.getLogger(StationDataService.class);

    private final SimulationProperties properties;

    private final Clock clock;

    /**
     * Cache dei campioni simulati. Lista immutabile, sostituita atomicamente.
     */
    private volatile List<StationSample> cached;

    /** Data massima del dataset: il giorno più recente con campioni. */
    private volatile LocalDate maxDate;

    /** Data minima del dataset: primo gennaio di N anni fa. */
    private final LocalDate minDate;

    @Autowired
    public StationDataService(SimulationProperties properties) {
        this(properties, Clock.systemDefaultZone());
    }

    StationDataService(SimulationProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.maxDate = LocalDate.now(clock);
        this.minDate = maxDate.minusYears(properties.getHistoryYears()).withDayOfYear(1);
    }

    // ========================================================================
    // METODI PUBBLICI
    // ========================================================================

    /**
     * Restituisce tutti i campioni disponibili, generando lo storico al primo accesso.
     *
     * @return lista immutabile di StationSample
     */
    public List<StationSample> getAll() {
        ensureDataLoaded();
        return cached;
    }

    /**
     * Campione più recente per ogni stazione, in ordine di codice stazione.
     */
    public List<StationSample> latestByStation() {
        return latestByStation(getAll());
    }

    /**
     * Campione più recente per ogni stazione tra quelli forniti.
     */
    public static List<StationSample> latestByStation(List<StationSample> samples) {
        Map<String, StationSample> latest = new LinkedHashMap<>();
        samples.stream()
                .sorted(Comparator.comparing(StationSample::stationId))
                .forEach(s -> latest.merge(s.stationId(), s,
                        (a, b) -> b.date().isAfter(a.date()) ? b : a));
        return List.copyOf(latest.values());
    }

    /**
     * Forza la rigenerazione completa del dataset storico.
     */
    public synchronized void regenerate() {
        cached = generateHistorical();
        logger.info("Dataset rigenerato: {} campioni", cached.size());
    }

    /**
     * Aggiorna i campioni della giornata odierna con valori simulati "real-time".
     *
     * Se la cache non è ancora caricata non fa nulla. Il seed variabile fa sì
     * che ogni aggiornamento produca valori leggermente diversi, come sensori
     * che inviano misure continue. I campioni storici restano intatti.
     */
    @Scheduled(fixedRateString = "${waterquality.simulation.live-refresh-ms:10000}")
    public void updateLiveData() {
        if (cached == null) return;

        synchronized (this) {
            LocalDate today = LocalDate.now(clock);
            long liveSeed = clock.millis();

            StationSimulator liveSimulator = new StationSimulator(
                    properties.getSeed(),
                    liveSeed,
                    today,
                    1,
                    properties.getStations()
            );
            List<StationSample> live = liveSimulator.generate();

            List<StationSample> updated = new ArrayList<>(cached);
            updated.removeIf(s -> s.date().equals(today));
            updated.addAll(live);

            cached = List.copyOf(updated);
            if (today.isAfter(maxDate)) {
                maxDate = today;
                logger.info("Nuovo giorno di campionamento: maxDate aggiornata a {}", today);
            }
            logger.debug("Campioni live aggiornati per {}: {} stazioni", today, live.size());
        }
    }

    public LocalDate getMinDate() {
        return minDate;
    }

    public LocalDate getMaxDate() {
        return maxDate;
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private void ensureDataLoaded() {
        if (cached == null) {
            synchronized (this) {
                if (cached == null) {
                    cached = generateHistorical();
                    logger.info("Dataset storico generato: {} campioni, {} stazioni, dal {} al {}",
                            cached.size(), properties.getStations(), minDate, maxDate);
                }
            }
        }
    }

    private List<StationSample> generateHistorical() {
        int days = (int) ChronoUnit.DAYS.between(minDate, maxDate) + 1;

        StationSimulator simulator = new StationSimulator(
                properties.getSeed(),
                minDate,
                days,
                properties.getStations()
        );
        return List.copyOf(simulator.generate());
    }
}
