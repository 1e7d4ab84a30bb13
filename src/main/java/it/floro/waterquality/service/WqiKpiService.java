package it.floro.waterquality.service;

import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.web.dto.StationSummary;
import it.floro.waterquality.wqi.InvalidParameterException;
import it.floro.waterquality.wqi.SubIndices;
import it.floro.waterquality.wqi.WaterQualityClass;
import it.floro.waterquality.wqi.WqiCalculator;
import it.floro.waterquality.wqi.WqiResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Service centralizzato per le aggregazioni WQI sui campioni delle stazioni.
 *
 * Fornisce tre livelli di analisi:
 * 1. Valore aggregato: media su tutto il dataset filtrato
 * 2. Serie temporali: mappe data → media giornaliera, anno → media annuale
 * 3. Disaggregazioni: per distretto, per tipo di corpo idrico, per classe CPCB
 *
 * Il calcolo del singolo WQI è delegato a {@link WqiCalculator}. I campioni
 * rifiutati dal calcolatore vengono esclusi dalle medie e segnalati nel log.
 */
@Service
public class WqiKpiService {

    private static final Logger logger = LoggerFactory.getLogger(WqiKpiService.class);

    private final WqiCalculator calculator;

    public WqiKpiService(WqiCalculator calculator) {
        this.calculator = calculator;
    }

    // ========================================================================
    // SEZIONE 1: VALORI AGGREGATI
    // ========================================================================

    /**
     * WQI medio sul dataset.
     *
     * @return media dei WQI validi (0.0 se nessun campione valido)
     */
    public double averageWqi(List<StationSample> samples) {
        return safeAverage(samples, this::wqiOrNaN);
    }

    /**
     * Media di un sotto-indice non pesato.
     *
     * @param parameter "ph", "bod", "dissolvedOxygen" o "fecalColiform"
     * @throws IllegalArgumentException se il parametro non è un sotto-indice
     */
    public double averageSubIndex(List<StationSample> samples, String parameter) {
        if (!SubIndices.NAMES.contains(parameter)) {
            throw new IllegalArgumentException("Sotto-indice sconosciuto: " + parameter);
        }
        return safeAverage(samples, s -> {
            WqiResult r = resultOrNull(s);
            return r != null ? r.subIndices().get(parameter) : Double.NaN;
        });
    }

    // ========================================================================
    // SEZIONE 2: SERIE TEMPORALI
    // ========================================================================

    public Map<LocalDate, Double> dailyWqiSeries(List<StationSample> samples) {
        return groupedAverage(samples, StationSample::date);
    }

    public Map<Integer, Double> annualWqiSeries(List<StationSample> samples) {
        return groupedAverage(samples, s -> s.date().getYear());
    }

    // ========================================================================
    // SEZIONE 3: DISAGGREGAZIONI
    // ========================================================================

    public Map<String, Double> wqiByDistrict(List<StationSample> samples) {
        return groupedAverage(samples, StationSample::district);
    }

    public Map<String, Double> wqiByWaterBodyType(List<StationSample> samples) {
        return groupedAverage(samples, StationSample::waterBodyType);
    }

    /**
     * Numero di campioni per banda CPCB. Tutte le bande sono presenti, anche a zero.
     */
    public Map<WaterQualityClass, Long> classDistribution(List<StationSample> samples) {
        Map<WaterQualityClass, Long> out = new EnumMap<>(WaterQualityClass.class);
        for (WaterQualityClass c : WaterQualityClass.values()) {
            out.put(c, 0L);
        }
        for (StationSample s : samples) {
            WqiResult r = resultOrNull(s);
            if (r != null) {
                out.merge(r.band(), 1L, Long::sum);
            }
        }
        return out;
    }

    // ========================================================================
    // SEZIONE 4: STAZIONI
    // ========================================================================

    /**
     * Ultimo risultato WQI di ogni stazione presente nei campioni.
     */
    public List<StationSummary> stationSummaries(List<StationSample> samples) {
        List<StationSummary> out = new ArrayList<>();
        for (StationSample s : StationDataService.latestByStation(samples)) {
            WqiResult r = resultOrNull(s);
            if (r != null) {
                out.add(new StationSummary(
                        s.stationId(), s.stationName(), s.district(), s.waterBodyType(),
                        s.latitude(), s.longitude(), s.date(), r));
            }
        }
        return out;
    }

    /**
     * Le n stazioni con il WQI più basso sull'ultimo campione disponibile.
     */
    public List<StationSummary> worstStations(List<StationSample> samples, int n) {
        return stationSummaries(samples).stream()
                .sorted(Comparator.comparingDouble(s -> s.result().wqi()))
                .limit(Math.max(0, n))
                .collect(Collectors.toList());
    }

    // ========================================================================
    // SEZIONE 5: METODI HELPER PRIVATI
    // ========================================================================

    private WqiResult resultOrNull(StationSample s) {
        try {
            return calculator.calculate(s.toReading());
        } catch (InvalidParameterException e) {
            logger.warn("Campione escluso ({} del {}): {}", s.stationId(), s.date(), e.getMessage());
            return null;
        }
    }

    private double wqiOrNaN(StationSample s) {
        WqiResult r = resultOrNull(s);
        return r != null ? r.wqi() : Double.NaN;
    }

    /**
     * Media che esclude NaN e infiniti; 0.0 se non resta nulla.
     */
    private static double safeAverage(List<StationSample> samples, ToDoubleFunction<StationSample> f) {
        return samples.stream()
                .mapToDouble(f)
                .filter(Double::isFinite)
                .average()
                .orElse(0.0);
    }

    /**
     * Media del WQI per chiave di raggruppamento, in una TreeMap ordinata per chiave.
     * I gruppi senza campioni validi non compaiono.
     */
    private <K extends Comparable<? super K>> Map<K, Double> groupedAverage(List<StationSample> samples,
                                                                            Function<StationSample, K> key) {
        Map<K, List<StationSample>> grouped = samples.stream()
                .collect(Collectors.groupingBy(key));

        Map<K, Double> out = new TreeMap<>();
        for (Map.Entry<K, List<StationSample>> e : grouped.entrySet()) {
            double[] values = e.getValue().stream()
                    .mapToDouble(this::wqiOrNaN)
                    .filter(Double::isFinite)
                    .toArray();
            if (values.length > 0) {
                double sum = 0;
                for (double v : values) sum += v;
                out.put(e.getKey(), sum / values.length);
            }
        }
        return out;
    }
}
