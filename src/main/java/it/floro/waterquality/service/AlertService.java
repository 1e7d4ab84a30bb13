package it.floro.waterquality.service;

import it.floro.waterquality.domain.Alert;
import it.floro.waterquality.domain.AlertSeverity;
import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.wqi.InvalidParameterException;
import it.floro.waterquality.wqi.WqiCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service che gestisce il ciclo di vita degli alert sulla qualità dell'acqua.
 *
 * Responsabilità:
 * - Mantenere la configurazione degli alert (parametro, soglia, condizione, distretto)
 * - Valutare le configurazioni attive sull'ultimo campione di ogni stazione
 * - Assegnare la gravità in base allo scostamento dalla soglia
 *
 * Soglie predefinite (standard WHO/EPA):
 * pH fuori da [6.5, 8.5], ossigeno disciolto sotto 5 mg/L, temperatura sopra 30 °C,
 * torbidità sopra 5 NTU, più un alert sul WQI sotto la banda "Medium to Good".
 *
 * Gli alert configurati vivono in memoria: si perdono al riavvio.
 */
@Service
public class AlertService {

    private static final Logger logger = LoggerFactory.getLogger(AlertService.class);

    /** Parametri su cui è possibile configurare un alert. */
    public static final Set<String> SUPPORTED_PARAMETERS = Set.of(
            "ph", "bod", "dissolvedOxygen", "fecalColiform", "waterTemperature", "turbidity", "wqi");

    public static final String ABOVE = "ABOVE";
    public static final String BELOW = "BELOW";

    /** Scostamento relativo oltre il quale l'alert è WARNING. */
    private static final double WARNING_DEVIATION = 0.15;
    /** Scostamento relativo oltre il quale l'alert è CRITICAL. */
    private static final double CRITICAL_DEVIATION = 0.30;

    private final WqiCalculator calculator;

    private final Map<String, Alert> configuredAlerts = new ConcurrentHashMap<>();

    public AlertService(WqiCalculator calculator) {
        this.calculator = calculator;

        // ===== ALERT PRE-CONFIGURATI =====
        configure("1", "ph", 6.5, BELOW);
        configure("2", "ph", 8.5, ABOVE);
        configure("3", "dissolvedOxygen", 5.0, BELOW);
        configure("4", "waterTemperature", 30.0, ABOVE);
        configure("5", "turbidity", 5.0, ABOVE);
        configure("6", "wqi", 50.0, BELOW);
    }

    /**
     * Valuta tutti gli alert attivi sull'ultimo campione di ogni stazione.
     *
     * @param samples campioni da analizzare (tipicamente l'intero dataset o un suo filtro)
     * @return alert scattati, ordinati per gravità decrescente
     */
    public List<Alert> checkAlerts(List<StationSample> samples) {
        List<StationSample> latest = StationDataService.latestByStation(samples);
        List<Alert> triggered = new ArrayList<>();

        for (Alert config : configuredAlerts.values()) {
            if (!config.active()) continue;

            for (StationSample sample : latest) {
                if (!appliesTo(config, sample)) continue;

                double value = currentValue(config.parameter(), sample);
                if (Double.isNaN(value)) continue;

                if (evaluateCondition(value, config.threshold(), config.condition())) {
                    triggered.add(Alert.createTriggered(config, sample, value,
                            severity(value, config.threshold())));
                }
            }
        }

        triggered.sort((a, b) -> b.severity().compareTo(a.severity()));
        logger.debug("Valutati {} alert su {} stazioni: {} scattati",
                configuredAlerts.size(), latest.size(), triggered.size());
        return triggered;
    }

    /**
     * Salva una nuova configurazione di alert, attiva per default.
     *
     * @throws IllegalArgumentException se parametro o condizione non sono supportati
     */
    public Alert saveAlert(Alert alert) {
        if (alert.parameter() == null || !SUPPORTED_PARAMETERS.contains(alert.parameter())) {
            throw new IllegalArgumentException("Parametro non supportato: " + alert.parameter()
                    + " (ammessi: " + SUPPORTED_PARAMETERS + ")");
        }
        if (!ABOVE.equals(alert.condition()) && !BELOW.equals(alert.condition())) {
            throw new IllegalArgumentException("Condizione non supportata: " + alert.condition()
                    + " (ammesse: ABOVE, BELOW)");
        }
        if (!Double.isFinite(alert.threshold())) {
            throw new IllegalArgumentException("Soglia non valida: " + alert.threshold());
        }

        String district = alert.district() == null || alert.district().isBlank()
                ? Alert.ALL_DISTRICTS : alert.district();
        Alert saved = new Alert(UUID.randomUUID().toString(), alert.parameter(), alert.threshold(),
                alert.condition(), district, "", null, true, "");

        configuredAlerts.put(saved.id(), saved);
        logger.info("Nuovo alert configurato: {} {} {} ({})",
                saved.parameter(), saved.condition(), saved.threshold(), saved.district());
        return saved;
    }

    /**
     * Disattiva un alert configurato.
     *
     * @return l'alert disattivato, vuoto se l'id non esiste
     */
    public Optional<Alert> deactivate(String id) {
        Alert updated = configuredAlerts.computeIfPresent(id, (k, a) -> new Alert(
                a.id(), a.parameter(), a.threshold(), a.condition(), a.district(),
                a.stationId(), a.severity(), false, a.message()));
        return Optional.ofNullable(updated);
    }

    public Collection<Alert> getAllConfigured() {
        return List.copyOf(configuredAlerts.values());
    }

    // ========== METODI HELPER PRIVATI ==========

    private void configure(String id, String parameter, double threshold, String condition) {
        configuredAlerts.put(id, new Alert(id, parameter, threshold, condition,
                Alert.ALL_DISTRICTS, "", null, true, ""));
    }

    private static boolean appliesTo(Alert config, StationSample sample) {
        return Alert.ALL_DISTRICTS.equalsIgnoreCase(config.district())
                || config.district().equalsIgnoreCase(sample.district());
    }

    /**
     * Valore attuale del parametro sul campione; NaN se il WQI non è calcolabile.
     */
    private double currentValue(String parameter, StationSample s) {
        return switch (parameter) {
            case "ph" -> s.ph();
            case "bod" -> s.bod();
            case "dissolvedOxygen" -> s.dissolvedOxygen();
            case "fecalColiform" -> s.fecalColiform();
            case "waterTemperature" -> s.waterTemperature();
            case "turbidity" -> s.turbidity();
            case "wqi" -> wqiOrNaN(s);
            default -> Double.NaN;
        };
    }

    private double wqiOrNaN(StationSample s) {
        try {
            return calculator.calculate(s.toReading()).wqi();
        } catch (InvalidParameterException e) {
            logger.warn("WQI non calcolabile per {}: {}", s.stationId(), e.getMessage());
            return Double.NaN;
        }
    }

    private static boolean evaluateCondition(double value, double threshold, String condition) {
        return switch (condition) {
            case ABOVE -> value > threshold;
            case BELOW -> value < threshold;
            default -> false;
        };
    }

    /**
     * Gravità dallo scostamento relativo dalla soglia: oltre il 30% CRITICAL,
     * oltre il 15% WARNING, altrimenti INFO. Con soglia nulla ogni superamento è CRITICAL.
     */
    static AlertSeverity severity(double value, double threshold) {
        if (threshold == 0) return AlertSeverity.CRITICAL;
        double deviation = Math.abs(value - threshold) / Math.abs(threshold);
        if (deviation > CRITICAL_DEVIATION) return AlertSeverity.CRITICAL;
        if (deviation > WARNING_DEVIATION) return AlertSeverity.WARNING;
        return AlertSeverity.INFO;
    }
}
