package it.floro.waterquality.domain;

import java.util.Locale;
import java.util.UUID;

/**
 * Record che rappresenta un alert sul monitoraggio della qualità dell'acqua.
 *
 * Lo stesso record descrive sia la configurazione (soglia e condizione) sia
 * l'alert scattato, che in più porta stazione, gravità e messaggio.
 */
public record Alert(
        String id,                          // Identificatore univoco (UUID)
        String parameter,                   // Parametro: "ph", "dissolvedOxygen", "bod", "fecalColiform", "waterTemperature", "turbidity", "wqi"
        double threshold,                   // Valore soglia di attivazione
        String condition,                   // Condizione di trigger: "ABOVE" (supera) o "BELOW" (scende sotto)
        String district,                    // Distretto monitorato, "Tutti" per tutti
        String stationId,                   // Stazione che ha fatto scattare l'alert (vuoto nelle configurazioni)
        AlertSeverity severity,             // Gravità (null nelle configurazioni)
        boolean active,                     // Indica se l'alert è attivo
        String message                      // Messaggio descrittivo dell'alert
) {

    public static final String ALL_DISTRICTS = "Tutti";

    /**
     * Crea un alert scattato per una stazione.
     *
     * @param config configurazione che ha generato l'alert
     * @param sample campione che ha superato la soglia
     * @param currentValue valore misurato
     * @param severity gravità calcolata dallo scostamento
     * @return nuovo Alert attivo con messaggio formattato
     */
    public static Alert createTriggered(Alert config, StationSample sample,
                                        double currentValue, AlertSeverity severity) {
        String msg = String.format(Locale.ROOT,
                "Alert %s: valore %.2f %s soglia %.2f presso %s (%s)",
                config.parameter(),
                currentValue,
                "ABOVE".equals(config.condition()) ? "supera" : "sotto",
                config.threshold(),
                sample.stationName(),
                sample.district()
        );

        return new Alert(
                UUID.randomUUID().toString(),
                config.parameter(),
                config.threshold(),
                config.condition(),
                sample.district(),
                sample.stationId(),
                severity,
                true,
                msg
        );
    }
}
