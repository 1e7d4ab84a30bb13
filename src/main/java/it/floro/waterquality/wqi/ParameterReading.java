package it.floro.waterquality.wqi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lettura puntuale dei quattro parametri CPCB più la temperatura dell'acqua.
 *
 * Il record non valida i valori: la validazione avviene nel calcolatore
 * ({@link WqiCalculator#calculate}) o come diagnostica ({@link WqiCalculator#validateParameters}).
 * La deserializzazione JSON rifiuta invece i campi obbligatori mancanti,
 * per non trasformarli silenziosamente in 0.0.
 */
public record ParameterReading(
        double ph,                          // pH [0..14]
        double bod,                         // Domanda biochimica di ossigeno: mg/L
        double dissolvedOxygen,             // Ossigeno disciolto: mg/L
        double fecalColiform,               // Coliformi fecali: MPN/100mL, > 0
        double waterTemperature             // Temperatura: °C, solo contesto
) {

    /**
     * Lettura con temperatura di default (25 °C).
     */
    public ParameterReading(double ph, double bod, double dissolvedOxygen, double fecalColiform) {
        this(ph, bod, dissolvedOxygen, fecalColiform, CpcbStandard.DEFAULT_WATER_TEMPERATURE_C);
    }

    @JsonCreator
    public static ParameterReading fromJson(
            @JsonProperty("ph") Double ph,
            @JsonProperty("bod") Double bod,
            @JsonProperty("dissolvedOxygen") Double dissolvedOxygen,
            @JsonProperty("fecalColiform") Double fecalColiform,
            @JsonProperty("waterTemperature") Double waterTemperature) {
        return new ParameterReading(
                required("ph", ph),
                required("bod", bod),
                required("dissolvedOxygen", dissolvedOxygen),
                required("fecalColiform", fecalColiform),
                waterTemperature != null ? waterTemperature : CpcbStandard.DEFAULT_WATER_TEMPERATURE_C
        );
    }

    private static double required(String name, Double value) {
        if (value == null) {
            throw new InvalidParameterException("Parametro obbligatorio mancante: " + name);
        }
        return value;
    }
}
