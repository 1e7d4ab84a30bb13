package it.floro.waterquality.domain;

import it.floro.waterquality.wqi.ParameterReading;

import java.time.LocalDate;

/**
 * Record che rappresenta un campione giornaliero raccolto da una stazione
 * di monitoraggio della qualità dell'acqua.
 *
 * Raggruppa anagrafica della stazione e parametri misurati, in modo da
 * supportare sia il calcolo del WQI sia le aggregazioni per distretto e tipo di corpo idrico.
 */
public record StationSample(
        // ============ INFORMAZIONI DI TRACCIAMENTO ============
        LocalDate date,                     // Data del campionamento
        String district,                    // Distretto amministrativo (es. "Pune", "Nagpur")
        String stationId,                   // Codice univoco della stazione (es. "MH-001")
        String stationName,                 // Nome descrittivo della stazione
        String waterBodyType,               // Tipo di corpo idrico: "River", "Lake", "Reservoir", ...

        // ============ POSIZIONE ============
        double latitude,
        double longitude,

        // ============ PARAMETRI CPCB ============
        double ph,                          // pH
        double bod,                         // BOD: mg/L
        double dissolvedOxygen,             // Ossigeno disciolto: mg/L
        double fecalColiform,               // Coliformi fecali: MPN/100mL

        // ============ PARAMETRI DI CONTESTO ============
        double waterTemperature,            // Temperatura dell'acqua: °C
        double turbidity                    // Torbidità: NTU
) {

    /**
     * Estrae la lettura dei parametri da passare al calcolatore WQI.
     */
    public ParameterReading toReading() {
        return new ParameterReading(ph, bod, dissolvedOxygen, fecalColiform, waterTemperature);
    }
}
