package it.floro.waterquality.wqi;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Sotto-indici moltiplicati per i rispettivi pesi CPCB.
 */
public record WeightedIndices(
        double ph,
        double bod,
        double dissolvedOxygen,
        double fecalColiform
) {

    /**
     * Somma nell'ordine DO, FC, pH, BOD: è il punteggio WQI composito.
     */
    @JsonIgnore
    public double total() {
        return dissolvedOxygen + fecalColiform + ph + bod;
    }
}
