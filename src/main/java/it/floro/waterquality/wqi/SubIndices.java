package it.floro.waterquality.wqi;

import java.util.List;

/**
 * Sotto-indici non pesati, ciascuno già vincolato in [0, 100].
 */
public record SubIndices(
        double ph,
        double bod,
        double dissolvedOxygen,
        double fecalColiform
) {

    /** Nomi dei parametri, come chiavi JSON. */
    public static final List<String> NAMES = List.of("ph", "bod", "dissolvedOxygen", "fecalColiform");

    /**
     * Applica i pesi CPCB.
     */
    public WeightedIndices weighted() {
        return new WeightedIndices(
                ph * CpcbStandard.WEIGHT_PH,
                bod * CpcbStandard.WEIGHT_BOD,
                dissolvedOxygen * CpcbStandard.WEIGHT_DISSOLVED_OXYGEN,
                fecalColiform * CpcbStandard.WEIGHT_FECAL_COLIFORM
        );
    }

    /**
     * Valore del sotto-indice per nome di parametro (stessi nomi del JSON).
     *
     * @throws IllegalArgumentException se il nome non è tra ph, bod, dissolvedOxygen, fecalColiform
     */
    public double get(String parameter) {
        return switch (parameter) {
            case "ph" -> ph;
            case "bod" -> bod;
            case "dissolvedOxygen" -> dissolvedOxygen;
            case "fecalColiform" -> fecalColiform;
            default -> throw new IllegalArgumentException("Sotto-indice sconosciuto: " + parameter);
        };
    }
}
