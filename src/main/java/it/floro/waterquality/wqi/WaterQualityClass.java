package it.floro.waterquality.wqi;

/**
 * Bande di qualità CPCB, ordinate dalla migliore alla peggiore.
 *
 * Ogni banda porta con sé la classe CPCB e lo stato di inquinamento associati.
 * Le soglie sono in {@link CpcbStandard}; un valore esattamente sulla soglia
 * appartiene alla banda superiore.
 */
public enum WaterQualityClass {

    GOOD_TO_EXCELLENT("Good to Excellent", "A", "Non Polluted"),
    MEDIUM_TO_GOOD("Medium to Good", "B", "Non Polluted"),
    BAD("Bad", "C", "Polluted"),
    BAD_TO_VERY_BAD("Bad to Very Bad", "D/E", "Heavily Polluted");

    private final String label;
    private final String cpcbClass;
    private final String status;

    WaterQualityClass(String label, String cpcbClass, String status) {
        this.label = label;
        this.cpcbClass = cpcbClass;
        this.status = status;
    }

    /**
     * Classifica un punteggio WQI composito.
     *
     * @param score punteggio composito (non clampato)
     * @return banda di appartenenza
     * @throws InvalidParameterException se il punteggio è NaN
     */
    public static WaterQualityClass of(double score) {
        if (Double.isNaN(score)) {
            throw new InvalidParameterException("wqi", score, "il punteggio non è un numero");
        }
        if (score >= CpcbStandard.GOOD_TO_EXCELLENT_MIN) return GOOD_TO_EXCELLENT;
        if (score >= CpcbStandard.MEDIUM_TO_GOOD_MIN) return MEDIUM_TO_GOOD;
        if (score >= CpcbStandard.BAD_MIN) return BAD;
        return BAD_TO_VERY_BAD;
    }

    /**
     * Classe MPCB (Maharashtra Pollution Control Board) per il punteggio.
     * A-I sopra 63, A-II fino a 38, poi A-III/A-IV separate a 25.
     */
    public static String mpcbClassOf(double score) {
        if (score >= CpcbStandard.GOOD_TO_EXCELLENT_MIN) return "A-I";
        if (score >= CpcbStandard.BAD_MIN) return "A-II";
        return score >= CpcbStandard.MPCB_A_III_MIN ? "A-III" : "A-IV";
    }

    public String label() {
        return label;
    }

    public String cpcbClass() {
        return cpcbClass;
    }

    public String status() {
        return status;
    }
}
