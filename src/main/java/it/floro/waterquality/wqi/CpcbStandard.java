package it.floro.waterquality.wqi;

/**
 * Costanti dello standard CPCB (Central Pollution Control Board) per il calcolo del WQI.
 *
 * Unica fonte autorevole per pesi, costante di saturazione e soglie di classificazione:
 * nessun altro punto del codice deve ridefinire questi valori.
 *
 * Riferimento: Maharashtra Water Quality Status Report 2023-24 (MPCB),
 * NSF-WQI modificato da CPCB per gli standard indiani.
 */
public final class CpcbStandard {

    // ========================================================================
    // PESI DEI SOTTO-INDICI
    // ========================================================================

    public static final double WEIGHT_DISSOLVED_OXYGEN = 0.31;
    public static final double WEIGHT_FECAL_COLIFORM   = 0.28;
    public static final double WEIGHT_PH               = 0.22;
    public static final double WEIGHT_BOD              = 0.19;

    /** Tolleranza ammessa sulla somma dei pesi. */
    public static final double WEIGHT_SUM_TOLERANCE = 1e-9;

    // ========================================================================
    // COSTANTI DI CALCOLO
    // ========================================================================

    /**
     * Concentrazione di riferimento per la saturazione dell'ossigeno disciolto (mg/L).
     * Fissa per lo standard, non dipende dalla temperatura.
     */
    public static final double DO_SATURATION_MG_L = 6.5;

    /** Temperatura dell'acqua assunta quando il campione non la riporta (°C). */
    public static final double DEFAULT_WATER_TEMPERATURE_C = 25.0;

    // ========================================================================
    // SOGLIE DI CLASSIFICAZIONE (estremo inferiore incluso nella banda)
    // ========================================================================

    public static final double GOOD_TO_EXCELLENT_MIN = 63.0;
    public static final double MEDIUM_TO_GOOD_MIN    = 50.0;
    public static final double BAD_MIN               = 38.0;

    /** Separa le classi MPCB A-III e A-IV all'interno della banda peggiore. */
    public static final double MPCB_A_III_MIN = 25.0;

    static {
        double sum = weightSum();
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new IllegalStateException("Somma dei pesi CPCB diversa da 1.0: " + sum);
        }
    }

    private CpcbStandard() {
    }

    /**
     * @return somma dei quattro pesi (1.0 a meno della tolleranza)
     */
    public static double weightSum() {
        return WEIGHT_DISSOLVED_OXYGEN + WEIGHT_FECAL_COLIFORM + WEIGHT_PH + WEIGHT_BOD;
    }
}
