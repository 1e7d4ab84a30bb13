package it.floro.waterquality.wqi;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Calcolatore del Water Quality Index secondo la formula CPCB.
 *
 * Flusso di calcolo:
 * 1. Validazione: ogni ingresso deve essere finito, coliformi fecali > 0
 * 2. Sotto-indici: funzioni a tratti per DO, FC, pH, BOD, vincolate in [0, 100]
 * 3. Pesatura: DO 0.31, FC 0.28, pH 0.22, BOD 0.19 ({@link CpcbStandard})
 * 4. Somma: punteggio composito, NON vincolato
 * 5. Classificazione: banda CPCB tramite {@link WaterQualityClass#of(double)}
 *
 * Il servizio è privo di stato: può essere invocato in parallelo da più thread
 * senza sincronizzazione e, a parità di ingresso, restituisce sempre lo stesso risultato.
 */
@Service
public class WqiCalculator {

    // ========================================================================
    // RANGE REALISTICI PER LA DIAGNOSTICA
    // ========================================================================

    private static final double DO_MAX_REALISTIC = 20.0;            // mg/L
    private static final double FC_MAX_REALISTIC = 1_000_000.0;     // MPN/100mL
    private static final double PH_MAX = 14.0;
    private static final double BOD_MAX_REALISTIC = 100.0;          // mg/L
    private static final double TEMP_MAX_REALISTIC = 50.0;          // °C

    // ========================================================================
    // CALCOLO WQI
    // ========================================================================

    /**
     * Calcola il WQI con la temperatura dell'acqua di default (25 °C).
     */
    public WqiResult calculateWQI(double ph, double bod, double dissolvedOxygen, double fecalColiform) {
        return calculate(new ParameterReading(ph, bod, dissolvedOxygen, fecalColiform));
    }

    public WqiResult calculateWQI(double ph, double bod, double dissolvedOxygen, double fecalColiform,
                                  double waterTemperature) {
        return calculate(new ParameterReading(ph, bod, dissolvedOxygen, fecalColiform, waterTemperature));
    }

    /**
     * Calcola il WQI per una lettura.
     *
     * @param reading lettura dei parametri
     * @return risultato con punteggio, sotto-indici e classificazione
     * @throws InvalidParameterException se la lettura manca, un valore non è finito o fecalColiform <= 0
     */
    public WqiResult calculate(ParameterReading reading) {
        if (reading == null) {
            throw new InvalidParameterException("lettura mancante");
        }
        requireValid(reading);

        SubIndices subIndices = new SubIndices(
                phSubIndex(reading.ph()),
                bodSubIndex(reading.bod()),
                dissolvedOxygenSubIndex(reading.dissolvedOxygen()),
                fecalColiformSubIndex(reading.fecalColiform())
        );
        WeightedIndices weighted = subIndices.weighted();
        double wqi = weighted.total();

        return new WqiResult(wqi, subIndices, weighted, WaterQualityClass.of(wqi));
    }

    /**
     * Calcola il WQI per un lotto di letture, mantenendo l'ordine.
     *
     * @throws InvalidParameterException alla prima lettura non valida o mancante, con l'indice
     *         nel messaggio e il parametro rifiutato della lettura originale
     */
    public List<WqiResult> calculateAll(List<ParameterReading> readings) {
        List<WqiResult> out = new ArrayList<>(readings.size());
        for (int i = 0; i < readings.size(); i++) {
            try {
                out.add(calculate(readings.get(i)));
            } catch (InvalidParameterException e) {
                throw new InvalidParameterException("Lettura #" + i + ": ", e);
            }
        }
        return out;
    }

    /**
     * Classifica un punteggio già calcolato.
     */
    public WaterQualityClass classify(double wqi) {
        return WaterQualityClass.of(wqi);
    }

    // ========================================================================
    // DIAGNOSTICA
    // ========================================================================

    /**
     * Verifica che i parametri cadano in range realistici.
     * Non solleva eccezioni: restituisce l'elenco dei problemi trovati.
     */
    public ValidationResult validateParameters(ParameterReading reading) {
        List<String> issues = new ArrayList<>();

        checkRange(issues, "Dissolved Oxygen", reading.dissolvedOxygen(), 0, DO_MAX_REALISTIC, "mg/l");
        checkRange(issues, "Fecal Coliform", reading.fecalColiform(), 0, FC_MAX_REALISTIC, "MPN/100ml");
        checkRange(issues, "pH", reading.ph(), 0, PH_MAX, "");
        checkRange(issues, "BOD", reading.bod(), 0, BOD_MAX_REALISTIC, "mg/l");
        checkRange(issues, "Temperature", reading.waterTemperature(), 0, TEMP_MAX_REALISTIC, "°C");

        return ValidationResult.of(issues);
    }

    private static void checkRange(List<String> issues, String name, double value,
                                   double min, double max, String unit) {
        if (!Double.isFinite(value)) {
            issues.add(name + " is not a finite number");
        } else if (value < min || value > max) {
            String range = String.format(java.util.Locale.ROOT, "%s-%s", fmt(min), fmt(max));
            issues.add(name + " out of realistic range (" + range + (unit.isEmpty() ? "" : " " + unit) + ")");
        }
    }

    private static String fmt(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }

    // ========================================================================
    // SOTTO-INDICI
    // ========================================================================

    /**
     * Sotto-indice ossigeno disciolto, calcolato sulla percentuale di saturazione
     * rispetto a 6.5 mg/L. Fuori da [0, 140]% si usa il valore della formula al bordo.
     */
    static double dissolvedOxygenSubIndex(double dissolvedOxygen) {
        double p = dissolvedOxygen / CpcbStandard.DO_SATURATION_MG_L * 100.0;
        p = Math.max(0.0, Math.min(140.0, p));

        double subIndex;
        if (p <= 40) {
            subIndex = 0.18 + 0.66 * p;
        } else if (p <= 100) {
            subIndex = -13.55 + 1.17 * p;
        } else {
            subIndex = 163.34 - 0.62 * p;
        }
        return clamp100(subIndex);
    }

    /**
     * Sotto-indice coliformi fecali (scala logaritmica). Richiede un valore positivo,
     * garantito da {@link #requireValid}.
     */
    static double fecalColiformSubIndex(double fecalColiform) {
        double subIndex;
        if (fecalColiform <= 1_000) {
            subIndex = 97.2 - 26.6 * Math.log10(fecalColiform);
        } else if (fecalColiform <= 100_000) {
            subIndex = 42.33 - 7.75 * Math.log10(fecalColiform);
        } else {
            subIndex = 2.0;
        }
        return clamp100(subIndex);
    }

    static double phSubIndex(double ph) {
        double subIndex;
        if (ph < 2 || ph > 12) {
            subIndex = 0.0;
        } else if (ph <= 5) {
            subIndex = 16.1 + 7.35 * ph;
        } else if (ph <= 7.3) {
            subIndex = -142.67 + 33.5 * ph;
        } else if (ph <= 10) {
            subIndex = 316.96 - 29.85 * ph;
        } else {
            subIndex = 96.17 - 8.0 * ph;
        }
        return clamp100(subIndex);
    }

    /**
     * Sotto-indice BOD. Un BOD negativo viene valutato come 0 mg/L.
     */
    static double bodSubIndex(double bod) {
        double b = Math.max(0.0, bod);
        double subIndex;
        if (b <= 10) {
            subIndex = 96.67 - 7.0 * b;
        } else if (b <= 30) {
            subIndex = 38.9 - 1.23 * b;
        } else {
            subIndex = 2.0;
        }
        return clamp100(subIndex);
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private static void requireValid(ParameterReading r) {
        requireFinite("ph", r.ph());
        requireFinite("bod", r.bod());
        requireFinite("dissolvedOxygen", r.dissolvedOxygen());
        requireFinite("fecalColiform", r.fecalColiform());
        requireFinite("waterTemperature", r.waterTemperature());
        if (r.fecalColiform() <= 0) {
            throw new InvalidParameterException("fecalColiform", r.fecalColiform(),
                    "deve essere > 0 (logaritmo non definito)");
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException(name, value, "valore non finito");
        }
    }

    private static double clamp100(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
