package it.floro.waterquality.simulator;

import it.floro.waterquality.domain.StationSample;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Simulatore di campioni realistici per una rete di stazioni di monitoraggio idrico.
 *
 * Responsabilità:
 * - Generazione di un StationSample per stazione e per giorno su un intervallo definito
 * - Profili stazione invarianti: codice, nome, distretto, tipo di corpo idrico, coordinate, carico inquinante
 * - Ciclo stagionale dei monsoni (giugno-settembre): più coliformi, BOD e torbidità
 * - Anomalie autocorrelate (AR(1)) di temperatura e carico inquinante
 * - Eventi di inquinamento rari (scarichi) che peggiorano DO, BOD e coliformi
 *
 * Seed fisso: stesso seed, stessi parametri, stesso dataset. I profili stazione
 * dipendono da un seed separato, così un aggiornamento live con seed diverso
 * mantiene le stesse stazioni dello storico.
 *
 * I coliformi fecali generati sono sempre >= 1 MPN/100mL, quindi ogni campione
 * è un ingresso valido per il calcolatore WQI.
 */
public class StationSimulator {

    private final Random rnd;
    private final Random profileRnd;
    private final LocalDate start;
    private final int days;
    private final int stations;

    // ========================================================================
    // PARAMETRI DI CONFIGURAZIONE GLOBALI
    // ========================================================================

    private static final String[] DISTRICTS = {
            "Mumbai", "Pune", "Nagpur", "Nashik", "Aurangabad", "Kolhapur", "Thane", "Solapur"
    };
    private static final double[][] DISTRICT_CENTERS = {
            {19.076, 72.877}, {18.520, 73.856}, {21.146, 79.088}, {19.997, 73.789},
            {19.876, 75.343}, {16.705, 74.243}, {19.218, 72.978}, {17.659, 75.906}
    };
    private static final String[] WATER_BODY_TYPES = {"River", "Lake", "Reservoir", "Groundwater", "Coastal"};
    private static final String[] RIVERS = {"Godavari", "Krishna", "Bhima", "Mula-Mutha", "Tapi", "Wainganga", "Panchganga", "Mithi"};

    /** Probabilità giornaliera di un evento di inquinamento per stazione. */
    private static final double POLLUTION_EVENT_PROB = 0.01;

    // ===== PARAMETRI AR(1) =====
    private static final double PHI_TEMP = 0.6, SIGMA_TEMP = 0.8;
    private static final double PHI_LOAD = 0.8, SIGMA_LOAD = 0.05;

    // ========================================================================
    // PROFILI STAZIONE (invarianti)
    // ========================================================================

    private String[] stationId;
    private String[] stationName;
    private String[] stationDistrict;
    private String[] stationType;
    private double[] stationLat;
    private double[] stationLon;
    /** Carico inquinante di base in [0, 1]: 0 = acqua pulita, 1 = fortemente inquinata. */
    private double[] stationLoad;

    // ========================================================================
    // COSTRUTTORE
    // ========================================================================

    /**
     * Simulatore con un unico seed per profili e campioni.
     */
    public StationSimulator(long seed, LocalDate start, int days, int stations) {
        this(seed, seed, start, days, stations);
    }

    /**
     * @param profileSeed seed dei profili stazione (anagrafica, coordinate, carico di base)
     * @param sampleSeed seed dei campioni giornalieri
     * @param start primo giorno simulato
     * @param days numero di giorni (>= 0)
     * @param stations numero di stazioni (>= 0)
     */
    public StationSimulator(long profileSeed, long sampleSeed, LocalDate start, int days, int stations) {
        if (days < 0 || stations < 0) {
            throw new IllegalArgumentException("days e stations devono essere >= 0");
        }
        this.profileRnd = new Random(profileSeed);
        this.rnd = new Random(sampleSeed);
        this.start = start;
        this.days = days;
        this.stations = stations;
        initStationProfiles();
    }

    // ========================================================================
    // METODI UTILITY PRIVATI - MATH BASICS
    // ========================================================================

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private double gauss(double mean, double std) {
        return mean + std * rnd.nextGaussian();
    }

    private double profileGauss(double std) {
        return std * profileRnd.nextGaussian();
    }

    /**
     * Intensità del monsone [0, 1] per il giorno dell'anno: campana centrata a fine luglio.
     */
    static double monsoonIntensity(int dayOfYear) {
        double z = (dayOfYear - 210) / 40.0;
        return Math.exp(-0.5 * z * z);
    }

    // ========================================================================
    // INIZIALIZZAZIONE PROFILI
    // ========================================================================

    private void initStationProfiles() {
        stationId       = new String[stations];
        stationName     = new String[stations];
        stationDistrict = new String[stations];
        stationType     = new String[stations];
        stationLat      = new double[stations];
        stationLon      = new double[stations];
        stationLoad     = new double[stations];

        for (int s = 0; s < stations; s++) {
            // Ogni distretto riceve almeno una stazione prima di ripetersi
            int d = s < DISTRICTS.length ? s : profileRnd.nextInt(DISTRICTS.length);
            String type = WATER_BODY_TYPES[profileRnd.nextInt(WATER_BODY_TYPES.length)];

            stationId[s]       = String.format("MH-%03d", s + 1);
            stationDistrict[s] = DISTRICTS[d];
            stationType[s]     = type;
            stationName[s]     = stationName(type, DISTRICTS[d], s);
            stationLat[s]      = DISTRICT_CENTERS[d][0] + profileGauss(0.15);
            stationLon[s]      = DISTRICT_CENTERS[d][1] + profileGauss(0.15);
            stationLoad[s]     = baseLoad(type, DISTRICTS[d]);
        }
    }

    private String stationName(String type, String district, int index) {
        return switch (type) {
            case "River"       -> RIVERS[profileRnd.nextInt(RIVERS.length)] + " River at " + district;
            case "Lake"        -> district + " Lake " + (index + 1);
            case "Reservoir"   -> district + " Reservoir " + (index + 1);
            case "Groundwater" -> district + " Well " + (index + 1);
            default            -> district + " Coast " + (index + 1);
        };
    }

    /**
     * Carico inquinante di base: le aree urbane e i corpi idrici costieri partono più sporchi,
     * pozzi e invasi più puliti.
     */
    private double baseLoad(String type, String district) {
        double typeBias = switch (type) {
            case "River"       -> 0.35;
            case "Coastal"     -> 0.45;
            case "Lake"        -> 0.30;
            case "Reservoir"   -> 0.15;
            default            -> 0.10;  // Groundwater
        };
        double urbanBias = switch (district) {
            case "Mumbai", "Thane" -> 0.25;
            case "Pune", "Nagpur"  -> 0.10;
            default                -> 0.0;
        };
        return clamp(typeBias + urbanBias + profileGauss(0.1), 0.0, 1.0);
    }

    // ========================================================================
    // METODO PRINCIPALE: GENERAZIONE DATASET
    // ========================================================================

    /**
     * Genera il dataset: days × stations campioni, ordinati per giorno e poi per stazione.
     */
    public List<StationSample> generate() {
        List<StationSample> out = new ArrayList<>(days * stations);

        double tempAnom = 0.0;
        double[] loadAnom = new double[stations];

        for (int d = 0; d < days; d++) {
            LocalDate date = start.plusDays(d);
            int doy = date.getDayOfYear();

            // Temperatura stagionale: picco a maggio, minimo a gennaio
            double tempSeason = 26.0 + 5.0 * Math.sin(2 * Math.PI * (doy - 45) / 365.0);
            tempAnom = PHI_TEMP * tempAnom + gauss(0, SIGMA_TEMP);
            double monsoon = monsoonIntensity(doy);

            for (int s = 0; s < stations; s++) {
                loadAnom[s] = PHI_LOAD * loadAnom[s] + gauss(0, SIGMA_LOAD);
                double load = clamp(stationLoad[s] + loadAnom[s], 0.0, 1.0);
                boolean event = rnd.nextDouble() < POLLUTION_EVENT_PROB;

                double temp = clamp(tempSeason - 3.0 * monsoon + tempAnom + gauss(0, 0.5), 10.0, 38.0);

                // Ossigeno disciolto: cala con temperatura e carico organico
                double dissolvedOxygen = 8.2 - 0.12 * (temp - 20) - 5.0 * load + gauss(0, 0.35);

                // BOD: cresce con il carico (quadratico) e con il dilavamento monsonico
                double bod = 0.8 + 20.0 * load * load + 1.5 * monsoon + gauss(0, 0.4);

                // Coliformi: scala logaritmica
                double log10Fc = 0.6 + 4.2 * load + 0.6 * monsoon + gauss(0, 0.25);

                // pH: leggermente alcalino, acidificato da carichi elevati
                double ph = 7.5 - 0.9 * load * load + gauss(0, 0.2);

                double turbidity = 1.5 + 25.0 * monsoon * (0.3 + load) + 6.0 * load + Math.abs(gauss(0, 1.0));

                if (event) {
                    dissolvedOxygen *= 0.4;
                    bod *= 2.5;
                    log10Fc += 1.3;
                    turbidity *= 2.0;
                }

                out.add(new StationSample(
                        date,
                        stationDistrict[s],
                        stationId[s],
                        stationName[s],
                        stationType[s],
                        round(stationLat[s], 5),
                        round(stationLon[s], 5),
                        round(clamp(ph, 4.0, 10.5), 2),
                        round(clamp(bod, 0.2, 80.0), 2),
                        round(clamp(dissolvedOxygen, 0.2, 14.0), 2),
                        Math.max(1.0, Math.round(Math.pow(10, clamp(log10Fc, 0.0, 6.0)))),
                        round(temp, 1),
                        round(clamp(turbidity, 0.1, 300.0), 1)
                ));
            }
        }
        return out;
    }

    private static double round(double v, int decimals) {
        double f = Math.pow(10, decimals);
        return Math.round(v * f) / f;
    }
}
