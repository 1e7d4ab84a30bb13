package it.floro.waterquality.web.api;

import it.floro.waterquality.wqi.CpcbStandard;
import it.floro.waterquality.wqi.ParameterReading;
import it.floro.waterquality.wqi.ValidationResult;
import it.floro.waterquality.wqi.WaterQualityClass;
import it.floro.waterquality.wqi.WqiCalculator;
import it.floro.waterquality.wqi.WqiResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller REST che espone il calcolatore WQI.
 *
 * Mapping base: /api/wqi
 *
 * Endpoint:
 * - POST /api/wqi/calculate  → calcolo da corpo JSON
 * - GET  /api/wqi/calculate  → calcolo da query string
 * - POST /api/wqi/batch      → calcolo su lista di letture
 * - POST /api/wqi/validate   → diagnostica sui range realistici
 * - GET  /api/wqi/standard   → pesi e soglie CPCB in uso
 *
 * Gli errori di validazione (InvalidParameterException) diventano HTTP 400
 * tramite ApiExceptionHandler.
 */
@RestController
@RequestMapping("/api/wqi")
public class WqiController {

    private final WqiCalculator calculator;

    public WqiController(WqiCalculator calculator) {
        this.calculator = calculator;
    }

    /**
     * Calcola il WQI per una lettura.
     *
     * Richiesta (JSON):
     * {
     *   "ph": 7.6,
     *   "bod": 2.2,
     *   "dissolvedOxygen": 5.5,
     *   "fecalColiform": 6
     * }
     *
     * Risposta (JSON):
     * {
     *   "wqi": 83.17,
     *   "subIndices": {"ph": 90.1, "bod": 81.27, "dissolvedOxygen": 85.45, "fecalColiform": 76.5},
     *   "weightedIndices": {...},
     *   "classification": "Good to Excellent",
     *   "cpcbClass": "A",
     *   "status": "Non Polluted",
     *   "mpcbClass": "A-I"
     * }
     */
    @PostMapping("/calculate")
    public WqiResult calculate(@RequestBody ParameterReading reading) {
        return calculator.calculate(reading);
    }

    @GetMapping("/calculate")
    public WqiResult calculate(
            @RequestParam double ph,
            @RequestParam double bod,
            @RequestParam double dissolvedOxygen,
            @RequestParam double fecalColiform,
            @RequestParam(defaultValue = "25.0") double waterTemperature
    ) {
        return calculator.calculateWQI(ph, bod, dissolvedOxygen, fecalColiform, waterTemperature);
    }

    /**
     * Calcolo su lotto. Una sola lettura non valida fa fallire l'intera richiesta.
     */
    @PostMapping("/batch")
    public List<WqiResult> batch(@RequestBody List<ParameterReading> readings) {
        return calculator.calculateAll(readings);
    }

    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody ParameterReading reading) {
        return calculator.validateParameters(reading);
    }

    /**
     * Pesi e bande dello standard CPCB, per legenda e tooltip del frontend.
     */
    @GetMapping("/standard")
    public Map<String, Object> standard() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("dissolvedOxygen", CpcbStandard.WEIGHT_DISSOLVED_OXYGEN);
        weights.put("fecalColiform", CpcbStandard.WEIGHT_FECAL_COLIFORM);
        weights.put("ph", CpcbStandard.WEIGHT_PH);
        weights.put("bod", CpcbStandard.WEIGHT_BOD);

        double[] minima = {
                CpcbStandard.GOOD_TO_EXCELLENT_MIN,
                CpcbStandard.MEDIUM_TO_GOOD_MIN,
                CpcbStandard.BAD_MIN,
                0.0
        };
        List<Map<String, Object>> bands = new ArrayList<>();
        WaterQualityClass[] classes = WaterQualityClass.values();
        for (int i = 0; i < classes.length; i++) {
            Map<String, Object> band = new LinkedHashMap<>();
            band.put("classification", classes[i].label());
            band.put("cpcbClass", classes[i].cpcbClass());
            band.put("status", classes[i].status());
            band.put("minWqi", minima[i]);
            bands.add(band);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("weights", weights);
        out.put("doSaturationMgL", CpcbStandard.DO_SATURATION_MG_L);
        out.put("bands", bands);
        return out;
    }
}
