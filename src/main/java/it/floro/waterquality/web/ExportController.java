package it.floro.waterquality.web;

import it.floro.waterquality.domain.StationSample;
import it.floro.waterquality.service.StationDataService;
import it.floro.waterquality.service.StationFilters;
import it.floro.waterquality.service.StationFilters.FilterParams;
import it.floro.waterquality.wqi.InvalidParameterException;
import it.floro.waterquality.wqi.WqiCalculator;
import it.floro.waterquality.wqi.WqiResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import static org.springframework.format.annotation.DateTimeFormat.ISO;

/**
 * Export CSV dei campioni filtrati, compatibile Excel ITA:
 * - Separatore di campo: ';'
 * - Decimali con virgola
 * - BOM UTF-8
 *
 * A ogni riga vengono aggiunti WQI e classificazione CPCB. I campioni che il
 * calcolatore rifiuta hanno le ultime colonne vuote.
 */
@RestController
public class ExportController extends BaseStationController {

    private static final Logger logger = LoggerFactory.getLogger(ExportController.class);

    private static final char DELIMITER = ';';
    private static final String NEWLINE = "\n";
    private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter FILENAME_DATE_FMT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final WqiCalculator calculator;

    public ExportController(StationDataService stationDataService,
                            StationFilters stationFilters,
                            WqiCalculator calculator) {
        super(stationDataService, stationFilters);
        this.calculator = calculator;
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> exportCsv(
            @RequestParam(required = false) String district,
            @RequestParam(required = false) String waterBodyType,
            @RequestParam(required = false) String stationId,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String periodo,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer quarter
    ) {
        // ===== STEP 1: FILTRI =====
        FilterParams params = resolveFilters(district, waterBodyType, stationId,
                startDate, endDate, periodo, year, month, quarter);
        List<StationSample> filtered = filter(params);

        // ===== STEP 2: CSV =====
        StringBuilder sb = new StringBuilder(256 + filtered.size() * 160);
        sb.append(String.join(String.valueOf(DELIMITER),
                "Data",
                "Distretto",
                "Stazione",
                "Nome stazione",
                "Corpo idrico",
                "Latitudine",
                "Longitudine",
                "pH",
                "BOD (mg/l)",
                "Ossigeno disciolto (mg/l)",
                "Coliformi fecali (MPN/100ml)",
                "Temperatura (°C)",
                "Torbidità (NTU)",
                "WQI",
                "Classificazione",
                "Classe CPCB"
        )).append(NEWLINE);

        for (StationSample s : filtered) {
            sb.append(s.date() != null ? s.date().format(DATE_FMT) : "")
                    .append(DELIMITER).append(safe(s.district()))
                    .append(DELIMITER).append(safe(s.stationId()))
                    .append(DELIMITER).append(safe(s.stationName()))
                    .append(DELIMITER).append(safe(s.waterBodyType()))
                    .append(DELIMITER).append(numIt(s.latitude(), 5))
                    .append(DELIMITER).append(numIt(s.longitude(), 5))
                    .append(DELIMITER).append(numIt(s.ph(), 2))
                    .append(DELIMITER).append(numIt(s.bod(), 2))
                    .append(DELIMITER).append(numIt(s.dissolvedOxygen(), 2))
                    .append(DELIMITER).append(numIt(s.fecalColiform(), 0))
                    .append(DELIMITER).append(numIt(s.waterTemperature(), 1))
                    .append(DELIMITER).append(numIt(s.turbidity(), 2));

            WqiResult r = resultOrNull(s);
            if (r != null) {
                sb.append(DELIMITER).append(numIt(r.wqi(), 2))
                        .append(DELIMITER).append(r.classification())
                        .append(DELIMITER).append(r.cpcbClass());
            } else {
                sb.append(DELIMITER).append(DELIMITER);
            }
            sb.append(NEWLINE);
        }

        // ===== STEP 3: NOME FILE =====
        String districtStr = (params.district() != null ? params.district() : "tutti_distretti").replaceAll("\\s+", "_");
        String typeStr = (params.waterBodyType() != null ? params.waterBodyType() : "tutti_corpi_idrici").replaceAll("\\s+", "_");
        String filename = String.format("wqi_%s_%s_%s_%s.csv", districtStr, typeStr,
                params.start().format(FILENAME_DATE_FMT), params.end().format(FILENAME_DATE_FMT));

        // ===== STEP 4: BYTES + BOM UTF-8 =====
        byte[] csv = sb.toString().getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[BOM.length + csv.length];
        System.arraycopy(BOM, 0, bytes, 0, BOM.length);
        System.arraycopy(csv, 0, bytes, BOM.length, csv.length);

        logger.debug("Export CSV {}: {} righe", filename, filtered.size());

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType("text/csv; charset=UTF-8"))
                .contentLength(bytes.length)
                .body(bytes);
    }

    // ===================== Helpers =====================

    private WqiResult resultOrNull(StationSample s) {
        try {
            return calculator.calculate(s.toReading());
        } catch (InvalidParameterException e) {
            logger.warn("WQI non calcolabile per {} del {}: {}", s.stationId(), s.date(), e.getMessage());
            return null;
        }
    }

    /**
     * Sanitizzazione dei campi testuali: niente doppi apici né newline, e un
     * apostrofo davanti a = + - @ contro la CSV injection.
     */
    static String safe(String s) {
        if (s == null || s.isEmpty()) return "";
        String cleaned = s.replace("\"", "").replace("\r", " ").replace("\n", " ");
        if (!cleaned.isEmpty()) {
            char c = cleaned.charAt(0);
            if (c == '=' || c == '+' || c == '-' || c == '@') {
                cleaned = "'" + cleaned;
            }
        }
        return cleaned;
    }

    /**
     * Formatta con le cifre decimali richieste, virgola come separatore, senza grouping.
     */
    static String numIt(double v, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", v).replace('.', ',');
    }
}
