package it.floro.waterquality.service;

import it.floro.waterquality.domain.StationSample;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.LocalDate;
import java.time.Month;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Componente che traduce i parametri di richiesta in filtri sui campioni delle stazioni.
 *
 * Responsabilità:
 * - Normalizzare il periodo richiesto (giorno, mese, trimestre, anno, custom)
 * - Calcolare l'intervallo di date quando start/end non sono espliciti
 * - Costruire un predicato case- e accent-insensitive su distretto, tipo di corpo idrico e stazione
 * - Estrarre i valori distinti per i menu di selezione
 */
@Component
public class StationFilters {

    /**
     * Periodo di analisi. Accetta alias italiani e inglesi.
     */
    public enum Period {
        DAY,
        MONTH,
        QUARTER,
        YEAR,
        CUSTOM;

        public static Period ofNullable(String s) {
            if (s == null || s.isBlank()) return CUSTOM;
            return switch (s.trim().toLowerCase()) {
                case "giorno", "day", "daily" -> DAY;
                case "mese", "month", "monthly" -> MONTH;
                case "trimestre", "quarter", "quarterly" -> QUARTER;
                case "anno", "year", "yearly" -> YEAR;
                default -> CUSTOM;
            };
        }
    }

    /**
     * Filtri risolti: date sempre valorizzate e ordinate, stringhe vuote ridotte a null.
     */
    public record FilterParams(
            String district,
            String waterBodyType,
            String stationId,
            LocalDate start,
            LocalDate end,
            Period period
    ) {}

    /**
     * Costruisce i filtri a partire dai parametri grezzi della richiesta.
     *
     * Se start o end mancano vengono derivati dal periodo:
     * - YEAR: 1 gennaio - 31 dicembre dell'anno (default: anno di maxDate)
     * - MONTH: intero mese (default: mese di maxDate)
     * - QUARTER: intero trimestre (default: trimestre di maxDate)
     * - DAY: la data fornita, altrimenti maxDate
     * - CUSTOM: da minDate a maxDate
     * Un intervallo invertito viene riordinato.
     */
    public FilterParams fromRequest(
            String rawDistrict,
            String rawWaterBodyType,
            String rawStationId,
            LocalDate startDate,
            LocalDate endDate,
            String rawPeriod,
            Integer year,
            Integer month,
            Integer quarter,
            LocalDate minDate,
            LocalDate maxDate
    ) {
        Period period = Period.ofNullable(rawPeriod);
        LocalDate ref = coalesce(maxDate, LocalDate.now());

        LocalDate start = startDate;
        LocalDate end = endDate;

        if (start == null || end == null) {
            switch (period) {
                case YEAR -> {
                    int y = coalesce(year, ref.getYear());
                    start = LocalDate.of(y, 1, 1);
                    end = LocalDate.of(y, 12, 31);
                }
                case MONTH -> {
                    int y = coalesce(year, ref.getYear());
                    int m = bound(coalesce(month, ref.getMonthValue()), 1, 12);
                    start = LocalDate.of(y, Month.of(m), 1);
                    end = start.withDayOfMonth(start.lengthOfMonth());
                }
                case QUARTER -> {
                    int y = coalesce(year, ref.getYear());
                    int q = bound(coalesce(quarter, quarterOf(coalesce(endDate, ref))), 1, 4);
                    start = LocalDate.of(y, Month.of((q - 1) * 3 + 1), 1);
                    LocalDate last = start.plusMonths(2);
                    end = last.withDayOfMonth(last.lengthOfMonth());
                }
                case DAY -> {
                    LocalDate d = coalesce(coalesce(startDate, endDate), ref);
                    start = d;
                    end = d;
                }
                case CUSTOM -> {
                    start = coalesce(startDate, coalesce(minDate, ref.minusYears(1).withDayOfYear(1)));
                    end = coalesce(endDate, ref);
                }
            }
        }

        if (start.isAfter(end)) {
            LocalDate tmp = start;
            start = end;
            end = tmp;
        }

        return new FilterParams(
                blankToNull(rawDistrict),
                blankToNull(rawWaterBodyType),
                blankToNull(rawStationId),
                start,
                end,
                period
        );
    }

    /**
     * Predicato sui campioni: intervallo di date inclusivo, poi distretto,
     * tipo di corpo idrico e stazione (ciascuno solo se valorizzato).
     */
    public Predicate<StationSample> predicate(FilterParams p) {
        final String districtNorm = normalizeNullable(p.district());
        final String typeNorm = normalizeNullable(p.waterBodyType());
        final String stationNorm = normalizeNullable(p.stationId());
        final LocalDate from = p.start() != null ? p.start() : LocalDate.MIN;
        final LocalDate to = p.end() != null ? p.end() : LocalDate.MAX;

        return s -> {
            if (s == null) return false;

            LocalDate d = s.date();
            if (d == null || d.isBefore(from) || d.isAfter(to)) return false;

            if (districtNorm != null && !districtNorm.equals(normalizeNullable(s.district()))) return false;
            if (typeNorm != null && !typeNorm.equals(normalizeNullable(s.waterBodyType()))) return false;
            return stationNorm == null || stationNorm.equals(normalizeNullable(s.stationId()));
        };
    }

    /**
     * Applica i filtri a una lista di campioni.
     */
    public List<StationSample> apply(List<StationSample> all, FilterParams p) {
        return all.stream().filter(predicate(p)).collect(Collectors.toList());
    }

    public List<String> districtsFrom(List<StationSample> all) {
        return distinctSorted(all, StationSample::district);
    }

    public List<String> waterBodyTypesFrom(List<StationSample> all) {
        return distinctSorted(all, StationSample::waterBodyType);
    }

    // ========= METODI UTILITY PRIVATI =========

    private static List<String> distinctSorted(List<StationSample> all, Function<StationSample, String> key) {
        return all.stream()
                .map(key)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(Comparator.comparing(StationFilters::normalizeNullable))
                .collect(Collectors.toList());
    }

    private static <T> T coalesce(T v, T fallback) {
        return v != null ? v : fallback;
    }

    private static int bound(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    /**
     * Minuscolo senza diacritici, punteggiatura ridotta a spazi singoli.
     * "MH-001" e "mh 001" risultano uguali.
     */
    static String normalizeNullable(String s) {
        if (s == null) return null;
        String n = Normalizer.normalize(s, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase();
        return n.replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static int quarterOf(LocalDate d) {
        return (d.getMonthValue() - 1) / 3 + 1;
    }
}
