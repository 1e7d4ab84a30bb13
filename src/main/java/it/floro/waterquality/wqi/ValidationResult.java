package it.floro.waterquality.wqi;

import java.util.List;

/**
 * Esito della diagnostica sui range realistici dei parametri.
 * Non blocca il calcolo: segnala soltanto valori sospetti.
 */
public record ValidationResult(boolean valid, List<String> issues) {

    public ValidationResult {
        issues = List.copyOf(issues);
    }

    public static ValidationResult of(List<String> issues) {
        return new ValidationResult(issues.isEmpty(), issues);
    }
}
