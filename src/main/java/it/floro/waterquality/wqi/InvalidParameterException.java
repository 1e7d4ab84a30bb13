package it.floro.waterquality.wqi;

/**
 * Sollevata quando un parametro in ingresso al calcolo WQI non è utilizzabile:
 * valore mancante, NaN, infinito, oppure coliformi fecali non positivi.
 *
 * Il calcolo non restituisce mai risultati parziali: l'eccezione arriva
 * direttamente al chiamante.
 */
public class InvalidParameterException extends RuntimeException {

    private final String parameter;
    private final double value;

    public InvalidParameterException(String parameter, double value, String reason) {
        super(String.format("Parametro '%s' non valido (%s): %s", parameter, value, reason));
        this.parameter = parameter;
        this.value = value;
    }

    public InvalidParameterException(String message) {
        super(message);
        this.parameter = null;
        this.value = Double.NaN;
    }

    /**
     * Ripropone un errore con un prefisso di contesto (es. l'indice nel lotto),
     * conservando parametro e valore rifiutati.
     */
    public InvalidParameterException(String prefix, InvalidParameterException cause) {
        super(prefix + cause.getMessage(), cause);
        this.parameter = cause.getParameter();
        this.value = cause.getValue();
    }

    /** Nome del parametro rifiutato, null se l'errore non riguarda un singolo campo. */
    public String getParameter() {
        return parameter;
    }

    public double getValue() {
        return value;
    }
}
