package it.floro.waterquality.web.dto;

import java.time.Instant;

/**
 * Corpo JSON delle risposte di errore dell'API.
 *
 * @param status codice HTTP
 * @param error descrizione breve dello stato (es. "Bad Request")
 * @param message dettaglio leggibile
 * @param parameter parametro rifiutato, se l'errore riguarda un singolo campo
 * @param timestamp istante dell'errore
 */
public record ApiError(int status, String error, String message, String parameter, Instant timestamp) {

    public static ApiError of(int status, String error, String message, String parameter) {
        return new ApiError(status, error, message, parameter, Instant.now());
    }
}
