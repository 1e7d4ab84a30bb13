package it.floro.waterquality.config;

import it.floro.waterquality.web.StationNotFoundException;
import it.floro.waterquality.web.dto.ApiError;
import it.floro.waterquality.wqi.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Gestore globale degli errori dell'API REST.
 *
 * Traduce le eccezioni di dominio in risposte JSON {@link ApiError}:
 * - InvalidParameterException, IllegalArgumentException, parametri mancanti o malformati → 400
 * - StationNotFoundException → 404
 */
@RestControllerAdvice
@Order(-1)
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidParameterException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleInvalidParameter(InvalidParameterException ex) {
        logger.debug("Parametro WQI rifiutato: {}", ex.getMessage());
        return badRequest(ex.getMessage(), ex.getParameter());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleIllegalArgument(IllegalArgumentException ex) {
        logger.debug("Richiesta non valida: {}", ex.getMessage());
        return badRequest(ex.getMessage(), null);
    }

    /**
     * Corpo JSON illeggibile. Se la causa è un parametro WQI mancante o non valido
     * (sollevato durante la deserializzazione di ParameterReading) ne riporta il messaggio.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleNotReadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getCause();
        while (cause != null) {
            if (cause instanceof InvalidParameterException ipe) {
                return badRequest(ipe.getMessage(), ipe.getParameter());
            }
            cause = cause.getCause();
        }
        logger.debug("Corpo della richiesta non leggibile: {}", ex.getMessage());
        return badRequest("Corpo della richiesta non valido", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleMissingParameter(MissingServletRequestParameterException ex) {
        return badRequest("Parametro obbligatorio mancante: " + ex.getParameterName(), ex.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return badRequest("Valore non valido per " + ex.getName() + ": " + ex.getValue(), ex.getName());
    }

    @ExceptionHandler(StationNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiError handleStationNotFound(StationNotFoundException ex) {
        return ApiError.of(HttpStatus.NOT_FOUND.value(), HttpStatus.NOT_FOUND.getReasonPhrase(), ex.getMessage(), null);
    }

    private static ApiError badRequest(String message, String parameter) {
        return ApiError.of(HttpStatus.BAD_REQUEST.value(), HttpStatus.BAD_REQUEST.getReasonPhrase(), message, parameter);
    }
}
