package it.floro.waterquality.web;

/**
 * Stazione richiesta non presente nel dataset.
 */
public class StationNotFoundException extends RuntimeException {

    public StationNotFoundException(String stationId) {
        super("Stazione non trovata: " + stationId);
    }
}
