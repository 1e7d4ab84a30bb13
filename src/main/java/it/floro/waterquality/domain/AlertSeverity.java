package it.floro.waterquality.domain;

/**
 * Gravità di un alert, dalla più lieve alla più grave.
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
