package it.floro.waterquality.web.api;

import it.floro.waterquality.domain.Alert;
import it.floro.waterquality.service.AlertService;
import it.floro.waterquality.service.StationDataService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;
import java.util.List;

/**
 * Controller REST per la gestione e il monitoraggio degli alert sulla qualità dell'acqua.
 *
 * Mapping base: /api/alerts
 *
 * Flusso tipico:
 * 1. GET /api/alerts/active → alert scattati sull'ultimo campione di ogni stazione
 * 2. GET /api/alerts/configured → tutte le configurazioni
 * 3. POST /api/alerts → nuova soglia
 * 4. DELETE /api/alerts/{id} → disattivazione
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    // ========================================================================
    // DIPENDENZE INIETTATE
    // ========================================================================

    private final AlertService alertService;

    /**
     * Fornisce il dataset corrente su cui valutare le soglie.
     */
    private final StationDataService stationDataService;

    public AlertController(AlertService alertService, StationDataService stationDataService) {
        this.alertService = alertService;
        this.stationDataService = stationDataService;
    }

    // ========================================================================
    // ENDPOINT 1: GET - ALERT ATTIVI
    // ========================================================================

    /**
     * Valuta le configurazioni attive e restituisce gli alert scattati,
     * ordinati per gravità decrescente.
     *
     * Esempio di risposta (JSON):
     * [
     *   {
     *     "id": "550e8400-e29b-41d4-a716-446655440000",
     *     "parameter": "dissolvedOxygen",
     *     "threshold": 5.0,
     *     "condition": "BELOW",
     *     "district": "Nagpur",
     *     "stationId": "MH-004",
     *     "severity": "CRITICAL",
     *     "active": true,
     *     "message": "Alert dissolvedOxygen: valore 2.90 sotto soglia 5.00 presso ..."
     *   }
     * ]
     */
    @GetMapping("/active")
    public List<Alert> getActiveAlerts() {
        return alertService.checkAlerts(stationDataService.getAll());
    }

    // ========================================================================
    // ENDPOINT 2: GET - CONFIGURAZIONI
    // ========================================================================

    @GetMapping("/configured")
    public Collection<Alert> getConfigured() {
        return alertService.getAllConfigured();
    }

    // ========================================================================
    // ENDPOINT 3: POST - NUOVA CONFIGURAZIONE
    // ========================================================================

    /**
     * Crea una nuova configurazione di alert.
     *
     * Richiesta (JSON):
     * {
     *   "parameter": "fecalColiform",
     *   "threshold": 2500,
     *   "condition": "ABOVE",
     *   "district": "Pune"
     * }
     *
     * L'id viene generato dal service e l'alert nasce attivo. Parametro o
     * condizione non supportati producono HTTP 400.
     */
    @PostMapping
    public Alert createAlert(@RequestBody Alert alert) {
        return alertService.saveAlert(alert);
    }

    // ========================================================================
    // ENDPOINT 4: DELETE - DISATTIVAZIONE
    // ========================================================================

    /**
     * Disattiva una configurazione. La configurazione resta visibile in
     * /configured con active=false.
     *
     * @return 200 con l'alert disattivato, 404 se l'id non esiste
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Alert> deactivate(@PathVariable String id) {
        return alertService.deactivate(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
