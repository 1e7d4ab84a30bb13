package it.floro.waterquality.wqi;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Risultato immutabile di un calcolo WQI.
 *
 * Serializzato come oggetto JSON piatto:
 * {@code wqi, subIndices, weightedIndices, classification, cpcbClass, status, mpcbClass}.
 * La banda è esposta tramite le sue etichette testuali, non come enum.
 */
@JsonPropertyOrder({"wqi", "subIndices", "weightedIndices", "classification", "cpcbClass", "status", "mpcbClass"})
public record WqiResult(
        double wqi,
        SubIndices subIndices,
        WeightedIndices weightedIndices,
        @JsonIgnore WaterQualityClass band
) {

    @JsonProperty("classification")
    public String classification() {
        return band.label();
    }

    @JsonProperty("cpcbClass")
    public String cpcbClass() {
        return band.cpcbClass();
    }

    @JsonProperty("status")
    public String status() {
        return band.status();
    }

    @JsonProperty("mpcbClass")
    public String mpcbClass() {
        return WaterQualityClass.mpcbClassOf(wqi);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "WQI: %.2f - %s (%s)", wqi, band.label(), band.status());
    }
}
