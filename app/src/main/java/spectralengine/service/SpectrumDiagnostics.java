package spectralengine.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.Regime;

import java.util.List;
import java.util.Map;

/**
 * Fotografía del estado de derivación de un espectro, pensada para informes.
 * Las magnitudes se identifican por su nombre externo (ej: "radiance_noslit").
 *
 * @param spectrum       Nombre del espectro.
 * @param declaredRegime Régimen con el que trabaja el motor.
 * @param observedRegime Régimen que indican las temperaturas.
 * @param conditions     Condiciones escalares del espectro.
 * @param known          Magnitudes almacenadas.
 * @param reachable      Alcanzabilidad de cada magnitud del catálogo.
 * @param redundant      Prueba de redundancia independiente de cada magnitud conocida.
 * @param compressible   Magnitudes que pueden descartarse juntas.
 * @param updateGraph    Combinaciones de precursores aplicables, de la preferida a la menos preferida.
 */
@Builder
@JsonPropertyOrder({"spectrum", "declared_regime", "observed_regime", "conditions", "known",
        "reachable", "redundant", "compressible", "update_graph"})
public record SpectrumDiagnostics(
        String spectrum,
        @JsonProperty("declared_regime") Regime declaredRegime,
        @JsonProperty("observed_regime") Regime observedRegime,
        ConditionSet conditions,
        List<String> known,
        Map<String, Boolean> reachable,
        Map<String, Boolean> redundant,
        Map<String, Boolean> compressible,
        @JsonProperty("update_graph") Map<String, List<List<String>>> updateGraph
) {
}
