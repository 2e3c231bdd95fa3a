package spectralengine.domain.spectrum;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;

import java.util.stream.Stream;

/**
 * Condiciones físicas escalares asociadas a un espectro.
 * <p>
 * El motor solo las lee; las modifica el llamador (o el reescalador, que sustituye
 * la instancia completa por una copia {@code with...}). Todos los
 * campos son opcionales: una regla de derivación que necesite un valor ausente
 * simplemente no es aplicable.
 * <p>
 * Las claves JSON coinciden con las que espera el colaborador de almacenamiento.
 *
 * @param moleFraction       Fracción molar de la especie absorbente (adimensional, (0, 1]).
 * @param pathLength         Longitud del camino óptico en centímetros.
 * @param pressureMbar       Presión total en milibares.
 * @param tgas               Temperatura del gas (traslacional) en K.
 * @param tvib               Temperatura vibracional en K. Ausente si coincide con Tgas.
 * @param trot               Temperatura rotacional en K. Ausente si coincide con Tgas.
 * @param thermalEquilibrium Régimen declarado explícitamente. Si es nulo se deduce de las temperaturas.
 */
@Builder
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConditionSet(
        @JsonProperty("mole_fraction") Double moleFraction,
        @JsonProperty("path_length") Double pathLength,
        @JsonProperty("pressure_mbar") Double pressureMbar,
        @JsonProperty("Tgas") Double tgas,
        @JsonProperty("Tvib") Double tvib,
        @JsonProperty("Trot") Double trot,
        @JsonProperty("thermal_equilibrium") Boolean thermalEquilibrium
) {

    /**
     * Indica si las temperaturas conocidas (Tgas, Tvib, Trot) coinciden dentro de la tolerancia.
     * Sin ninguna temperatura conocida no hay nada que contradiga el equilibrio.
     */
    public boolean temperaturesCoincide(double toleranceKelvin) {
        double[] temperatures = Stream.of(tgas, tvib, trot)
                .filter(t -> t != null)
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (temperatures.length < 2) {
            return true;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double t : temperatures) {
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        return max - min <= toleranceKelvin;
    }

    /**
     * Régimen declarado: el flag explícito si existe, o el deducido de las temperaturas.
     */
    public Regime declaredRegime(double toleranceKelvin) {
        boolean equilibrium = (thermalEquilibrium != null) ? thermalEquilibrium : temperaturesCoincide(toleranceKelvin);
        return Regime.of(equilibrium);
    }

    @JsonIgnore
    public boolean isThermalEquilibriumDeclared() {
        return thermalEquilibrium != null;
    }

    public boolean has(ConditionKey key) {
        return key.valueIn(this) != null;
    }

    /**
     * Devuelve el valor de la condición o falla si no está definida.
     */
    public double require(ConditionKey key) {
        Double value = key.valueIn(this);
        if (value == null) {
            throw new IllegalStateException("La condición '" + key.wireName() + "' no está definida en el espectro.");
        }
        return value;
    }
}
