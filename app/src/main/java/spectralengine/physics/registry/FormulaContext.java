package spectralengine.physics.registry;

import spectralengine.config.EngineConfig;
import spectralengine.domain.spectrum.ConditionKey;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;

import java.util.Map;

/**
 * Lo que una fórmula puede leer: los arrays de sus precursores, el eje espectral,
 * las condiciones y las tolerancias del motor.
 */
public record FormulaContext(
        Map<QuantityName, double[]> inputs,
        double[] wavenumber,
        ConditionSet conditions,
        EngineConfig config
) {

    public double[] input(QuantityName quantity) {
        double[] values = inputs.get(quantity);
        if (values == null) {
            throw new IllegalStateException("Falta el precursor '" + quantity + "' en el contexto de la fórmula.");
        }
        return values;
    }

    public double condition(ConditionKey key) {
        return conditions.require(key);
    }
}
