package spectralengine.physics.updater;

import spectralengine.domain.spectrum.QuantityName;
import spectralengine.physics.registry.DerivationRule;

/**
 * Un paso de derivación ejecutado: qué se calculó, con qué regla y desde qué magnitudes.
 */
public record DerivationStep(QuantityName target, DerivationRule rule) {

    public String describe() {
        return String.format("%s <- %s con [%s]", target, rule.precursors(), rule.description());
    }
}
