package spectralengine.physics.graph;

import spectralengine.domain.spectrum.QuantityName;
import spectralengine.physics.registry.DerivationRule;

import java.util.List;

/**
 * Una combinación de precursores candidata para una magnitud, anotada con los
 * precursores que aún no se conocen.
 */
public record DerivationPath(DerivationRule rule, List<QuantityName> missing) {

    public DerivationPath {
        missing = List.copyOf(missing);
    }

    public List<QuantityName> precursors() {
        return rule.precursors();
    }

    /**
     * true si todos los precursores ya son conocidos.
     */
    public boolean isSatisfied() {
        return missing.isEmpty();
    }

    @Override
    public String toString() {
        return rule.precursors() + (missing.isEmpty() ? "" : " (faltan " + missing + ")");
    }
}
