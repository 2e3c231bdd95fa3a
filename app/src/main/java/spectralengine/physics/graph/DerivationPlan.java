package spectralengine.physics.graph;

import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;
import spectralengine.physics.registry.DerivationRule;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cierre transitivo de lo derivable, junto con la regla elegida para cada magnitud.
 * <p>
 * Cada regla del plan solo usa precursores que estaban disponibles en una ronda
 * anterior del punto fijo, así que ejecutar el plan de forma recursiva nunca entra
 * en un ciclo aunque el grafo de relaciones los tenga (k ↔ A, por ejemplo).
 */
public final class DerivationPlan {

    private final Regime regime;
    private final Set<QuantityName> known;
    private final Map<QuantityName, DerivationRule> steps;
    private final Map<QuantityName, Integer> depth;

    DerivationPlan(Regime regime, Set<QuantityName> known, Map<QuantityName, DerivationRule> steps,
                   Map<QuantityName, Integer> depth) {
        this.regime = regime;
        this.known = known.isEmpty() ? EnumSet.noneOf(QuantityName.class) : EnumSet.copyOf(known);
        this.steps = Collections.unmodifiableMap(new EnumMap<>(steps));
        this.depth = Collections.unmodifiableMap(new EnumMap<>(depth));
    }

    public Regime regime() {
        return regime;
    }

    public boolean isKnown(QuantityName quantity) {
        return known.contains(quantity);
    }

    public boolean isReachable(QuantityName quantity) {
        return known.contains(quantity) || steps.containsKey(quantity);
    }

    /**
     * Regla elegida para una magnitud derivable y no conocida.
     */
    public Optional<DerivationRule> stepFor(QuantityName quantity) {
        return Optional.ofNullable(steps.get(quantity));
    }

    /**
     * Ronda del punto fijo en la que la magnitud pasó a ser alcanzable (0 = conocida).
     */
    public Optional<Integer> depthOf(QuantityName quantity) {
        return Optional.ofNullable(depth.get(quantity));
    }

    /**
     * Mapa magnitud → alcanzable para todo el catálogo.
     */
    public Map<QuantityName, Boolean> reachability() {
        Map<QuantityName, Boolean> result = new EnumMap<>(QuantityName.class);
        for (QuantityName quantity : QuantityName.values()) {
            result.put(quantity, isReachable(quantity));
        }
        return result;
    }

    /**
     * Magnitudes alcanzables que todavía no se conocen, en orden de catálogo.
     */
    public Set<QuantityName> derivable() {
        return steps.isEmpty() ? EnumSet.noneOf(QuantityName.class) : EnumSet.copyOf(steps.keySet());
    }
}
