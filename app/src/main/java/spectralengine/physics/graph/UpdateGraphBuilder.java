package spectralengine.physics.graph;

import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;
import spectralengine.physics.registry.DerivationRule;
import spectralengine.physics.registry.QuantityRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumera, para cada magnitud del catálogo, todas las combinaciones de precursores
 * aplicables en el régimen y con las condiciones dadas.
 * <p>
 * Orden de cada lista: primero las que tienen menos precursores pendientes; a igualdad,
 * el orden de declaración del registro (conversiones antes que física de varias magnitudes).
 */
public class UpdateGraphBuilder {

    private static final Comparator<DerivationPath> PREFERENCE = Comparator
            .comparingInt((DerivationPath p) -> p.missing().size())
            .thenComparingInt(p -> p.rule().priority());

    public UpdateGraph build(Set<QuantityName> known, Regime regime, ConditionSet conditions) {
        Map<QuantityName, List<DerivationPath>> graph = new EnumMap<>(QuantityName.class);

        for (QuantityName quantity : QuantityName.values()) {
            List<DerivationPath> paths = new ArrayList<>();
            for (DerivationRule rule : QuantityRegistry.rulesFor(quantity)) {
                if (rule.isApplicable(regime, conditions)) {
                    paths.add(new DerivationPath(rule, rule.missingFrom(known)));
                }
            }
            if (!paths.isEmpty()) {
                paths.sort(PREFERENCE);
                graph.put(quantity, paths);
            }
        }
        return new UpdateGraph(graph);
    }
}
