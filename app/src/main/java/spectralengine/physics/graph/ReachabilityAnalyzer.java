package spectralengine.physics.graph;

import lombok.extern.slf4j.Slf4j;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;
import spectralengine.physics.registry.DerivationRule;
import spectralengine.physics.registry.QuantityRegistry;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Calcula qué magnitudes son derivables a partir de un conjunto conocido.
 * <p>
 * Punto fijo síncrono (estilo Jacobi): en cada ronda solo cuenta lo que ya era
 * alcanzable al empezarla, de modo que el resultado no depende del orden en que se
 * recorren las reglas. Termina porque el catálogo es finito y cada ronda útil añade
 * al menos una magnitud.
 */
@Slf4j
public class ReachabilityAnalyzer {

    /**
     * Magnitud → alcanzable, para todo el catálogo.
     */
    public Map<QuantityName, Boolean> reachable(Set<QuantityName> known, Regime regime, ConditionSet conditions) {
        return plan(known, regime, conditions).reachability();
    }

    /**
     * Cierre transitivo con la regla elegida para cada magnitud derivada.
     * A igualdad de ronda gana la regla declarada antes en el registro.
     */
    public DerivationPlan plan(Set<QuantityName> known, Regime regime, ConditionSet conditions) {
        Set<QuantityName> available = known.isEmpty() ? EnumSet.noneOf(QuantityName.class) : EnumSet.copyOf(known);
        Map<QuantityName, DerivationRule> steps = new EnumMap<>(QuantityName.class);
        Map<QuantityName, Integer> depth = new EnumMap<>(QuantityName.class);
        available.forEach(q -> depth.put(q, 0));

        int round = 0;
        while (true) {
            round++;
            Map<QuantityName, DerivationRule> newlyReachable = new EnumMap<>(QuantityName.class);

            for (DerivationRule rule : QuantityRegistry.allRules()) {
                QuantityName target = rule.target();
                if (available.contains(target) || newlyReachable.containsKey(target)) continue;
                if (rule.isApplicable(regime, conditions) && rule.isSatisfiedBy(available)) {
                    newlyReachable.put(target, rule);
                }
            }

            if (newlyReachable.isEmpty()) break;

            final int currentRound = round;
            newlyReachable.forEach((quantity, rule) -> {
                steps.put(quantity, rule);
                depth.put(quantity, currentRound);
            });
            available.addAll(newlyReachable.keySet());
        }

        log.trace("Punto fijo alcanzado en {} rondas. Conocidas={}, derivables={}", round, known, steps.keySet());
        return new DerivationPlan(regime, known, steps, depth);
    }
}
