package spectralengine.physics.graph;

import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Determina qué magnitudes conocidas podrían eliminarse y regenerarse sin pérdida.
 * <p>
 * El catálogo tiene 9 entradas, así que el coste cuadrático (un punto fijo por
 * magnitud) es irrelevante.
 */
public class RedundancyAnalyzer {

    private final ReachabilityAnalyzer reachabilityAnalyzer;

    public RedundancyAnalyzer(ReachabilityAnalyzer reachabilityAnalyzer) {
        this.reachabilityAnalyzer = reachabilityAnalyzer;
    }

    /**
     * Prueba independiente para cada magnitud conocida {@code q}: es redundante si sigue
     * siendo alcanzable desde {@code known - {q}}.
     *
     * @return Una entrada por magnitud conocida.
     */
    public Map<QuantityName, Boolean> redundant(Set<QuantityName> known, Regime regime, ConditionSet conditions) {
        Map<QuantityName, Boolean> result = new EnumMap<>(QuantityName.class);
        for (QuantityName quantity : known) {
            Set<QuantityName> others = EnumSet.copyOf(known);
            others.remove(quantity);
            result.put(quantity, reachabilityAnalyzer.plan(others, regime, conditions).isReachable(quantity));
        }
        return result;
    }

    /**
     * Compresión conjunta: recorre el catálogo del final al principio y descarta cada
     * magnitud que siga siendo alcanzable desde las que aún se conservan. A diferencia de
     * {@link #redundant}, las eliminaciones se acumulan, por lo que todas las marcadas
     * pueden borrarse a la vez.
     *
     * @return Una entrada por magnitud conocida; true = puede descartarse.
     */
    public Map<QuantityName, Boolean> compressible(Set<QuantityName> known, Regime regime, ConditionSet conditions) {
        Map<QuantityName, Boolean> result = new EnumMap<>(QuantityName.class);
        if (known.isEmpty()) {
            return result;
        }
        Set<QuantityName> kept = EnumSet.copyOf(known);
        QuantityName[] catalogue = QuantityName.values();

        for (int i = catalogue.length - 1; i >= 0; i--) {
            QuantityName quantity = catalogue[i];
            if (!kept.contains(quantity)) continue;

            kept.remove(quantity);
            boolean regenerable = reachabilityAnalyzer.plan(kept, regime, conditions).isReachable(quantity);
            if (!regenerable) {
                kept.add(quantity);
            }
            result.put(quantity, regenerable);
        }
        return result;
    }
}
