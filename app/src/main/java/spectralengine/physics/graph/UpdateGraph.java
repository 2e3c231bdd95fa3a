package spectralengine.physics.graph;

import spectralengine.domain.spectrum.QuantityName;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resultado del constructor de caminos: para cada magnitud, las combinaciones de
 * precursores aplicables ordenadas de la más barata a la más costosa.
 */
public final class UpdateGraph {

    private final Map<QuantityName, List<DerivationPath>> paths;

    UpdateGraph(Map<QuantityName, List<DerivationPath>> paths) {
        Map<QuantityName, List<DerivationPath>> copy = new EnumMap<>(QuantityName.class);
        paths.forEach((quantity, list) -> copy.put(quantity, List.copyOf(list)));
        this.paths = Collections.unmodifiableMap(copy);
    }

    /**
     * Caminos para {@code quantity}, vacío si no hay ninguna regla aplicable.
     */
    public List<DerivationPath> pathsFor(QuantityName quantity) {
        return paths.getOrDefault(quantity, List.of());
    }

    /**
     * Primer camino cuyos precursores son todos conocidos.
     */
    public Optional<DerivationPath> firstSatisfied(QuantityName quantity) {
        return pathsFor(quantity).stream().filter(DerivationPath::isSatisfied).findFirst();
    }

    public Set<QuantityName> quantities() {
        return paths.keySet();
    }

    public Map<QuantityName, List<DerivationPath>> asMap() {
        return paths;
    }

    /**
     * Vista solo con nombres de precursores, útil para informes.
     */
    public Map<QuantityName, List<List<QuantityName>>> precursorNames() {
        Map<QuantityName, List<List<QuantityName>>> names = new EnumMap<>(QuantityName.class);
        paths.forEach((quantity, list) -> names.put(quantity,
                list.stream().map(DerivationPath::precursors).collect(Collectors.toList())));
        return names;
    }

    @Override
    public String toString() {
        return paths.toString();
    }
}
