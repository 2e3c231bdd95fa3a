package spectralengine.domain.spectrum;

import java.util.function.Function;

/**
 * Condiciones escalares de las que puede depender una regla de derivación.
 */
public enum ConditionKey {

    MOLE_FRACTION("mole_fraction", ConditionSet::moleFraction),
    PATH_LENGTH("path_length", ConditionSet::pathLength),
    PRESSURE("pressure_mbar", ConditionSet::pressureMbar),
    TGAS("Tgas", ConditionSet::tgas);

    private final String wireName;
    private final Function<ConditionSet, Double> accessor;

    ConditionKey(String wireName, Function<ConditionSet, Double> accessor) {
        this.wireName = wireName;
        this.accessor = accessor;
    }

    public String wireName() {
        return wireName;
    }

    Double valueIn(ConditionSet conditions) {
        return accessor.apply(conditions);
    }
}
