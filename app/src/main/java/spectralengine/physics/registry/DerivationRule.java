package spectralengine.physics.registry;

import spectralengine.domain.spectrum.ConditionKey;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Registro etiquetado {target, precursores, régimen, fórmula}.
 * <p>
 * Las reglas son inmutables y viven en la tabla estática de {@link QuantityRegistry}.
 * {@code priority} es la posición de declaración en esa tabla y sirve para desempatar.
 *
 * @param priority           Posición en la tabla (menor = preferida).
 * @param target             Magnitud que produce la regla.
 * @param precursors         Magnitudes necesarias (1 o 2), en el orden en que se citan.
 * @param regime             Regímenes en que la relación física es válida.
 * @param requiredConditions Condiciones escalares que necesita la fórmula.
 * @param kind               Conversión directa o relación física.
 * @param description        Texto corto para trazas y diagnóstico (ej: "A = k·L").
 * @param formula            Implementación de la relación.
 */
public record DerivationRule(
        int priority,
        QuantityName target,
        List<QuantityName> precursors,
        RuleRegime regime,
        Set<ConditionKey> requiredConditions,
        RuleKind kind,
        String description,
        SpectralFormula formula
) {

    public DerivationRule {
        Objects.requireNonNull(target, "La regla necesita una magnitud objetivo.");
        Objects.requireNonNull(formula, "La regla necesita una fórmula.");
        if (precursors == null || precursors.isEmpty() || precursors.size() > 2) {
            throw new IllegalArgumentException("Una regla necesita 1 o 2 precursores: " + precursors);
        }
        if (precursors.contains(target)) {
            throw new IllegalArgumentException("La magnitud '" + target + "' no puede derivarse de sí misma.");
        }
        precursors = List.copyOf(precursors);
        requiredConditions = Set.copyOf(requiredConditions);
    }

    /**
     * Aplicable = válida en el régimen y con todas sus condiciones definidas.
     */
    public boolean isApplicable(Regime activeRegime, ConditionSet conditions) {
        return regime.appliesTo(activeRegime) && requiredConditions.stream().allMatch(conditions::has);
    }

    public boolean isSatisfiedBy(Collection<QuantityName> available) {
        return available.containsAll(precursors);
    }

    /**
     * Precursores que faltan en {@code available}, en orden de declaración.
     */
    public List<QuantityName> missingFrom(Collection<QuantityName> available) {
        List<QuantityName> missing = new ArrayList<>(precursors.size());
        for (QuantityName precursor : precursors) {
            if (!available.contains(precursor)) {
                missing.add(precursor);
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return target + " <- " + precursors + " [" + regime + "] " + description;
    }
}
