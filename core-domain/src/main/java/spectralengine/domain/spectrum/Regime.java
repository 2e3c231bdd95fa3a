package spectralengine.domain.spectrum;

/**
 * Régimen físico bajo el que se recalculan las magnitudes.
 * <p>
 * En {@link #EQUILIBRIUM} las temperaturas vibracional y rotacional coinciden y son
 * válidos los atajos de Kirchhoff (emisividad = absortividad, emisión de cuerpo negro).
 */
public enum Regime {
    EQUILIBRIUM,
    NON_EQUILIBRIUM;

    public static Regime of(boolean thermalEquilibrium) {
        return thermalEquilibrium ? EQUILIBRIUM : NON_EQUILIBRIUM;
    }

    public boolean isEquilibrium() {
        return this == EQUILIBRIUM;
    }
}
