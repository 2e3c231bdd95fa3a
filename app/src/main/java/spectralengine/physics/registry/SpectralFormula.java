package spectralengine.physics.registry;

/**
 * Fórmula cerrada que produce el array de una magnitud a partir de sus precursores.
 */
@FunctionalInterface
public interface SpectralFormula {
    double[] apply(FormulaContext context);
}
