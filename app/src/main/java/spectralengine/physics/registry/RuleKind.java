package spectralengine.physics.registry;

/**
 * Naturaleza de una regla. Las conversiones directas se declaran antes que las
 * derivaciones físicas de varias magnitudes y por tanto tienen prioridad.
 */
public enum RuleKind {
    /** Cambio de representación sin coste ni pérdida (ej: abscoeff ↔ xsection). */
    CONVERSION,
    /** Relación física (Beer-Lambert, Kirchhoff, transferencia radiativa). */
    PHYSICAL
}
