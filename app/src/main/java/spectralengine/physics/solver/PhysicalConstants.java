package spectralengine.physics.solver;

/**
 * Constantes físicas en unidades SI (valores exactos de la redefinición SI 2019).
 */
public final class PhysicalConstants {

    /** Constante de Planck [J·s]. */
    public static final double PLANCK = 6.62607015e-34;
    /** Velocidad de la luz en el vacío [m/s]. */
    public static final double SPEED_OF_LIGHT = 2.99792458e8;
    /** Constante de Boltzmann [J/K]. */
    public static final double BOLTZMANN = 1.380649e-23;

    /** 1 mbar = 100 Pa. */
    public static final double PASCAL_PER_MBAR = 100.0;
    /** 1 m⁻³ = 1e-6 cm⁻³. */
    public static final double CM3_PER_M3 = 1e6;
    /** 1 cm⁻¹ = 100 m⁻¹. */
    public static final double PER_M_PER_CM = 100.0;

    /**
     * Conversión de radiancia espectral por número de onda:
     * W/(m²·sr·m⁻¹) → mW/(cm²·sr·cm⁻¹) = 1e3 (W→mW) · 1e-4 (m²→cm²) · 1e2 (m⁻¹→cm⁻¹).
     */
    public static final double RADIANCE_SI_TO_INTERNAL = 10.0;

    private PhysicalConstants() {
    }
}
