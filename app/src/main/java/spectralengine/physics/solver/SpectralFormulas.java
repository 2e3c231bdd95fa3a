package spectralengine.physics.solver;

import spectralengine.domain.exception.UnderdeterminedQuantityException;
import spectralengine.domain.spectrum.QuantityName;

/**
 * Biblioteca estática de relaciones cerradas entre magnitudes espectrales.
 * <p>
 * Todas las funciones son puras: reciben arrays y escalares en unidades internas
 * (cm, cm⁻¹, mbar, K) y devuelven un array NUEVO, sin modificar la entrada.
 * Dos llamadas con los mismos argumentos producen resultados idénticos bit a bit.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class SpectralFormulas {

    private SpectralFormulas() {
    }

    // --------------------------------------------------------------------------
    // Beer-Lambert
    // --------------------------------------------------------------------------

    /**
     * A = k · L
     */
    public static double[] absorbanceFromAbscoeff(double[] abscoeff, double pathLength) {
        double[] result = new double[abscoeff.length];
        for (int i = 0; i < abscoeff.length; i++) {
            result[i] = abscoeff[i] * pathLength;
        }
        return result;
    }

    /**
     * k = A / L
     */
    public static double[] abscoeffFromAbsorbance(double[] absorbance, double pathLength) {
        requirePositive(pathLength, "path_length");
        double[] result = new double[absorbance.length];
        for (int i = 0; i < absorbance.length; i++) {
            result[i] = absorbance[i] / pathLength;
        }
        return result;
    }

    /**
     * T = exp(-A)
     */
    public static double[] transmittanceFromAbsorbance(double[] absorbance) {
        double[] result = new double[absorbance.length];
        for (int i = 0; i < absorbance.length; i++) {
            result[i] = Math.exp(-absorbance[i]);
        }
        return result;
    }

    /**
     * A = -ln(T)
     */
    public static double[] absorbanceFromTransmittance(double[] transmittance) {
        double[] result = new double[transmittance.length];
        for (int i = 0; i < transmittance.length; i++) {
            result[i] = -Math.log(transmittance[i]);
        }
        return result;
    }

    /**
     * Multiplica cada valor por {@code ratio} (ley de proporcionalidad de Beer-Lambert).
     */
    public static double[] scale(double[] values, double ratio) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] * ratio;
        }
        return result;
    }

    // --------------------------------------------------------------------------
    // Ley de Kirchhoff (solo en equilibrio)
    // --------------------------------------------------------------------------

    /**
     * ε = 1 - T
     */
    public static double[] emissivityFromTransmittance(double[] transmittance) {
        double[] result = new double[transmittance.length];
        for (int i = 0; i < transmittance.length; i++) {
            result[i] = 1.0 - transmittance[i];
        }
        return result;
    }

    /**
     * T = 1 - ε
     */
    public static double[] transmittanceFromEmissivity(double[] emissivity) {
        return emissivityFromTransmittance(emissivity);
    }

    /**
     * Ley de Planck por número de onda.
     *
     * @param wavenumber  Eje espectral [cm⁻¹].
     * @param temperature Temperatura [K].
     * @return Radiancia de cuerpo negro [mW/cm²/sr/cm⁻¹].
     */
    public static double[] planck(double[] wavenumber, double temperature) {
        requirePositive(temperature, "Tgas");
        final double h = PhysicalConstants.PLANCK;
        final double c = PhysicalConstants.SPEED_OF_LIGHT;
        final double kb = PhysicalConstants.BOLTZMANN;

        double[] result = new double[wavenumber.length];
        for (int i = 0; i < wavenumber.length; i++) {
            double nu = wavenumber[i] * PhysicalConstants.PER_M_PER_CM; // m⁻¹
            double x = h * c * nu / (kb * temperature);
            double bSi = 2.0 * h * c * c * nu * nu * nu / Math.expm1(x);
            result[i] = bSi * PhysicalConstants.RADIANCE_SI_TO_INTERNAL;
        }
        return result;
    }

    /**
     * Coeficiente de emisión en equilibrio: j = k · B(ν, T).
     */
    public static double[] emisscoeffAtEquilibrium(double[] abscoeff, double[] wavenumber, double temperature) {
        double[] blackbody = planck(wavenumber, temperature);
        double[] result = new double[abscoeff.length];
        for (int i = 0; i < abscoeff.length; i++) {
            result[i] = abscoeff[i] * blackbody[i];
        }
        return result;
    }

    /**
     * Radiancia en equilibrio a partir de la absorción: I = B(ν, T) · (1 - exp(-k·L)).
     */
    public static double[] radianceAtEquilibrium(double[] abscoeff, double pathLength, double[] wavenumber, double temperature) {
        double[] blackbody = planck(wavenumber, temperature);
        double[] result = new double[abscoeff.length];
        for (int i = 0; i < abscoeff.length; i++) {
            result[i] = blackbody[i] * -Math.expm1(-abscoeff[i] * pathLength);
        }
        return result;
    }

    /**
     * Radiancia en equilibrio a partir de la emisividad: I = ε · B(ν, T).
     */
    public static double[] radianceFromEmissivity(double[] emissivity, double[] wavenumber, double temperature) {
        double[] blackbody = planck(wavenumber, temperature);
        double[] result = new double[emissivity.length];
        for (int i = 0; i < emissivity.length; i++) {
            result[i] = emissivity[i] * blackbody[i];
        }
        return result;
    }

    // --------------------------------------------------------------------------
    // Ecuación de transferencia radiativa 1D (columna homogénea)
    // --------------------------------------------------------------------------

    /**
     * Solución de la ETR en una columna homogénea de longitud L:
     * I = j / k · (1 - exp(-k·L)). Donde k·L es despreciable se usa el límite
     * ópticamente delgado I = j · L.
     */
    public static double[] radianceFromEmisscoeff(double[] emisscoeff, double[] abscoeff, double pathLength,
                                                  double negligibleOpticalDepth) {
        requireSameLength(emisscoeff, abscoeff);
        double[] result = new double[emisscoeff.length];
        for (int i = 0; i < emisscoeff.length; i++) {
            double tau = abscoeff[i] * pathLength;
            if (Math.abs(tau) <= negligibleOpticalDepth) {
                result[i] = emisscoeff[i] * pathLength;
            } else {
                result[i] = emisscoeff[i] / abscoeff[i] * -Math.expm1(-tau);
            }
        }
        return result;
    }

    /**
     * Inversión de la ETR: j = I · k / (1 - exp(-k·L)).
     * <p>
     * Solo está bien planteada donde k no es despreciable. Los puntos con k·L
     * despreciable usan el límite delgado j = I / L, pero si son más de
     * {@code maxNegligibleFraction} del eje el resultado no se aproxima.
     *
     * @throws UnderdeterminedQuantityException si la absorción es despreciable en demasiados puntos.
     */
    public static double[] emisscoeffFromRadiance(double[] radiance, double[] abscoeff, double pathLength,
                                                  double negligibleOpticalDepth, double maxNegligibleFraction) {
        requireSameLength(radiance, abscoeff);
        requirePositive(pathLength, "path_length");

        int negligible = 0;
        for (double k : abscoeff) {
            if (Math.abs(k * pathLength) <= negligibleOpticalDepth) negligible++;
        }
        double fraction = (double) negligible / abscoeff.length;
        if (fraction > maxNegligibleFraction) {
            throw new UnderdeterminedQuantityException(QuantityName.EMISSCOEFF, fraction, maxNegligibleFraction);
        }

        double[] result = new double[radiance.length];
        for (int i = 0; i < radiance.length; i++) {
            double tau = abscoeff[i] * pathLength;
            if (Math.abs(tau) <= negligibleOpticalDepth) {
                result[i] = radiance[i] / pathLength;
            } else {
                result[i] = radiance[i] * abscoeff[i] / -Math.expm1(-tau);
            }
        }
        return result;
    }

    // --------------------------------------------------------------------------
    // Sección eficaz
    // --------------------------------------------------------------------------

    /**
     * Densidad numérica total de un gas ideal: N = p / (kB · T).
     *
     * @return Moléculas por cm³.
     */
    public static double numberDensity(double pressureMbar, double temperature) {
        requirePositive(pressureMbar, "pressure_mbar");
        requirePositive(temperature, "Tgas");
        double perM3 = pressureMbar * PhysicalConstants.PASCAL_PER_MBAR / (PhysicalConstants.BOLTZMANN * temperature);
        return perM3 / PhysicalConstants.CM3_PER_M3;
    }

    /**
     * σ = k / (x · N)
     */
    public static double[] xsectionFromAbscoeff(double[] abscoeff, double moleFraction, double pressureMbar, double temperature) {
        requirePositive(moleFraction, "mole_fraction");
        double absorbers = moleFraction * numberDensity(pressureMbar, temperature);
        double[] result = new double[abscoeff.length];
        for (int i = 0; i < abscoeff.length; i++) {
            result[i] = abscoeff[i] / absorbers;
        }
        return result;
    }

    /**
     * k = σ · x · N
     */
    public static double[] abscoeffFromXsection(double[] xsection, double moleFraction, double pressureMbar, double temperature) {
        double absorbers = moleFraction * numberDensity(pressureMbar, temperature);
        double[] result = new double[xsection.length];
        for (int i = 0; i < xsection.length; i++) {
            result[i] = xsection[i] * absorbers;
        }
        return result;
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("'" + name + "' debe ser positivo: " + value);
        }
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Los arrays tienen longitudes distintas: " + a.length + " y " + b.length);
        }
    }
}
