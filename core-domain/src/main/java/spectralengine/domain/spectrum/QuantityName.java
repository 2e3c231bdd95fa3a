package spectralengine.domain.spectrum;

import java.util.Arrays;
import java.util.Optional;

/**
 * Catálogo cerrado de magnitudes espectrales que puede contener un {@link Spectrum}.
 * <p>
 * El orden de declaración es el orden canónico de recorrido (de la magnitud más
 * "primitiva" a la más derivada). Lo usan el análisis de compresión y los
 * informes de diagnóstico.
 * <p>
 * Las magnitudes convolucionadas con la función de rendija ({@link #TRANSMITTANCE},
 * {@link #RADIANCE}) pueden almacenarse, pero el motor nunca las deriva: la
 * convolución es externa.
 */
public enum QuantityName {

    ABSCOEFF("abscoeff", "cm-1", false),
    ABSORBANCE("absorbance", "", false),
    EMISSCOEFF("emisscoeff", "mW/cm3/sr/cm-1", false),
    RADIANCE_NOSLIT("radiance_noslit", "mW/cm2/sr/cm-1", false),
    TRANSMITTANCE_NOSLIT("transmittance_noslit", "", false),
    EMISSIVITY_NOSLIT("emissivity_noslit", "", false),
    XSECTION("xsection", "cm2", false),
    TRANSMITTANCE("transmittance", "", true),
    RADIANCE("radiance", "mW/cm2/sr/cm-1", true);

    private final String wireName;
    private final String unit;
    private final boolean slitConvolved;

    QuantityName(String wireName, String unit, boolean slitConvolved) {
        this.wireName = wireName;
        this.unit = unit;
        this.slitConvolved = slitConvolved;
    }

    /**
     * Nombre con el que la magnitud se identifica fuera del motor (ej: "radiance_noslit").
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Unidad interna de la magnitud. Cadena vacía para magnitudes adimensionales.
     */
    public String unit() {
        return unit;
    }

    public boolean isSlitConvolved() {
        return slitConvolved;
    }

    public static Optional<QuantityName> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(q -> q.wireName.equals(name))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
