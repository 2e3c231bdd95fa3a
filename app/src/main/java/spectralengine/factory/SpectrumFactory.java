package spectralengine.factory;

import lombok.extern.slf4j.Slf4j;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.SpectralQuantity;
import spectralengine.domain.spectrum.Spectrum;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Punto de entrada para el colaborador de síntesis línea a línea: recibe los arrays que
 * este ha calculado y construye un {@link Spectrum} validado.
 */
@Slf4j
public class SpectrumFactory {

    /**
     * Crea un espectro a partir de un eje de números de onda y sus magnitudes iniciales.
     *
     * @param name       Nombre del espectro (para logs e informes).
     * @param wavenumber Eje espectral en cm⁻¹. Estrictamente monótono y finito.
     * @param initial    Magnitudes iniciales. Debe incluir abscoeff o xsection.
     * @param conditions Condiciones físicas del cálculo.
     * @return Un espectro nuevo, independiente de los arrays recibidos.
     */
    public Spectrum create(String name, double[] wavenumber, Map<QuantityName, double[]> initial, ConditionSet conditions) {
        Objects.requireNonNull(wavenumber, "El eje espectral no puede ser nulo.");
        Objects.requireNonNull(initial, "Las magnitudes iniciales no pueden ser nulas.");
        Objects.requireNonNull(conditions, "Las condiciones no pueden ser nulas.");

        // 1. Validar el eje espectral
        validateAxis(wavenumber);

        // 2. Debe haber al menos una magnitud de absorción de la que partir
        if (!initial.containsKey(QuantityName.ABSCOEFF) && !initial.containsKey(QuantityName.XSECTION)) {
            throw new IllegalArgumentException("Se necesita 'abscoeff' o 'xsection' para crear el espectro " + name + ".");
        }

        // 3. Empaquetar los arrays (el espectro valida las longitudes)
        Map<QuantityName, SpectralQuantity> quantities = new EnumMap<>(QuantityName.class);
        initial.forEach((quantity, values) -> {
            if (values == null) {
                throw new IllegalArgumentException("Los valores de '" + quantity + "' no pueden ser nulos.");
            }
            quantities.put(quantity, SpectralQuantity.of(quantity, values));
        });

        Spectrum spectrum = new Spectrum(name, wavenumber, quantities, conditions);
        log.debug("Espectro {} creado: {} puntos, magnitudes {}", name, wavenumber.length, spectrum.knownQuantities());
        return spectrum;
    }

    /**
     * Atajo para el caso habitual: la síntesis solo entrega el coeficiente de absorción.
     */
    public Spectrum fromAbscoeff(String name, double[] wavenumber, double[] abscoeff, ConditionSet conditions) {
        Map<QuantityName, double[]> initial = new EnumMap<>(QuantityName.class);
        initial.put(QuantityName.ABSCOEFF, abscoeff);
        return create(name, wavenumber, initial, conditions);
    }

    private void validateAxis(double[] wavenumber) {
        if (wavenumber.length == 0) {
            throw new IllegalArgumentException("El eje espectral no puede estar vacío.");
        }
        for (double w : wavenumber) {
            if (!Double.isFinite(w)) {
                throw new IllegalArgumentException("El eje espectral contiene valores no finitos.");
            }
            if (w <= 0) {
                throw new IllegalArgumentException("El eje espectral debe ser positivo (cm⁻¹): " + w);
            }
        }
        if (wavenumber.length < 2) {
            return;
        }
        boolean ascending = wavenumber[1] > wavenumber[0];
        for (int i = 1; i < wavenumber.length; i++) {
            double step = wavenumber[i] - wavenumber[i - 1];
            if (ascending ? step <= 0 : step >= 0) {
                throw new IllegalArgumentException("El eje espectral debe ser estrictamente monótono (índice " + i + ").");
            }
        }
    }
}
