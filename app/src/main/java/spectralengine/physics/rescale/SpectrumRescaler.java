package spectralengine.physics.rescale;

import lombok.extern.slf4j.Slf4j;
import spectralengine.config.EngineConfig;
import spectralengine.domain.exception.UnreachableQuantityException;
import spectralengine.domain.spectrum.ConditionKey;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.Length;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;
import spectralengine.domain.spectrum.SpectralQuantity;
import spectralengine.domain.spectrum.Spectrum;
import spectralengine.physics.solver.SpectralFormulas;
import spectralengine.physics.updater.DerivationListener;
import spectralengine.physics.updater.SpectrumUpdater;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static spectralengine.domain.spectrum.QuantityName.ABSCOEFF;
import static spectralengine.domain.spectrum.QuantityName.ABSORBANCE;
import static spectralengine.domain.spectrum.QuantityName.EMISSCOEFF;
import static spectralengine.domain.spectrum.QuantityName.RADIANCE_NOSLIT;

/**
 * Reescala las magnitudes conocidas cuando cambia la longitud del camino o la fracción
 * molar, aplicando su dependencia analítica en lugar de regenerarlas desde los datos de
 * línea.
 * <p>
 * Todas las magnitudes nuevas se calculan antes de tocar el espectro: si alguna no se
 * puede reescalar, el espectro queda intacto.
 * <p>
 * Las magnitudes convolucionadas con la rendija no son lineales en estas condiciones y
 * se eliminan con un aviso.
 */
@Slf4j
public class SpectrumRescaler {

    private final SpectrumUpdater updater;
    private final EngineConfig config;

    public SpectrumRescaler(SpectrumUpdater updater, EngineConfig config) {
        this.updater = updater;
        this.config = config;
    }

    /**
     * Versión con unidades: la longitud se normaliza a centímetros antes de calcular el
     * cociente, así que 1 km y 100000 cm dan resultados idénticos bit a bit.
     */
    public Map<QuantityName, SpectralQuantity> rescalePathLength(Spectrum spectrum, Length newPathLength,
                                                                 DerivationListener listener) {
        return rescalePathLength(spectrum, newPathLength.toCentimeters(), listener);
    }

    /**
     * Reescala a una nueva longitud de camino (en cm).
     * <ul>
     * <li>abscoeff, xsection, emisscoeff: intensivas, no cambian.</li>
     * <li>absorbance: A' = A · L'/L.</li>
     * <li>transmittance_noslit: exp(-A'). emissivity_noslit: 1 - exp(-A').</li>
     * <li>radiance_noslit: se rehace sobre la nueva longitud (cuerpo negro en equilibrio o ETR).</li>
     * </ul>
     *
     * @return Las magnitudes del espectro tras el reescalado.
     */
    public Map<QuantityName, SpectralQuantity> rescalePathLength(Spectrum spectrum, double newPathLengthCm,
                                                                 DerivationListener listener) {
        if (!(newPathLengthCm > 0) || Double.isInfinite(newPathLengthCm)) {
            throw new IllegalArgumentException("La longitud de camino debe ser positiva y finita: " + newPathLengthCm);
        }
        ConditionSet oldConditions = spectrum.getConditions();
        double oldPathLength = storedPositive(spectrum, ConditionKey.PATH_LENGTH);
        double ratio = newPathLengthCm / oldPathLength;
        ConditionSet newConditions = oldConditions.withPathLength(newPathLengthCm);
        Regime regime = oldConditions.declaredRegime(config.equilibriumTemperatureTolerance());

        Set<QuantityName> known = spectrum.knownQuantities();
        Map<QuantityName, double[]> rescaled = new EnumMap<>(QuantityName.class);
        double[] newAbsorbance = null;

        for (QuantityName quantity : known) {
            switch (quantity) {
                case ABSCOEFF:
                case XSECTION:
                case EMISSCOEFF:
                    rescaled.put(quantity, spectrum.values(quantity));
                    break;
                case ABSORBANCE:
                case TRANSMITTANCE_NOSLIT:
                case EMISSIVITY_NOSLIT:
                    if (newAbsorbance == null) {
                        double[] oldAbsorbance = updater.compute(spectrum, ABSORBANCE, listener);
                        newAbsorbance = SpectralFormulas.scale(oldAbsorbance, ratio);
                    }
                    rescaled.put(quantity, fromAbsorbance(quantity, newAbsorbance, regime));
                    break;
                case RADIANCE_NOSLIT:
                    double[] knownEmisscoeff = known.contains(EMISSCOEFF) ? spectrum.values(EMISSCOEFF) : null;
                    rescaled.put(quantity, radianceAt(spectrum, newConditions, knownEmisscoeff, listener));
                    break;
                default:
                    break; // convolucionadas con rendija: se descartan
            }
        }

        apply(spectrum, rescaled, newConditions);
        log.info("Espectro {} reescalado a path_length={} cm (ratio {}).", spectrum.getName(), newPathLengthCm, ratio);
        return spectrum.quantities();
    }

    /**
     * Reescala a una nueva fracción molar.
     * <p>
     * xsection no cambia; abscoeff y emisscoeff son proporcionales a la densidad de
     * moléculas y se multiplican por x'/x. El resto se vuelve a derivar con las fórmulas
     * del actualizador bajo las nuevas condiciones, porque la interacción
     * emisión/absorción no es lineal en x.
     *
     * @return Las magnitudes del espectro tras el reescalado.
     */
    public Map<QuantityName, SpectralQuantity> rescaleMoleFraction(Spectrum spectrum, double newMoleFraction,
                                                                   DerivationListener listener) {
        if (!(newMoleFraction > 0) || newMoleFraction > 1) {
            throw new IllegalArgumentException("La fracción molar debe estar en (0, 1]: " + newMoleFraction);
        }
        ConditionSet oldConditions = spectrum.getConditions();
        double oldMoleFraction = storedPositive(spectrum, ConditionKey.MOLE_FRACTION);
        double ratio = newMoleFraction / oldMoleFraction;
        ConditionSet newConditions = oldConditions.withMoleFraction(newMoleFraction);

        Set<QuantityName> known = spectrum.knownQuantities();

        double[] newAbscoeff = SpectralFormulas.scale(updater.compute(spectrum, ABSCOEFF, listener), ratio);
        double[] newEmisscoeff = known.contains(EMISSCOEFF)
                ? SpectralFormulas.scale(spectrum.values(EMISSCOEFF), ratio)
                : null;

        Spectrum base = baseSpectrum(spectrum, newConditions, newAbscoeff, newEmisscoeff);
        if (known.contains(RADIANCE_NOSLIT) && newEmisscoeff == null && !updater.isReachable(base, RADIANCE_NOSLIT)) {
            // Sin atajo de cuerpo negro: la emisión se obtiene de la radiancia antigua y se escala igual que k.
            double[] oldEmisscoeff = updater.compute(spectrum, EMISSCOEFF, listener);
            base.put(SpectralQuantity.of(EMISSCOEFF, SpectralFormulas.scale(oldEmisscoeff, ratio)));
        }

        Map<QuantityName, double[]> rescaled = new EnumMap<>(QuantityName.class);
        for (QuantityName quantity : known) {
            if (quantity.isSlitConvolved()) continue;
            if (quantity == QuantityName.XSECTION) {
                rescaled.put(quantity, spectrum.values(quantity));
            } else {
                rescaled.put(quantity, updater.compute(base, quantity, listener));
            }
        }

        apply(spectrum, rescaled, newConditions);
        log.info("Espectro {} reescalado a mole_fraction={} (ratio {}).", spectrum.getName(), newMoleFraction, ratio);
        return spectrum.quantities();
    }

    /**
     * Valor actual de una condición que actúa como denominador del factor de escala.
     *
     * @throws IllegalStateException si falta o no es positivo y finito.
     */
    private static double storedPositive(Spectrum spectrum, ConditionKey key) {
        double value = spectrum.getConditions().require(key);
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalStateException("El espectro " + spectrum.getName() + " tiene " + key.wireName() + "="
                    + value + ": no se puede reescalar a partir de un valor no positivo.");
        }
        return value;
    }

    private double[] fromAbsorbance(QuantityName quantity, double[] absorbance, Regime regime) {
        switch (quantity) {
            case ABSORBANCE:
                return absorbance;
            case TRANSMITTANCE_NOSLIT:
                return SpectralFormulas.transmittanceFromAbsorbance(absorbance);
            case EMISSIVITY_NOSLIT:
                if (!regime.isEquilibrium()) {
                    throw new UnreachableQuantityException(quantity, regime,
                            "la ley de Kirchhoff solo es válida en equilibrio térmico.");
                }
                return SpectralFormulas.emissivityFromTransmittance(SpectralFormulas.transmittanceFromAbsorbance(absorbance));
            default:
                throw new IllegalArgumentException("'" + quantity + "' no depende solo de la absorbancia.");
        }
    }

    /**
     * Rehace radiance_noslit bajo {@code newConditions} a partir de las magnitudes intensivas
     * (que no dependen de la longitud). Si el régimen no permite el atajo de cuerpo negro,
     * emisscoeff se obtiene antes de la radiancia antigua.
     */
    private double[] radianceAt(Spectrum spectrum, ConditionSet newConditions, double[] emisscoeff,
                                DerivationListener listener) {
        double[] k = updater.compute(spectrum, ABSCOEFF, listener);
        Spectrum base = baseSpectrum(spectrum, newConditions, k, emisscoeff);
        if (emisscoeff == null && !updater.isReachable(base, RADIANCE_NOSLIT)) {
            base.put(SpectralQuantity.of(EMISSCOEFF, updater.compute(spectrum, EMISSCOEFF, listener)));
        }
        return updater.compute(base, RADIANCE_NOSLIT, listener);
    }

    private Spectrum baseSpectrum(Spectrum source, ConditionSet conditions, double[] abscoeff, double[] emisscoeff) {
        Map<QuantityName, SpectralQuantity> quantities = new EnumMap<>(QuantityName.class);
        quantities.put(ABSCOEFF, SpectralQuantity.of(ABSCOEFF, abscoeff));
        if (emisscoeff != null) {
            quantities.put(EMISSCOEFF, SpectralQuantity.of(EMISSCOEFF, emisscoeff));
        }
        return new Spectrum(source.getName(), source.getWavenumber(), quantities, conditions);
    }

    private void apply(Spectrum spectrum, Map<QuantityName, double[]> rescaled, ConditionSet newConditions) {
        for (QuantityName quantity : spectrum.knownQuantities()) {
            if (quantity.isSlitConvolved()) {
                log.warn("'{}' está convolucionada con la rendija y no puede reescalarse: se elimina de {}.",
                        quantity, spectrum.getName());
            }
            spectrum.delete(quantity);
        }
        rescaled.forEach((quantity, values) -> spectrum.put(SpectralQuantity.of(quantity, values)));
        spectrum.setConditions(newConditions);
    }
}
