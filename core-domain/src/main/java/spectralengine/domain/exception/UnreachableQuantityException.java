package spectralengine.domain.exception;

import lombok.Getter;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;

/**
 * Se pidió explícitamente una magnitud que no tiene ningún camino de derivación
 * satisfacible con las magnitudes conocidas y el régimen activo.
 */
@Getter
public class UnreachableQuantityException extends SpectralEngineException {

    private final QuantityName quantity;
    private final Regime regime;

    public UnreachableQuantityException(QuantityName quantity, Regime regime, String detail) {
        super("No se puede calcular '" + quantity + "' en régimen " + regime + ": " + detail);
        this.quantity = quantity;
        this.regime = regime;
    }
}
