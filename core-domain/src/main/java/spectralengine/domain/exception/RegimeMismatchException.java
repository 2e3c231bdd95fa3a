package spectralengine.domain.exception;

import lombok.Getter;
import spectralengine.domain.spectrum.Regime;

/**
 * El régimen declarado en las condiciones contradice lo que indican las temperaturas.
 */
@Getter
public class RegimeMismatchException extends SpectralEngineException {

    private final Regime declared;
    private final Regime observed;

    public RegimeMismatchException(Regime declared, Regime observed, String detail) {
        super("Régimen declarado " + declared + " pero las temperaturas indican " + observed + ". " + detail);
        this.declared = declared;
        this.observed = observed;
    }
}
