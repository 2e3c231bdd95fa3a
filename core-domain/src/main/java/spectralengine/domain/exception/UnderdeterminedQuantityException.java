package spectralengine.domain.exception;

import lombok.Getter;
import spectralengine.domain.spectrum.QuantityName;

/**
 * Una derivación inversa exigiría dividir por una magnitud casi nula en demasiados
 * puntos del eje espectral. El resultado no se aproxima: se informa al llamador.
 */
@Getter
public class UnderdeterminedQuantityException extends SpectralEngineException {

    private final QuantityName quantity;
    private final double negligibleFraction;

    public UnderdeterminedQuantityException(QuantityName quantity, double negligibleFraction, double maxNegligibleFraction) {
        super(String.format("'%s' está indeterminada: la absorción es despreciable en el %.2f%% del eje (máximo tolerado %.2f%%).",
                quantity, negligibleFraction * 100, maxNegligibleFraction * 100));
        this.quantity = quantity;
        this.negligibleFraction = negligibleFraction;
    }
}
