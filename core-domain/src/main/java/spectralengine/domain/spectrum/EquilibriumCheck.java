package spectralengine.domain.spectrum;

/**
 * Qué hacer cuando el régimen declarado contradice las temperaturas del espectro.
 */
public enum EquilibriumCheck {
    /** No se verifica nada. */
    IGNORE,
    /** Se registra un aviso y el cálculo continúa con el régimen declarado. */
    WARN,
    /** Se lanza {@link spectralengine.domain.exception.RegimeMismatchException}. */
    ERROR
}
