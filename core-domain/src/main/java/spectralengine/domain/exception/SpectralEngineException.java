package spectralengine.domain.exception;

/**
 * Raíz de los errores propios del motor de magnitudes espectrales.
 * <p>
 * Son excepciones no comprobadas: indican que lo pedido no es calculable con los
 * datos presentes, no un fallo transitorio, y por tanto no se reintentan.
 */
public class SpectralEngineException extends RuntimeException {

    public SpectralEngineException(String message) {
        super(message);
    }

    public SpectralEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
