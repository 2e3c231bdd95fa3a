package spectralengine.physics.updater;

/**
 * Canal de diagnóstico que recibe cada paso de derivación.
 * <p>
 * Se pasa explícitamente al actualizador en cada llamada; no hay flag global de depuración.
 */
@FunctionalInterface
public interface DerivationListener {

    void onDerivation(DerivationStep step);

    /**
     * Listener que ignora todos los pasos.
     */
    static DerivationListener none() {
        return step -> { };
    }
}
