package spectralengine.physics.updater;

import lombok.extern.slf4j.Slf4j;

/**
 * Modo traza: registra cada paso de derivación en el log a nivel DEBUG.
 */
@Slf4j
public class LoggingDerivationListener implements DerivationListener {

    @Override
    public void onDerivation(DerivationStep step) {
        log.debug("Derivación: {}", step.describe());
    }
}
