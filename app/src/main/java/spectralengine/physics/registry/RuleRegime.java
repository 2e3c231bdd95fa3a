package spectralengine.physics.registry;

import spectralengine.domain.spectrum.Regime;

/**
 * Regímenes en los que es válida una regla de derivación.
 */
public enum RuleRegime {
    BOTH,
    EQUILIBRIUM_ONLY,
    NON_EQUILIBRIUM_ONLY;

    public boolean appliesTo(Regime regime) {
        switch (this) {
            case EQUILIBRIUM_ONLY:
                return regime == Regime.EQUILIBRIUM;
            case NON_EQUILIBRIUM_ONLY:
                return regime == Regime.NON_EQUILIBRIUM;
            case BOTH:
            default:
                return true;
        }
    }
}
