package spectralengine.physics.updater;

import spectralengine.domain.spectrum.QuantityName;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Qué debe recalcular el actualizador: una magnitud, varias, o "todas las alcanzables".
 * <p>
 * La diferencia importa para los errores: un objetivo explícito inalcanzable es un
 * error, mientras que con {@link #all()} simplemente se omite.
 */
public final class UpdateTargets {

    private static final UpdateTargets ALL = new UpdateTargets(EnumSet.noneOf(QuantityName.class), true);

    private final Set<QuantityName> names;
    private final boolean all;

    private UpdateTargets(Set<QuantityName> names, boolean all) {
        this.names = Collections.unmodifiableSet(names);
        this.all = all;
    }

    public static UpdateTargets all() {
        return ALL;
    }

    public static UpdateTargets of(QuantityName first, QuantityName... rest) {
        Objects.requireNonNull(first, "La magnitud objetivo no puede ser nula.");
        return new UpdateTargets(EnumSet.of(first, rest), false);
    }

    public static UpdateTargets of(Collection<QuantityName> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos una magnitud objetivo.");
        }
        return new UpdateTargets(EnumSet.copyOf(names), false);
    }

    public boolean isAll() {
        return all;
    }

    /**
     * Magnitudes explícitas. Vacío cuando {@link #isAll()}.
     */
    public Set<QuantityName> names() {
        return names;
    }

    @Override
    public String toString() {
        return all ? "all" : names.toString();
    }
}
