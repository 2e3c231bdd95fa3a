package spectralengine.domain.spectrum;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Contenedor mutable de las magnitudes espectrales conocidas y de las condiciones físicas.
 * <p>
 * Es el dueño exclusivo de sus magnitudes. El motor recibe un espectro, lo lee y lo
 * modifica en el hilo que hace la llamada, sin sincronización interna. Cuando se
 * quiere comparar un original con una versión recalculada se trabaja sobre
 * {@link #copy()}, que produce una instancia completamente independiente.
 * <p>
 * Todas las magnitudes comparten el mismo eje espectral (número de onda en cm⁻¹).
 */
public class Spectrum {

    @Getter
    private final String name;
    private final double[] wavenumber;
    private final EnumMap<QuantityName, SpectralQuantity> quantities;
    @Getter
    private ConditionSet conditions;

    public Spectrum(String name, double[] wavenumber, Map<QuantityName, SpectralQuantity> quantities, ConditionSet conditions) {
        Objects.requireNonNull(wavenumber, "El eje espectral no puede ser nulo.");
        Objects.requireNonNull(quantities, "El mapa de magnitudes no puede ser nulo.");
        Objects.requireNonNull(conditions, "Las condiciones no pueden ser nulas.");
        if (wavenumber.length == 0) {
            throw new IllegalArgumentException("El eje espectral no puede estar vacío.");
        }
        this.name = name;
        this.wavenumber = wavenumber.clone();
        this.quantities = new EnumMap<>(QuantityName.class);
        this.conditions = conditions;
        quantities.values().forEach(this::put);
    }

    /**
     * Copia profunda: el eje, las magnitudes y las condiciones quedan desacoplados del original.
     */
    public Spectrum copy() {
        return new Spectrum(name, wavenumber, quantities, conditions);
    }

    public double[] getWavenumber() {
        return wavenumber.clone();
    }

    public int size() {
        return wavenumber.length;
    }

    public void setConditions(ConditionSet conditions) {
        this.conditions = Objects.requireNonNull(conditions, "Las condiciones no pueden ser nulas.");
    }

    public boolean has(QuantityName quantity) {
        return quantities.containsKey(quantity);
    }

    public Optional<SpectralQuantity> find(QuantityName quantity) {
        return Optional.ofNullable(quantities.get(quantity));
    }

    /**
     * Devuelve la magnitud almacenada.
     *
     * @throws IllegalStateException si la magnitud no es conocida.
     */
    public SpectralQuantity get(QuantityName quantity) {
        SpectralQuantity value = quantities.get(quantity);
        if (value == null) {
            throw new IllegalStateException("La magnitud '" + quantity + "' no está en el espectro " + name + ".");
        }
        return value;
    }

    /**
     * Atajo para obtener una copia de los valores de una magnitud conocida.
     */
    public double[] values(QuantityName quantity) {
        return get(quantity).values();
    }

    /**
     * Añade o sustituye una magnitud.
     *
     * @throws IllegalArgumentException si el array no tiene la longitud del eje espectral
     *                                  o si la magnitud no está en su unidad interna.
     */
    public void put(SpectralQuantity quantity) {
        Objects.requireNonNull(quantity, "La magnitud no puede ser nula.");
        if (!quantity.unit().equals(quantity.name().unit())) {
            throw new IllegalArgumentException("La magnitud '" + quantity.name() + "' está en '" + quantity.unit()
                    + "' y se esperaba la unidad interna '" + quantity.name().unit() + "'.");
        }
        if (quantity.length() != wavenumber.length) {
            throw new IllegalArgumentException("La magnitud '" + quantity.name() + "' tiene " + quantity.length()
                    + " puntos y el eje espectral " + wavenumber.length + ".");
        }
        quantities.put(quantity.name(), quantity);
    }

    /**
     * Elimina una magnitud.
     *
     * @return true si la magnitud existía.
     */
    public boolean delete(QuantityName quantity) {
        return quantities.remove(quantity) != null;
    }

    /**
     * Conjunto (copia) de las magnitudes conocidas.
     */
    public Set<QuantityName> knownQuantities() {
        return quantities.isEmpty() ? EnumSet.noneOf(QuantityName.class) : EnumSet.copyOf(quantities.keySet());
    }

    /**
     * Vista de solo lectura de las magnitudes almacenadas.
     */
    public Map<QuantityName, SpectralQuantity> quantities() {
        return Collections.unmodifiableMap(quantities);
    }

    @Override
    public String toString() {
        return "Spectrum[" + name + ", n=" + wavenumber.length + ", quantities=" + quantities.keySet() + "]";
    }
}
