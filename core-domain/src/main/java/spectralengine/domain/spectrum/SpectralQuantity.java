package spectralengine.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * Una magnitud espectral conocida: un array indexado por número de onda más su unidad.
 * <p>
 * Es un objeto de valor inmutable. El constructor canónico hace una copia defensiva
 * del array y {@link #values()} devuelve otra copia, de forma que ningún consumidor
 * puede alterar el contenido almacenado en un {@link Spectrum}.
 *
 * @param name   Identidad de la magnitud.
 * @param values Valores en cada punto del eje espectral, en la unidad {@code unit}.
 * @param unit   Unidad física de los valores.
 */
public record SpectralQuantity(QuantityName name, double[] values, String unit) {

    public SpectralQuantity {
        Objects.requireNonNull(name, "El nombre de la magnitud no puede ser nulo.");
        Objects.requireNonNull(values, "El array de valores no puede ser nulo.");
        Objects.requireNonNull(unit, "La unidad no puede ser nula.");
        values = values.clone();
    }

    /**
     * Crea la magnitud en su unidad interna por defecto.
     */
    public static SpectralQuantity of(QuantityName name, double[] values) {
        return new SpectralQuantity(name, values, name.unit());
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int length() {
        return values.length;
    }

    public double valueAt(int index) {
        if (index < 0 || index >= values.length) {
            throw new IndexOutOfBoundsException("El índice " + index + " está fuera de los límites [0, " + (values.length - 1) + "].");
        }
        return values[index];
    }

    public double max() {
        return Arrays.stream(values).max().orElse(Double.NaN);
    }

    // equals y hashCode por contenido del array.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpectralQuantity that = (SpectralQuantity) o;
        return name == that.name && unit.equals(that.unit) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, unit);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        return "SpectralQuantity[" + name + ", n=" + values.length + ", unit=" + unit + "]";
    }
}
