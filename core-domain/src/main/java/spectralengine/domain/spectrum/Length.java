package spectralengine.domain.spectrum;

import java.util.Objects;

/**
 * Una longitud con su unidad.
 * <p>
 * Se normaliza siempre a centímetros antes de operar, de forma que 1 km y
 * 100000 cm producen exactamente el mismo {@code double}.
 */
public record Length(double value, LengthUnit unit) {

    public Length {
        Objects.requireNonNull(unit, "La unidad de longitud no puede ser nula.");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("La longitud debe ser un número finito: " + value);
        }
    }

    public static Length of(double value, LengthUnit unit) {
        return new Length(value, unit);
    }

    public static Length centimeters(double value) {
        return new Length(value, LengthUnit.CENTIMETER);
    }

    public double toCentimeters() {
        return unit.toCentimeters(value);
    }

    public Length to(LengthUnit target) {
        return new Length(target.fromCentimeters(toCentimeters()), target);
    }

    @Override
    public String toString() {
        return value + " " + unit.symbol();
    }
}
