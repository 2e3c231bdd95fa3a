package spectralengine.domain.spectrum;

/**
 * Unidades de longitud aceptadas para la longitud del camino óptico.
 * <p>
 * La unidad interna del espectro es el centímetro; cada constante guarda cuántos
 * centímetros contiene una unidad.
 */
public enum LengthUnit {
    NANOMETER("nm", 1e-7),
    MICROMETER("um", 1e-4),
    MILLIMETER("mm", 0.1),
    CENTIMETER("cm", 1.0),
    METER("m", 100.0),
    KILOMETER("km", 100000.0);

    private final String symbol;
    private final double centimeters;

    LengthUnit(String symbol, double centimeters) {
        this.symbol = symbol;
        this.centimeters = centimeters;
    }

    public String symbol() {
        return symbol;
    }

    public double toCentimeters(double value) {
        return value * centimeters;
    }

    public double fromCentimeters(double valueCm) {
        return valueCm / centimeters;
    }
}
