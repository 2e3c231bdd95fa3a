package spectralengine.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con los parámetros numéricos del motor de recálculo.
 * <p>
 * Agrupa las tolerancias que el motor necesita para decidir el régimen físico
 * y para detectar derivaciones mal condicionadas. No se carga desde fichero:
 * quien crea el motor construye la configuración con el builder o parte de
 * {@link #defaults()} y modifica lo necesario con los métodos {@code with...}.
 *
 * @param equilibriumTemperatureTolerance Diferencia máxima (K) entre Tgas, Tvib y Trot para considerar
 *                                        que las temperaturas coinciden (equilibrio térmico).
 * @param negligibleOpticalDepth          Profundidad óptica (k·L) por debajo de la cual el coeficiente de
 *                                        absorción se considera nulo en un punto del eje espectral.
 * @param maxNegligibleFraction           Fracción máxima del eje espectral con absorción despreciable que se
 *                                        tolera al invertir la ecuación de transferencia radiativa. Por encima
 *                                        de ella la derivación de {@code emisscoeff} está indeterminada.
 * @param traceDerivations                Si es true, cada paso de derivación se registra en el log (modo depuración).
 */
@Builder
@With
public record EngineConfig(
        double equilibriumTemperatureTolerance,
        double negligibleOpticalDepth,
        double maxNegligibleFraction,
        boolean traceDerivations
) {

    public EngineConfig {
        if (equilibriumTemperatureTolerance < 0) {
            throw new IllegalArgumentException("La tolerancia de temperatura no puede ser negativa: " + equilibriumTemperatureTolerance);
        }
        if (negligibleOpticalDepth < 0) {
            throw new IllegalArgumentException("La profundidad óptica despreciable no puede ser negativa: " + negligibleOpticalDepth);
        }
        if (maxNegligibleFraction < 0 || maxNegligibleFraction > 1) {
            throw new IllegalArgumentException("La fracción despreciable debe estar en [0, 1]: " + maxNegligibleFraction);
        }
    }

    public static EngineConfig defaults() {
        return EngineConfig.builder()
                .equilibriumTemperatureTolerance(1e-3)
                .negligibleOpticalDepth(1e-12)
                .maxNegligibleFraction(0.01)
                .traceDerivations(false)
                .build();
    }
}
