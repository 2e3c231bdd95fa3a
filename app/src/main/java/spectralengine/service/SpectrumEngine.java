package spectralengine.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import spectralengine.config.EngineConfig;
import spectralengine.domain.exception.RegimeMismatchException;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.EquilibriumCheck;
import spectralengine.domain.spectrum.Length;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;
import spectralengine.domain.spectrum.SpectralQuantity;
import spectralengine.domain.spectrum.Spectrum;
import spectralengine.physics.graph.DerivationPath;
import spectralengine.physics.graph.DerivationPlan;
import spectralengine.physics.graph.ReachabilityAnalyzer;
import spectralengine.physics.graph.RedundancyAnalyzer;
import spectralengine.physics.graph.UpdateGraph;
import spectralengine.physics.graph.UpdateGraphBuilder;
import spectralengine.physics.registry.DerivationRule;
import spectralengine.physics.rescale.SpectrumRescaler;
import spectralengine.physics.updater.DerivationListener;
import spectralengine.physics.updater.LoggingDerivationListener;
import spectralengine.physics.updater.SpectrumUpdater;
import spectralengine.physics.updater.UpdateTargets;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * API a nivel de espectro.
 * Facade de alto nivel sobre el analizador de alcanzabilidad, el actualizador y el reescalador.
 * <p>
 * No guarda estado por espectro: cada llamada lee las magnitudes y condiciones del
 * espectro recibido. Una misma instancia puede compartirse entre hilos siempre que
 * cada espectro se use desde un solo hilo.
 */
@Slf4j
public class SpectrumEngine {

    @Getter
    private final EngineConfig config;
    private final ReachabilityAnalyzer reachabilityAnalyzer;
    private final RedundancyAnalyzer redundancyAnalyzer;
    private final UpdateGraphBuilder graphBuilder;
    private final SpectrumUpdater updater;
    private final SpectrumRescaler rescaler;
    private final DerivationListener listener;

    public SpectrumEngine(EngineConfig config) {
        this(config, config.traceDerivations() ? new LoggingDerivationListener() : DerivationListener.none());
    }

    /**
     * @param listener Receptor de la traza de derivación para todas las llamadas de este motor.
     */
    public SpectrumEngine(EngineConfig config, DerivationListener listener) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.listener = Objects.requireNonNull(listener, "El listener no puede ser nulo.");
        this.reachabilityAnalyzer = new ReachabilityAnalyzer();
        this.redundancyAnalyzer = new RedundancyAnalyzer(reachabilityAnalyzer);
        this.graphBuilder = new UpdateGraphBuilder();
        this.updater = new SpectrumUpdater(reachabilityAnalyzer, config);
        this.rescaler = new SpectrumRescaler(updater, config);

        log.info("SpectrumEngine inicializado. tolerancia={} K, kL despreciable={}, fracción máxima={}, traza={}",
                config.equilibriumTemperatureTolerance(), config.negligibleOpticalDepth(),
                config.maxNegligibleFraction(), config.traceDerivations());
    }

    // --- Recálculo ---

    public Map<QuantityName, SpectralQuantity> update(Spectrum spectrum, QuantityName quantity) {
        return update(spectrum, UpdateTargets.of(quantity));
    }

    public Map<QuantityName, SpectralQuantity> update(Spectrum spectrum, Collection<QuantityName> quantities) {
        return update(spectrum, UpdateTargets.of(quantities));
    }

    /**
     * Calcula todas las magnitudes alcanzables que aún no se conocen.
     */
    public Map<QuantityName, SpectralQuantity> updateAll(Spectrum spectrum) {
        return update(spectrum, UpdateTargets.all());
    }

    public Map<QuantityName, SpectralQuantity> update(Spectrum spectrum, UpdateTargets targets) {
        isAtEquilibrium(spectrum, EquilibriumCheck.WARN);
        return updater.update(spectrum, targets, listener);
    }

    /**
     * Magnitudes que intervienen en el recálculo de los objetivos: los propios objetivos
     * más, de forma transitiva, los precursores de la regla que ejecutaría el actualizador.
     * Para las magnitudes que no son alcanzables se sigue el camino preferido del grafo de
     * actualización, que indica qué falta. El recorrido se detiene en las magnitudes
     * conocidas y en las ya visitadas.
     */
    public Set<QuantityName> getRecompute(Spectrum spectrum, Collection<QuantityName> targets) {
        DerivationPlan plan = updater.planFor(spectrum);
        UpdateGraph graph = updateGraph(spectrum);
        Set<QuantityName> known = spectrum.knownQuantities();

        Set<QuantityName> result = EnumSet.noneOf(QuantityName.class);
        Deque<QuantityName> pending = new ArrayDeque<>(targets);
        while (!pending.isEmpty()) {
            QuantityName quantity = pending.pop();
            if (!result.add(quantity) || known.contains(quantity)) {
                continue;
            }
            Optional<DerivationRule> step = plan.stepFor(quantity);
            if (step.isPresent()) {
                pending.addAll(step.get().precursors());
                continue;
            }
            List<DerivationPath> paths = graph.pathsFor(quantity);
            if (!paths.isEmpty()) {
                pending.addAll(paths.get(0).precursors());
            }
        }
        return result;
    }

    public Set<QuantityName> getRecompute(Spectrum spectrum, QuantityName target) {
        return getRecompute(spectrum, List.of(target));
    }

    // --- Análisis ---

    public Map<QuantityName, Boolean> getReachable(Spectrum spectrum) {
        return reachabilityAnalyzer.reachable(spectrum.knownQuantities(), regimeOf(spectrum), spectrum.getConditions());
    }

    public Map<QuantityName, Boolean> getRedundant(Spectrum spectrum) {
        return redundancyAnalyzer.redundant(spectrum.knownQuantities(), regimeOf(spectrum), spectrum.getConditions());
    }

    public Map<QuantityName, Boolean> getCompressible(Spectrum spectrum) {
        return redundancyAnalyzer.compressible(spectrum.knownQuantities(), regimeOf(spectrum), spectrum.getConditions());
    }

    /**
     * Elimina del espectro las magnitudes que pueden regenerarse a partir de las restantes.
     *
     * @return Las magnitudes eliminadas.
     */
    public Set<QuantityName> compress(Spectrum spectrum) {
        Set<QuantityName> dropped = getCompressible(spectrum).entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(QuantityName.class)));
        dropped.forEach(spectrum::delete);
        log.debug("Espectro {} comprimido: eliminadas {}", spectrum.getName(), dropped);
        return dropped;
    }

    public UpdateGraph updateGraph(Spectrum spectrum) {
        return graphBuilder.build(spectrum.knownQuantities(), regimeOf(spectrum), spectrum.getConditions());
    }

    // --- Reescalado ---

    public Map<QuantityName, SpectralQuantity> rescaleMoleFraction(Spectrum spectrum, double newMoleFraction) {
        isAtEquilibrium(spectrum, EquilibriumCheck.WARN);
        return rescaler.rescaleMoleFraction(spectrum, newMoleFraction, listener);
    }

    /**
     * @param newPathLengthCm Nueva longitud en centímetros.
     */
    public Map<QuantityName, SpectralQuantity> rescalePathLength(Spectrum spectrum, double newPathLengthCm) {
        isAtEquilibrium(spectrum, EquilibriumCheck.WARN);
        return rescaler.rescalePathLength(spectrum, newPathLengthCm, listener);
    }

    public Map<QuantityName, SpectralQuantity> rescalePathLength(Spectrum spectrum, Length newPathLength) {
        isAtEquilibrium(spectrum, EquilibriumCheck.WARN);
        return rescaler.rescalePathLength(spectrum, newPathLength, listener);
    }

    // --- Régimen ---

    /**
     * Indica si las temperaturas del espectro corresponden a equilibrio térmico y, según
     * {@code check}, contrasta ese resultado con el régimen declarado explícitamente.
     *
     * @return true si Tgas, Tvib y Trot coinciden dentro de la tolerancia.
     * @throws RegimeMismatchException con {@link EquilibriumCheck#ERROR} si el régimen declarado no coincide.
     */
    public boolean isAtEquilibrium(Spectrum spectrum, EquilibriumCheck check) {
        ConditionSet conditions = spectrum.getConditions();
        Regime observed = observedRegime(conditions);
        Regime declared = conditions.declaredRegime(config.equilibriumTemperatureTolerance());

        if (declared != observed) {
            String detail = String.format("Espectro %s: Tgas=%s, Tvib=%s, Trot=%s.",
                    spectrum.getName(), conditions.tgas(), conditions.tvib(), conditions.trot());
            switch (check) {
                case ERROR:
                    throw new RegimeMismatchException(declared, observed, detail);
                case WARN:
                    log.warn("Régimen declarado {} pero las temperaturas indican {}. Se sigue con el declarado. {}",
                            declared, observed, detail);
                    break;
                case IGNORE:
                default:
                    break;
            }
        }
        return observed.isEquilibrium();
    }

    public Regime regimeOf(Spectrum spectrum) {
        return spectrum.getConditions().declaredRegime(config.equilibriumTemperatureTolerance());
    }

    // --- Diagnóstico ---

    public SpectrumDiagnostics diagnose(Spectrum spectrum) {
        ConditionSet conditions = spectrum.getConditions();
        Map<String, List<List<String>>> graph = new LinkedHashMap<>();
        updateGraph(spectrum).precursorNames().forEach((quantity, combinations) ->
                graph.put(quantity.wireName(), combinations.stream()
                        .map(SpectrumEngine::wireNames)
                        .collect(Collectors.toList())));

        return SpectrumDiagnostics.builder()
                .spectrum(spectrum.getName())
                .declaredRegime(regimeOf(spectrum))
                .observedRegime(observedRegime(conditions))
                .conditions(conditions)
                .known(wireNames(spectrum.knownQuantities()))
                .reachable(byWireName(getReachable(spectrum)))
                .redundant(byWireName(getRedundant(spectrum)))
                .compressible(byWireName(getCompressible(spectrum)))
                .updateGraph(graph)
                .build();
    }

    private Regime observedRegime(ConditionSet conditions) {
        return Regime.of(conditions.temperaturesCoincide(config.equilibriumTemperatureTolerance()));
    }

    private static List<String> wireNames(Collection<QuantityName> quantities) {
        return quantities.stream().map(QuantityName::wireName).collect(Collectors.toList());
    }

    private static Map<String, Boolean> byWireName(Map<QuantityName, Boolean> map) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        map.forEach((quantity, value) -> result.put(quantity.wireName(), value));
        return result;
    }
}
