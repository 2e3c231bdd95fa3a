package spectralengine.physics.updater;

import lombok.extern.slf4j.Slf4j;
import spectralengine.config.EngineConfig;
import spectralengine.domain.exception.UnreachableQuantityException;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;
import spectralengine.domain.spectrum.SpectralQuantity;
import spectralengine.domain.spectrum.Spectrum;
import spectralengine.physics.graph.DerivationPlan;
import spectralengine.physics.graph.ReachabilityAnalyzer;
import spectralengine.physics.registry.DerivationRule;
import spectralengine.physics.registry.FormulaContext;
import spectralengine.physics.registry.QuantityRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Orquestador del recálculo de magnitudes.
 * Responsabilidades:
 * 1. Obtener el plan de derivación (punto fijo) para el conjunto conocido y el régimen.
 * 2. Resolver cada objetivo siguiendo el plan, calculando los precursores intermedios
 *    en un espacio temporal que no se guarda en el espectro.
 * 3. Guardar en el espectro solo los objetivos pedidos, y solo si todos se pudieron calcular.
 * <p>
 * Es determinista: mismas magnitudes y condiciones producen arrays idénticos bit a bit.
 */
@Slf4j
public class SpectrumUpdater {

    private final ReachabilityAnalyzer reachabilityAnalyzer;
    private final EngineConfig config;

    public SpectrumUpdater(ReachabilityAnalyzer reachabilityAnalyzer, EngineConfig config) {
        this.reachabilityAnalyzer = reachabilityAnalyzer;
        this.config = config;
    }

    /**
     * Recalcula los objetivos y los añade al espectro.
     *
     * @param spectrum Espectro a completar (se modifica).
     * @param targets  Magnitudes a calcular o {@link UpdateTargets#all()}.
     * @param listener Receptor de la traza de derivación.
     * @return Las magnitudes nuevas, en orden de catálogo. Vacío si no había nada que calcular.
     * @throws UnreachableQuantityException si un objetivo explícito no es alcanzable.
     */
    public Map<QuantityName, SpectralQuantity> update(Spectrum spectrum, UpdateTargets targets, DerivationListener listener) {
        DerivationPlan plan = planFor(spectrum);

        List<QuantityName> pending = new ArrayList<>();
        if (targets.isAll()) {
            pending.addAll(plan.derivable());
        } else {
            for (QuantityName target : targets.names()) {
                if (spectrum.has(target)) continue;
                if (!plan.isReachable(target)) {
                    throw unreachable(target, spectrum, plan.regime());
                }
                pending.add(target);
            }
        }

        Map<QuantityName, double[]> scratch = new EnumMap<>(QuantityName.class);
        Map<QuantityName, SpectralQuantity> computed = new LinkedHashMap<>();
        for (QuantityName target : pending) {
            double[] values = resolve(target, spectrum, plan, scratch, listener);
            computed.put(target, SpectralQuantity.of(target, values));
        }

        computed.values().forEach(spectrum::put);
        if (!computed.isEmpty()) {
            log.debug("update({}) en {}: calculadas {}", targets, spectrum.getName(), computed.keySet());
        }
        return computed;
    }

    /**
     * Devuelve los valores de una magnitud, conocida o derivada, SIN guardarla en el espectro.
     *
     * @throws UnreachableQuantityException si no es alcanzable.
     */
    public double[] compute(Spectrum spectrum, QuantityName quantity, DerivationListener listener) {
        if (spectrum.has(quantity)) {
            return spectrum.values(quantity);
        }
        DerivationPlan plan = planFor(spectrum);
        if (!plan.isReachable(quantity)) {
            throw unreachable(quantity, spectrum, plan.regime());
        }
        return resolve(quantity, spectrum, plan, new EnumMap<>(QuantityName.class), listener);
    }

    public boolean isReachable(Spectrum spectrum, QuantityName quantity) {
        return planFor(spectrum).isReachable(quantity);
    }

    public DerivationPlan planFor(Spectrum spectrum) {
        ConditionSet conditions = spectrum.getConditions();
        Regime regime = conditions.declaredRegime(config.equilibriumTemperatureTolerance());
        return reachabilityAnalyzer.plan(spectrum.knownQuantities(), regime, conditions);
    }

    private double[] resolve(QuantityName quantity, Spectrum spectrum, DerivationPlan plan,
                             Map<QuantityName, double[]> scratch, DerivationListener listener) {
        if (spectrum.has(quantity)) {
            return spectrum.values(quantity);
        }
        double[] cached = scratch.get(quantity);
        if (cached != null) {
            return cached;
        }

        // El plan garantiza que los precursores se resolvieron en rondas anteriores: no hay ciclos.
        DerivationRule rule = plan.stepFor(quantity)
                .orElseThrow(() -> unreachable(quantity, spectrum, plan.regime()));

        Map<QuantityName, double[]> inputs = new EnumMap<>(QuantityName.class);
        for (QuantityName precursor : rule.precursors()) {
            inputs.put(precursor, resolve(precursor, spectrum, plan, scratch, listener));
        }

        FormulaContext context = new FormulaContext(inputs, spectrum.getWavenumber(), spectrum.getConditions(), config);
        double[] values = rule.formula().apply(context);
        listener.onDerivation(new DerivationStep(quantity, rule));

        scratch.put(quantity, values);
        return values;
    }

    private UnreachableQuantityException unreachable(QuantityName quantity, Spectrum spectrum, Regime regime) {
        String candidates = QuantityRegistry.rulesFor(quantity).stream()
                .filter(rule -> rule.isApplicable(regime, spectrum.getConditions()))
                .map(rule -> rule.precursors().toString())
                .collect(Collectors.joining(" o "));
        String detail = candidates.isEmpty()
                ? "no hay ninguna regla aplicable con las condiciones actuales."
                : "conocidas " + spectrum.knownQuantities() + ", se necesitaría " + candidates + ".";
        return new UnreachableQuantityException(quantity, regime, detail);
    }
}
