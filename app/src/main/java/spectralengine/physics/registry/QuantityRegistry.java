package spectralengine.physics.registry;

import spectralengine.domain.spectrum.ConditionKey;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.physics.solver.SpectralFormulas;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static spectralengine.domain.spectrum.ConditionKey.MOLE_FRACTION;
import static spectralengine.domain.spectrum.ConditionKey.PATH_LENGTH;
import static spectralengine.domain.spectrum.ConditionKey.PRESSURE;
import static spectralengine.domain.spectrum.ConditionKey.TGAS;
import static spectralengine.domain.spectrum.QuantityName.ABSCOEFF;
import static spectralengine.domain.spectrum.QuantityName.ABSORBANCE;
import static spectralengine.domain.spectrum.QuantityName.EMISSCOEFF;
import static spectralengine.domain.spectrum.QuantityName.EMISSIVITY_NOSLIT;
import static spectralengine.domain.spectrum.QuantityName.RADIANCE_NOSLIT;
import static spectralengine.domain.spectrum.QuantityName.TRANSMITTANCE_NOSLIT;
import static spectralengine.domain.spectrum.QuantityName.XSECTION;

/**
 * Tabla estática de las relaciones entre magnitudes espectrales.
 * <p>
 * Cada relación es un {@link DerivationRule} en una colección plana y ordenada:
 * el orden de declaración ES la prioridad (conversiones directas primero, después
 * Beer-Lambert, Kirchhoff y por último la transferencia radiativa de dos magnitudes).
 * Los analizadores de grafo recorren esta tabla; ninguna magnitud "sabe" calcularse
 * a sí misma.
 * <p>
 * Se construye una sola vez al cargar la clase y es inmutable, por lo que puede
 * leerse desde varios hilos sin sincronización.
 */
public final class QuantityRegistry {

    private static final List<DerivationRule> RULES;
    private static final Map<QuantityName, List<DerivationRule>> RULES_BY_TARGET;

    static {
        List<DerivationRule> rules = new ArrayList<>();

        // --- Conversiones directas ---
        add(rules, XSECTION, RuleRegime.BOTH, RuleKind.CONVERSION, EnumSet.of(MOLE_FRACTION, PRESSURE, TGAS),
                "σ = k / (x·N)",
                ctx -> SpectralFormulas.xsectionFromAbscoeff(ctx.input(ABSCOEFF),
                        ctx.condition(MOLE_FRACTION), ctx.condition(PRESSURE), ctx.condition(TGAS)),
                ABSCOEFF);
        add(rules, ABSCOEFF, RuleRegime.BOTH, RuleKind.CONVERSION, EnumSet.of(MOLE_FRACTION, PRESSURE, TGAS),
                "k = σ·x·N",
                ctx -> SpectralFormulas.abscoeffFromXsection(ctx.input(XSECTION),
                        ctx.condition(MOLE_FRACTION), ctx.condition(PRESSURE), ctx.condition(TGAS)),
                XSECTION);

        // --- Beer-Lambert ---
        add(rules, ABSORBANCE, RuleRegime.BOTH, RuleKind.PHYSICAL, EnumSet.of(PATH_LENGTH),
                "A = k·L",
                ctx -> SpectralFormulas.absorbanceFromAbscoeff(ctx.input(ABSCOEFF), ctx.condition(PATH_LENGTH)),
                ABSCOEFF);
        add(rules, ABSCOEFF, RuleRegime.BOTH, RuleKind.PHYSICAL, EnumSet.of(PATH_LENGTH),
                "k = A / L",
                ctx -> SpectralFormulas.abscoeffFromAbsorbance(ctx.input(ABSORBANCE), ctx.condition(PATH_LENGTH)),
                ABSORBANCE);
        add(rules, TRANSMITTANCE_NOSLIT, RuleRegime.BOTH, RuleKind.PHYSICAL, EnumSet.noneOf(ConditionKey.class),
                "T = exp(-A)",
                ctx -> SpectralFormulas.transmittanceFromAbsorbance(ctx.input(ABSORBANCE)),
                ABSORBANCE);
        add(rules, ABSORBANCE, RuleRegime.BOTH, RuleKind.PHYSICAL, EnumSet.noneOf(ConditionKey.class),
                "A = -ln(T)",
                ctx -> SpectralFormulas.absorbanceFromTransmittance(ctx.input(TRANSMITTANCE_NOSLIT)),
                TRANSMITTANCE_NOSLIT);

        // --- Kirchhoff (solo equilibrio) ---
        add(rules, EMISSIVITY_NOSLIT, RuleRegime.EQUILIBRIUM_ONLY, RuleKind.PHYSICAL, EnumSet.noneOf(ConditionKey.class),
                "ε = 1 - T (Kirchhoff)",
                ctx -> SpectralFormulas.emissivityFromTransmittance(ctx.input(TRANSMITTANCE_NOSLIT)),
                TRANSMITTANCE_NOSLIT);
        add(rules, TRANSMITTANCE_NOSLIT, RuleRegime.EQUILIBRIUM_ONLY, RuleKind.PHYSICAL, EnumSet.noneOf(ConditionKey.class),
                "T = 1 - ε (Kirchhoff)",
                ctx -> SpectralFormulas.transmittanceFromEmissivity(ctx.input(EMISSIVITY_NOSLIT)),
                EMISSIVITY_NOSLIT);
        add(rules, RADIANCE_NOSLIT, RuleRegime.EQUILIBRIUM_ONLY, RuleKind.PHYSICAL, EnumSet.of(PATH_LENGTH, TGAS),
                "I = B(ν,Tgas)·(1 - exp(-k·L))",
                ctx -> SpectralFormulas.radianceAtEquilibrium(ctx.input(ABSCOEFF), ctx.condition(PATH_LENGTH),
                        ctx.wavenumber(), ctx.condition(TGAS)),
                ABSCOEFF);
        add(rules, RADIANCE_NOSLIT, RuleRegime.EQUILIBRIUM_ONLY, RuleKind.PHYSICAL, EnumSet.of(TGAS),
                "I = ε·B(ν,Tgas)",
                ctx -> SpectralFormulas.radianceFromEmissivity(ctx.input(EMISSIVITY_NOSLIT), ctx.wavenumber(),
                        ctx.condition(TGAS)),
                EMISSIVITY_NOSLIT);
        add(rules, EMISSCOEFF, RuleRegime.EQUILIBRIUM_ONLY, RuleKind.PHYSICAL, EnumSet.of(TGAS),
                "j = k·B(ν,Tgas) (Kirchhoff)",
                ctx -> SpectralFormulas.emisscoeffAtEquilibrium(ctx.input(ABSCOEFF), ctx.wavenumber(),
                        ctx.condition(TGAS)),
                ABSCOEFF);

        // --- Transferencia radiativa (cualquier régimen) ---
        add(rules, RADIANCE_NOSLIT, RuleRegime.BOTH, RuleKind.PHYSICAL, EnumSet.of(PATH_LENGTH),
                "I = j/k·(1 - exp(-k·L))",
                ctx -> SpectralFormulas.radianceFromEmisscoeff(ctx.input(EMISSCOEFF), ctx.input(ABSCOEFF),
                        ctx.condition(PATH_LENGTH), ctx.config().negligibleOpticalDepth()),
                EMISSCOEFF, ABSCOEFF);
        add(rules, EMISSCOEFF, RuleRegime.BOTH, RuleKind.PHYSICAL, EnumSet.of(PATH_LENGTH),
                "j = I·k / (1 - exp(-k·L))",
                ctx -> SpectralFormulas.emisscoeffFromRadiance(ctx.input(RADIANCE_NOSLIT), ctx.input(ABSCOEFF),
                        ctx.condition(PATH_LENGTH), ctx.config().negligibleOpticalDepth(),
                        ctx.config().maxNegligibleFraction()),
                RADIANCE_NOSLIT, ABSCOEFF);

        RULES = Collections.unmodifiableList(rules);

        Map<QuantityName, List<DerivationRule>> byTarget = new EnumMap<>(QuantityName.class);
        for (QuantityName quantity : QuantityName.values()) {
            List<DerivationRule> forTarget = new ArrayList<>();
            for (DerivationRule rule : rules) {
                if (rule.target() == quantity) forTarget.add(rule);
            }
            byTarget.put(quantity, Collections.unmodifiableList(forTarget));
        }
        RULES_BY_TARGET = Collections.unmodifiableMap(byTarget);
    }

    /**
     * Prohibido construir esta clase utilidad
     */
    private QuantityRegistry() {
    }

    private static void add(List<DerivationRule> rules, QuantityName target, RuleRegime regime, RuleKind kind,
                            Set<ConditionKey> conditions, String description, SpectralFormula formula,
                            QuantityName... precursors) {
        rules.add(new DerivationRule(rules.size(), target, List.of(precursors), regime, conditions, kind,
                description, formula));
    }

    /**
     * Todas las reglas, en orden de prioridad.
     */
    public static List<DerivationRule> allRules() {
        return RULES;
    }

    /**
     * Reglas que producen {@code quantity}, en orden de prioridad. Lista vacía para
     * magnitudes que el motor no sabe derivar (las convolucionadas con rendija).
     */
    public static List<DerivationRule> rulesFor(QuantityName quantity) {
        return RULES_BY_TARGET.get(quantity);
    }

    public static boolean isDerivable(QuantityName quantity) {
        return !RULES_BY_TARGET.get(quantity).isEmpty();
    }
}
