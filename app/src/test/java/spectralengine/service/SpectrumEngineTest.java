package spectralengine.service;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import spectralengine.config.EngineConfig;
import spectralengine.domain.exception.RegimeMismatchException;
import spectralengine.domain.exception.UnreachableQuantityException;
import spectralengine.domain.spectrum.EquilibriumCheck;
import spectralengine.domain.spectrum.Length;
import spectralengine.domain.spectrum.LengthUnit;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Regime;
import spectralengine.domain.spectrum.Spectrum;
import spectralengine.fixture.RoundTripFixture;
import spectralengine.fixture.TestSpectra;
import spectralengine.physics.solver.SpectralFormulas;
import spectralengine.physics.updater.DerivationListener;
import spectralengine.physics.updater.DerivationStep;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static spectralengine.domain.spectrum.QuantityName.*;

@Slf4j
@ExtendWith(MockitoExtension.class)
class SpectrumEngineTest {

    @Mock
    private DerivationListener listener;

    private SpectrumEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SpectrumEngine(EngineConfig.defaults(), DerivationListener.none());
    }

    private Spectrum fullEquilibrium() {
        Spectrum spectrum = TestSpectra.equilibrium();
        engine.updateAll(spectrum);
        return spectrum;
    }

    private Spectrum fullNonEquilibrium() {
        Spectrum spectrum = TestSpectra.nonEquilibrium();
        engine.updateAll(spectrum);
        return spectrum;
    }

    // --------------------------------------------------------------------------
    // Ida y vuelta
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Ida y vuelta (equilibrio): borrar y recalcular cada magnitud reproduce el original")
    void roundTrip_atEquilibrium_shouldReproduceEveryQuantity() {
        Spectrum original = fullEquilibrium();

        for (QuantityName quantity : original.knownQuantities()) {
            RoundTripFixture.assertRoundTrip(engine, original, quantity);
        }
        RoundTripFixture.assertRoundTrip(engine, original, List.of(ABSORBANCE, TRANSMITTANCE_NOSLIT, RADIANCE_NOSLIT));
    }

    @Test
    @DisplayName("Ida y vuelta (fuera de equilibrio): incluida la inversión de la ETR para emisscoeff")
    void roundTrip_outOfEquilibrium_shouldReproduceEveryQuantity() {
        Spectrum original = fullNonEquilibrium();
        log.info("Conocidas fuera de equilibrio: {}", original.knownQuantities());

        for (QuantityName quantity : original.knownQuantities()) {
            RoundTripFixture.assertRoundTrip(engine, original, quantity);
        }
    }

    @Test
    @DisplayName("Corrección de la redundancia: toda magnitud redundante se regenera desde el resto")
    void redundant_shouldImplyRoundTrip() {
        for (Spectrum original : List.of(fullEquilibrium(), fullNonEquilibrium())) {
            Map<QuantityName, Boolean> redundant = engine.getRedundant(original);
            log.info("Redundantes en {}: {}", original.getName(), redundant);

            redundant.forEach((quantity, isRedundant) -> {
                if (isRedundant) {
                    RoundTripFixture.assertRoundTrip(engine, original, quantity);
                }
            });
        }
    }

    // --------------------------------------------------------------------------
    // Escenario concreto de radiancia
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Radiancia en equilibrio: usa {abscoeff} y no {emisscoeff, abscoeff}")
    void update_radianceAtEquilibrium_shouldUseDirectFormula() {
        // ARRANGE
        SpectrumEngine traced = new SpectrumEngine(EngineConfig.defaults(), listener);
        Spectrum spectrum = TestSpectra.equilibrium();
        ArgumentCaptor<DerivationStep> step = ArgumentCaptor.forClass(DerivationStep.class);

        // ACT
        traced.update(spectrum, RADIANCE_NOSLIT);

        // ASSERT
        verify(listener).onDerivation(step.capture());
        assertEquals(List.of(ABSCOEFF), step.getValue().rule().precursors());
        assertEquals(EnumSet.of(RADIANCE_NOSLIT, ABSCOEFF), engine.getRecompute(TestSpectra.equilibrium(), RADIANCE_NOSLIT));
    }

    @Test
    @DisplayName("getRecompute a varios pasos: coincide con las magnitudes que usa el actualizador")
    void getRecompute_multiStep_shouldMatchUpdaterDerivation() {
        // ARRANGE: solo transmitancia conocida, radiancia a tres pasos (T → A → k → I)
        SpectrumEngine traced = new SpectrumEngine(EngineConfig.defaults(), listener);
        Spectrum spectrum = fullEquilibrium();
        for (QuantityName quantity : spectrum.knownQuantities()) {
            if (quantity != TRANSMITTANCE_NOSLIT) {
                spectrum.delete(quantity);
            }
        }
        ArgumentCaptor<DerivationStep> steps = ArgumentCaptor.forClass(DerivationStep.class);

        // ACT
        Set<QuantityName> recompute = traced.getRecompute(spectrum, RADIANCE_NOSLIT);
        traced.update(spectrum, RADIANCE_NOSLIT);

        // ASSERT
        verify(listener, atLeastOnce()).onDerivation(steps.capture());
        Set<QuantityName> used = EnumSet.of(TRANSMITTANCE_NOSLIT);
        steps.getAllValues().forEach(step -> used.add(step.target()));
        log.info("getRecompute(radiance_noslit) desde transmittance_noslit = {}", recompute);

        assertEquals(used, recompute);
        assertTrue(recompute.contains(TRANSMITTANCE_NOSLIT));
        assertFalse(recompute.contains(XSECTION));
        assertTrue(spectrum.has(RADIANCE_NOSLIT));
    }

    @Test
    @DisplayName("Radiancia fuera de equilibrio: necesita emisscoeff y falla si no está")
    void update_radianceOutOfEquilibrium_shouldRequireEmisscoeff() {
        // ARRANGE
        Spectrum spectrum = TestSpectra.nonEquilibrium();
        spectrum.delete(EMISSCOEFF);

        // ACT
        Set<QuantityName> recompute = engine.getRecompute(spectrum, RADIANCE_NOSLIT);

        // ASSERT
        assertEquals(EnumSet.of(RADIANCE_NOSLIT, EMISSCOEFF, ABSCOEFF), recompute);
        assertThrows(UnreachableQuantityException.class, () -> engine.update(spectrum, RADIANCE_NOSLIT));
    }

    @Test
    @DisplayName("Equilibrio: la radiancia de cuerpo negro coincide con la ETR y con Kirchhoff")
    void equilibrium_radianceFormsShouldAgree() {
        // ARRANGE
        Spectrum spectrum = fullEquilibrium();
        double[] k = spectrum.values(ABSCOEFF);

        // ACT
        double[] rte = SpectralFormulas.radianceFromEmisscoeff(spectrum.values(EMISSCOEFF), k,
                TestSpectra.PATH_LENGTH, 1e-12);
        double[] kirchhoff = SpectralFormulas.radianceFromEmissivity(spectrum.values(EMISSIVITY_NOSLIT),
                spectrum.getWavenumber(), TestSpectra.TGAS);

        // ASSERT
        RoundTripFixture.assertClose(spectrum.values(RADIANCE_NOSLIT), rte, 1e-9, "ETR");
        RoundTripFixture.assertClose(spectrum.values(RADIANCE_NOSLIT), kirchhoff, 1e-9, "Kirchhoff");
    }

    // --------------------------------------------------------------------------
    // Régimen
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("isAtEquilibrium(ERROR): falla si se declara equilibrio con Tvib distinta de Tgas")
    void isAtEquilibrium_withError_shouldThrowOnMismatch() {
        // ARRANGE
        Spectrum spectrum = TestSpectra.equilibrium();
        spectrum.setConditions(spectrum.getConditions().withTvib(2000.0));

        // ACT
        RegimeMismatchException ex = assertThrows(RegimeMismatchException.class,
                () -> engine.isAtEquilibrium(spectrum, EquilibriumCheck.ERROR));

        // ASSERT
        assertEquals(Regime.EQUILIBRIUM, ex.getDeclared());
        assertEquals(Regime.NON_EQUILIBRIUM, ex.getObserved());
        assertFalse(engine.isAtEquilibrium(spectrum, EquilibriumCheck.WARN));
        assertFalse(engine.isAtEquilibrium(spectrum, EquilibriumCheck.IGNORE));
    }

    @Test
    @DisplayName("Discrepancia de régimen con WARN: el cálculo sigue con el régimen declarado")
    void update_withRegimeMismatch_shouldProceedUnderDeclaredRegime() {
        // ARRANGE
        Spectrum spectrum = TestSpectra.equilibrium();
        spectrum.setConditions(spectrum.getConditions().withTvib(2000.0));

        // ACT
        engine.update(spectrum, EMISSIVITY_NOSLIT);

        // ASSERT
        assertTrue(spectrum.has(EMISSIVITY_NOSLIT), "Kirchhoff sigue disponible bajo el régimen declarado.");
        assertEquals(Regime.EQUILIBRIUM, engine.regimeOf(spectrum));
    }

    @Test
    @DisplayName("isAtEquilibrium: coherente en ambos regímenes")
    void isAtEquilibrium_shouldReportObservedRegime() {
        assertTrue(engine.isAtEquilibrium(TestSpectra.equilibrium(), EquilibriumCheck.ERROR));
        assertFalse(engine.isAtEquilibrium(TestSpectra.nonEquilibrium(), EquilibriumCheck.ERROR));
    }

    // --------------------------------------------------------------------------
    // Compresión y análisis
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("compress: conserva solo abscoeff y update(all) lo reconstruye todo")
    void compress_thenUpdateAll_shouldRestoreSpectrum() {
        // ARRANGE
        Spectrum original = fullEquilibrium();
        Spectrum compressed = original.copy();

        // ACT
        Set<QuantityName> dropped = engine.compress(compressed);
        engine.updateAll(compressed);

        // ASSERT
        assertEquals(EnumSet.of(ABSORBANCE, EMISSCOEFF, RADIANCE_NOSLIT, TRANSMITTANCE_NOSLIT, EMISSIVITY_NOSLIT, XSECTION),
                dropped);
        assertEquals(original.knownQuantities(), compressed.knownQuantities());
        for (QuantityName quantity : original.knownQuantities()) {
            RoundTripFixture.assertClose(original.values(quantity), compressed.values(quantity),
                    RoundTripFixture.RELATIVE_TOLERANCE, quantity.wireName());
        }
    }

    @Test
    @DisplayName("getReachable y updateGraph fuera de equilibrio")
    void analysis_outOfEquilibrium_shouldHonourRegime() {
        Spectrum spectrum = TestSpectra.nonEquilibrium();

        Map<QuantityName, Boolean> reachable = engine.getReachable(spectrum);

        assertTrue(reachable.get(RADIANCE_NOSLIT));
        assertFalse(reachable.get(EMISSIVITY_NOSLIT));
        assertTrue(engine.updateGraph(spectrum).pathsFor(EMISSIVITY_NOSLIT).isEmpty());
    }

    // --------------------------------------------------------------------------
    // Reescalado y configuración
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("rescalePathLength con unidades: 1 m equivale a 100 cm")
    void rescalePathLength_withUnits_shouldNormalizeToCentimeters() {
        // ARRANGE
        Spectrum inMeters = fullEquilibrium();
        Spectrum inCentimeters = inMeters.copy();

        // ACT
        engine.rescalePathLength(inMeters, Length.of(1, LengthUnit.METER));
        engine.rescalePathLength(inCentimeters, 100.0);

        // ASSERT
        assertEquals(100.0, inMeters.getConditions().pathLength());
        for (QuantityName quantity : inMeters.knownQuantities()) {
            assertArrayEquals(inCentimeters.values(quantity), inMeters.values(quantity), quantity.wireName());
        }
    }

    @Test
    @DisplayName("rescaleMoleFraction a través del motor actualiza las condiciones")
    void rescaleMoleFraction_shouldUpdateConditions() {
        Spectrum spectrum = fullEquilibrium();

        engine.rescaleMoleFraction(spectrum, 0.1);

        assertEquals(0.1, spectrum.getConditions().moleFraction());
        assertTrue(spectrum.has(RADIANCE_NOSLIT));
    }

    @Test
    @DisplayName("Modo traza: el motor con traceDerivations funciona igual")
    void traceMode_shouldNotChangeResults() {
        // ARRANGE
        SpectrumEngine traced = new SpectrumEngine(EngineConfig.defaults().withTraceDerivations(true));
        Spectrum a = TestSpectra.nonEquilibrium();
        Spectrum b = a.copy();

        // ACT
        traced.updateAll(a);
        engine.updateAll(b);

        // ASSERT
        for (QuantityName quantity : a.knownQuantities()) {
            assertArrayEquals(b.values(quantity), a.values(quantity), quantity.wireName());
        }
    }

    @Test
    @DisplayName("diagnose: resume el estado con nombres externos")
    void diagnose_shouldSummarizeSpectrum() {
        // ACT
        SpectrumDiagnostics diagnostics = engine.diagnose(TestSpectra.equilibrium());

        // ASSERT
        assertEquals("eq-test", diagnostics.spectrum());
        assertEquals(Regime.EQUILIBRIUM, diagnostics.declaredRegime());
        assertEquals(List.of("abscoeff"), diagnostics.known());
        assertTrue(diagnostics.reachable().get("radiance_noslit"));
        assertFalse(diagnostics.redundant().get("abscoeff"));
        assertEquals(List.of("abscoeff"), diagnostics.updateGraph().get("radiance_noslit").get(0));
    }
}
