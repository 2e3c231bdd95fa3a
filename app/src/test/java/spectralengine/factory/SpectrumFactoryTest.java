package spectralengine.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import spectralengine.domain.spectrum.ConditionSet;
import spectralengine.domain.spectrum.QuantityName;
import spectralengine.domain.spectrum.Spectrum;
import spectralengine.fixture.TestSpectra;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpectrumFactoryTest {

    private final SpectrumFactory factory = new SpectrumFactory();
    private final ConditionSet conditions = TestSpectra.equilibriumConditions();

    @Test
    @DisplayName("Creación: el espectro es independiente de los arrays de la síntesis")
    void create_shouldCopyInputArrays() {
        // ARRANGE
        double[] wavenumber = {2000.0, 2001.0, 2002.0};
        double[] xsection = {1e-20, 2e-20, 3e-20};
        Map<QuantityName, double[]> initial = new EnumMap<>(QuantityName.class);
        initial.put(QuantityName.XSECTION, xsection);

        // ACT
        Spectrum spectrum = factory.create("xs", wavenumber, initial, conditions);
        xsection[0] = -1.0;
        wavenumber[0] = -1.0;

        // ASSERT
        assertEquals(EnumSet.of(QuantityName.XSECTION), spectrum.knownQuantities());
        assertEquals(1e-20, spectrum.values(QuantityName.XSECTION)[0]);
        assertEquals(2000.0, spectrum.getWavenumber()[0]);
    }

    @Test
    @DisplayName("Eje descendente: también es válido si es estrictamente monótono")
    void create_shouldAcceptDescendingAxis() {
        Spectrum spectrum = factory.fromAbscoeff("desc", new double[]{2002.0, 2001.0, 2000.0},
                new double[]{0.1, 0.2, 0.3}, conditions);

        assertEquals(3, spectrum.size());
    }

    @Test
    @DisplayName("Validación: hace falta abscoeff o xsection")
    void create_shouldRequireAbsorptionQuantity() {
        Map<QuantityName, double[]> initial = new EnumMap<>(QuantityName.class);
        initial.put(QuantityName.RADIANCE_NOSLIT, new double[]{1.0, 2.0});

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> factory.create("no-k", new double[]{1.0, 2.0}, initial, conditions));
        assertTrue(ex.getMessage().contains("abscoeff"));
    }

    @Test
    @DisplayName("Validación: eje no monótono, no finito o vacío")
    void create_shouldRejectInvalidAxis() {
        double[] k = {0.1, 0.2, 0.3};

        assertThrows(IllegalArgumentException.class,
                () -> factory.fromAbscoeff("dup", new double[]{2000.0, 2000.0, 2001.0}, k, conditions));
        assertThrows(IllegalArgumentException.class,
                () -> factory.fromAbscoeff("zigzag", new double[]{2000.0, 2002.0, 2001.0}, k, conditions));
        assertThrows(IllegalArgumentException.class,
                () -> factory.fromAbscoeff("nan", new double[]{2000.0, Double.NaN, 2001.0}, k, conditions));
        assertThrows(IllegalArgumentException.class,
                () -> factory.fromAbscoeff("empty", new double[0], new double[0], conditions));
    }

    @Test
    @DisplayName("Validación: el número de onda debe ser positivo (Planck no está definido en ν ≤ 0)")
    void create_shouldRejectNonPositiveWavenumber() {
        double[] k = {0.1, 0.2, 0.3};

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> factory.fromAbscoeff("zero", new double[]{0.0, 1.0, 2.0}, k, conditions));
        assertTrue(ex.getMessage().contains("positivo"));
        assertThrows(IllegalArgumentException.class,
                () -> factory.fromAbscoeff("negative", new double[]{-2.0, -1.0, 1.0}, k, conditions));
    }

    @Test
    @DisplayName("Validación: los arrays deben tener la longitud del eje")
    void create_shouldRejectShapeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.fromAbscoeff("short", new double[]{1.0, 2.0, 3.0}, new double[]{0.1}, conditions));
    }
}
