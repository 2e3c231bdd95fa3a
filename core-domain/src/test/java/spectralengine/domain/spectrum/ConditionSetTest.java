package spectralengine.domain.spectrum;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class ConditionSetTest {

    private static final double TOLERANCE = 1e-3;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Régimen: sin flag explícito se deduce de Tgas/Tvib/Trot")
    void declaredRegime_shouldFollowTemperaturesWhenNoFlag() {
        // ARRANGE
        ConditionSet coincident = ConditionSet.builder().tgas(1500.0).tvib(1500.0).trot(1500.0).build();
        ConditionSet divergent = ConditionSet.builder().tgas(1500.0).tvib(2000.0).trot(1000.0).build();
        ConditionSet onlyTgas = ConditionSet.builder().tgas(300.0).build();

        // ACT & ASSERT
        assertEquals(Regime.EQUILIBRIUM, coincident.declaredRegime(TOLERANCE));
        assertEquals(Regime.NON_EQUILIBRIUM, divergent.declaredRegime(TOLERANCE));
        assertEquals(Regime.EQUILIBRIUM, onlyTgas.declaredRegime(TOLERANCE), "Una sola temperatura no contradice el equilibrio.");
    }

    @Test
    @DisplayName("Régimen: el flag explícito prevalece sobre las temperaturas")
    void declaredRegime_shouldPreferExplicitFlag() {
        // ARRANGE
        ConditionSet conditions = ConditionSet.builder()
                .tgas(1500.0).tvib(2000.0)
                .thermalEquilibrium(true)
                .build();

        // ACT & ASSERT
        assertTrue(conditions.isThermalEquilibriumDeclared());
        assertFalse(conditions.temperaturesCoincide(TOLERANCE));
        assertEquals(Regime.EQUILIBRIUM, conditions.declaredRegime(TOLERANCE));
    }

    @Test
    @DisplayName("Tolerancia: diferencias por debajo de la tolerancia cuentan como coincidentes")
    void temperaturesCoincide_shouldRespectTolerance() {
        ConditionSet conditions = ConditionSet.builder().tgas(1500.0).tvib(1500.0005).build();

        assertTrue(conditions.temperaturesCoincide(1e-3));
        assertFalse(conditions.temperaturesCoincide(1e-4));
    }

    @Test
    @DisplayName("require: devuelve el valor o falla si la condición no está definida")
    void require_shouldFailOnMissingCondition() {
        // ARRANGE
        ConditionSet conditions = ConditionSet.builder().pathLength(10.0).build();

        // ACT & ASSERT
        assertTrue(conditions.has(ConditionKey.PATH_LENGTH));
        assertFalse(conditions.has(ConditionKey.MOLE_FRACTION));
        assertEquals(10.0, conditions.require(ConditionKey.PATH_LENGTH));
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> conditions.require(ConditionKey.MOLE_FRACTION));
        assertTrue(ex.getMessage().contains("mole_fraction"));
    }

    @Test
    @DisplayName("JSON: usa las claves del colaborador de almacenamiento y omite los nulos")
    void json_shouldUseStorageKeys() throws Exception {
        // ARRANGE
        ConditionSet conditions = ConditionSet.builder()
                .moleFraction(0.1)
                .pathLength(1.0)
                .pressureMbar(1013.25)
                .tgas(1500.0)
                .thermalEquilibrium(true)
                .build();

        // ACT
        String json = objectMapper.writeValueAsString(conditions);
        ConditionSet restored = objectMapper.readValue(json, ConditionSet.class);

        // ASSERT
        log.info("ConditionSet serializado: {}", json);
        assertTrue(json.contains("\"mole_fraction\":0.1"));
        assertTrue(json.contains("\"pressure_mbar\":1013.25"));
        assertTrue(json.contains("\"Tgas\":1500.0"));
        assertTrue(json.contains("\"thermal_equilibrium\":true"));
        assertFalse(json.contains("Tvib"), "Los campos nulos no se escriben.");
        assertFalse(json.contains("thermalEquilibriumDeclared"));
        assertEquals(conditions, restored);
    }

    @Test
    @DisplayName("JSON: ignora claves desconocidas al leer")
    void json_shouldIgnoreUnknownKeys() throws Exception {
        String json = "{\"path_length\": 5.0, \"Tvib\": 2000.0, \"wstep\": 0.01}";

        ConditionSet conditions = objectMapper.readValue(json, ConditionSet.class);

        assertEquals(5.0, conditions.pathLength());
        assertEquals(2000.0, conditions.tvib());
        assertNull(conditions.thermalEquilibrium());
    }
}
