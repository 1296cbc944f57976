package io.surfworks.warplayout.pass;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("LayoutPassConfig")
class LayoutPassConfigTest {

    // ==================== Defaults ====================

    @Nested
    @DisplayName("Defaults")
    class DefaultsTests {

        @Test
        @DisplayName("every stage is enabled and diagnostics are off")
        void defaults() {
            LayoutPassConfig config = LayoutPassConfig.defaults();

            assertEquals(4, config.numWarps());
            assertEquals(32, config.threadsPerWarp());
            assertEquals(10, config.maxPatternIterations());
            assertTrue(config.rematerialization());
            assertTrue(config.hoisting());
            assertTrue(config.dotAccumulatorDecomposition());
            assertFalse(config.verifyEachStage());
            assertFalse(config.dumpIr());
        }

        @Test
        @DisplayName("the config file lives under the user config directory")
        void configFile() {
            assertTrue(LayoutPassConfig.configFile().endsWith("warplayout/pass.json"));
        }
    }

    // ==================== With-ers ====================

    @Nested
    @DisplayName("Copies")
    class WithTests {

        @Test
        @DisplayName("each with method changes only its own field")
        void withMethods() {
            LayoutPassConfig config = LayoutPassConfig.defaults()
                    .withWarpGeometry(8, 64)
                    .withMaxPatternIterations(3)
                    .withHoisting(false)
                    .withVerifyEachStage(true);

            assertEquals(8, config.numWarps());
            assertEquals(64, config.threadsPerWarp());
            assertEquals(3, config.maxPatternIterations());
            assertFalse(config.hoisting());
            assertTrue(config.verifyEachStage());
            assertTrue(config.rematerialization());
            assertTrue(config.dotAccumulatorDecomposition());
            assertFalse(config.dumpIr());
        }

        @Test
        @DisplayName("the remaining switches toggle independently")
        void toggles() {
            LayoutPassConfig config = LayoutPassConfig.defaults()
                    .withRematerialization(false)
                    .withDotAccumulatorDecomposition(false)
                    .withDumpIr(true);

            assertFalse(config.rematerialization());
            assertFalse(config.dotAccumulatorDecomposition());
            assertTrue(config.dumpIr());
            assertTrue(config.hoisting());
        }
    }

    // ==================== Validation ====================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @ParameterizedTest
        @ValueSource(ints = {0, -1})
        @DisplayName("rejects non-positive geometry")
        void rejectsGeometry(int value) {
            LayoutPassConfig defaults = LayoutPassConfig.defaults();

            assertThrows(IllegalArgumentException.class, () -> defaults.withWarpGeometry(value, 32));
            assertThrows(IllegalArgumentException.class, () -> defaults.withWarpGeometry(4, value));
        }

        @Test
        @DisplayName("rejects a non-positive iteration limit")
        void rejectsIterations() {
            assertThrows(IllegalArgumentException.class,
                    () -> LayoutPassConfig.defaults().withMaxPatternIterations(0));
        }
    }
}
