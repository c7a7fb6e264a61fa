package work.lcod.scals.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.scals.shared.ScalsException;

class EngineConfigurationLoaderTest {
    @Test
    void loadsClasspathConfiguration() {
        var configuration = EngineConfigurationLoader.loadFromClasspath(getClass().getClassLoader());
        assertTrue(configuration.trackingEnabled());
        assertEquals(12.0, configuration.defaultSectionItemSpacing());
        assertTrue(configuration.allowUnknownComponents());
        assertFalse(configuration.allowUnknownActions());
    }

    @Test
    void absentKeysKeepBuilderValues() {
        var base = EngineConfiguration.builder().trackingEnabled(false).allowUnknownActions(false);
        var configuration = EngineConfigurationLoader.parse("[resolution]\nsection_item_spacing = 4.5\n", base, "test");
        assertFalse(configuration.trackingEnabled());
        assertFalse(configuration.allowUnknownActions());
        assertEquals(4.5, configuration.defaultSectionItemSpacing());
    }

    @Test
    void emptyFileYieldsDefaults() {
        var configuration = EngineConfigurationLoader.parse("");
        var defaults = EngineConfiguration.defaults();
        assertEquals(defaults.trackingEnabled(), configuration.trackingEnabled());
        assertEquals(defaults.defaultSectionItemSpacing(), configuration.defaultSectionItemSpacing());
        assertTrue(configuration.designSystem().isEmpty());
    }

    @Test
    void loadsFromPath(@TempDir Path dir) throws Exception {
        var file = dir.resolve(EngineConfigurationLoader.FILE_NAME);
        Files.writeString(file, "[validation]\nallow_unknown_components = false\n");
        assertFalse(EngineConfigurationLoader.load(file).allowUnknownComponents());
    }

    @Test
    void missingFileIsAnIoFailure(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> EngineConfigurationLoader.load(dir.resolve("absent.toml")));
    }

    @Test
    void rejectsMalformedToml() {
        var error = assertThrows(ScalsException.class, () -> EngineConfigurationLoader.parse("[resolution\ntracking = "));
        assertEquals("invalid_configuration", error.code());
    }

    @Test
    void rejectsWrongValueTypes() {
        var error = assertThrows(ScalsException.class,
            () -> EngineConfigurationLoader.parse("[resolution]\ntracking = \"yes\"\n"));
        assertTrue(error.getMessage().contains("tracking"));
    }

    @Test
    void rejectsNegativeSpacing() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfigurationLoader.parse("[resolution]\nsection_item_spacing = -1\n"));
    }

    @Test
    void toBuilderRoundTripsSettings() {
        var configuration = EngineConfiguration.builder().trackingEnabled(false).defaultSectionItemSpacing(3).build();
        assertEquals(configuration, configuration.toBuilder().build());
    }
}
