package work.lcod.scals.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.scals.shared.ScalsException;

/**
 * Reads {@link EngineConfiguration} settings from a {@code scals.toml} file:
 *
 * <pre>
 * [resolution]
 * tracking = true
 * section_item_spacing = 8
 *
 * [validation]
 * allow_unknown_components = true
 * allow_unknown_actions = false
 * </pre>
 *
 * Absent keys keep the builder's current value. The executor and design system cannot be set
 * from a file.
 */
public final class EngineConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigurationLoader.class);

    public static final String FILE_NAME = "scals.toml";

    private EngineConfigurationLoader() {}

    public static EngineConfiguration load(Path path) {
        return load(path, EngineConfiguration.builder());
    }

    public static EngineConfiguration load(Path path, EngineConfiguration.Builder base) {
        try {
            return parse(Files.readString(path), base, path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
    }

    /** Loads {@code scals.toml} from the classpath, or the defaults when it is absent. */
    public static EngineConfiguration loadFromClasspath(ClassLoader loader) {
        try (InputStream in = loader.getResourceAsStream(FILE_NAME)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", FILE_NAME);
                return EngineConfiguration.defaults();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), EngineConfiguration.builder(), FILE_NAME);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + FILE_NAME + " from the classpath", ex);
        }
    }

    public static EngineConfiguration parse(String toml) {
        return parse(toml, EngineConfiguration.builder(), "inline");
    }

    static EngineConfiguration parse(String toml, EngineConfiguration.Builder builder, String source) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var details = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ScalsException("invalid_configuration", "Invalid configuration in " + source + ": " + details);
        }
        var resolution = result.getTable("resolution");
        if (resolution != null) {
            var tracking = bool(resolution, "tracking", source);
            if (tracking != null) {
                builder.trackingEnabled(tracking);
            }
            var spacing = number(resolution, "section_item_spacing", source);
            if (spacing != null) {
                builder.defaultSectionItemSpacing(spacing);
            }
        }
        var validation = result.getTable("validation");
        if (validation != null) {
            var components = bool(validation, "allow_unknown_components", source);
            if (components != null) {
                builder.allowUnknownComponents(components);
            }
            var actions = bool(validation, "allow_unknown_actions", source);
            if (actions != null) {
                builder.allowUnknownActions(actions);
            }
        }
        return builder.build();
    }

    private static Boolean bool(TomlTable table, String key, String source) {
        var value = table.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw new ScalsException("invalid_configuration", source + ": '" + key + "' must be a boolean");
    }

    // TOML keeps integers and floats apart; both are accepted here.
    private static Double number(TomlTable table, String key, String source) {
        var value = table.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ScalsException("invalid_configuration", source + ": '" + key + "' must be a number");
    }
}
