package work.lcod.scals.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads wire documents (JSON or YAML), validates them and builds the immutable model.
 * Resolution never sees a document that failed validation.
 */
public final class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final DocumentValidator validator;

    public DocumentLoader() {
        this(new DocumentValidator());
    }

    public DocumentLoader(DocumentValidator validator) {
        this.validator = validator;
    }

    public DocumentDefinition loadJson(String json) {
        return load(readTree(JSON_MAPPER, json, "JSON"));
    }

    public DocumentDefinition loadYaml(String yaml) {
        return load(readTree(YAML_MAPPER, yaml, "YAML"));
    }

    /** Picks the YAML reader for {@code .yaml}/{@code .yml} files, JSON otherwise. */
    public DocumentDefinition load(Path path) {
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        var mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return load(mapper.readTree(in));
        } catch (JsonProcessingException ex) {
            throw malformed(path.toString(), ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read document: " + path, ex);
        }
    }

    public DocumentDefinition load(InputStream in) {
        try {
            return load(JSON_MAPPER.readTree(in));
        } catch (JsonProcessingException ex) {
            throw malformed("stream", ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read document stream", ex);
        }
    }

    public DocumentDefinition load(JsonNode tree) {
        var result = validator.validate(tree);
        result.warnings().forEach(warning -> log.warn(warning));
        if (!result.isValid()) {
            log.debug("Document rejected with {} issue(s)", result.errors().size());
            throw new DocumentValidationException(result.errors());
        }
        return DocumentParser.parse(tree);
    }

    private static JsonNode readTree(ObjectMapper mapper, String text, String format) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw malformed(format + " input", ex);
        }
    }

    private static DocumentValidationException malformed(String source, JsonProcessingException ex) {
        var issue = new ValidationIssue("$", ValidationIssue.Kind.INVALID_FORMAT,
            "cannot parse " + source + ": " + ex.getOriginalMessage());
        return new DocumentValidationException(List.of(issue), ex);
    }
}
