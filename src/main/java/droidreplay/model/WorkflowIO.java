package droidreplay.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link Workflow} documents as JSON.
 *
 * <p>{@link #read(Path)} checks the document against
 * {@code workflow-schema.json} before binding it, then runs
 * {@link WorkflowValidator} on the result. {@link #fromJson(String)} does
 * neither and is meant for tests and trusted input.
 */
public final class WorkflowIO {

    private static final Logger log = LoggerFactory.getLogger(WorkflowIO.class);
    private static final String SCHEMA_RESOURCE = "/workflow-schema.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static volatile JsonSchema schema;

    private WorkflowIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Loads and validates a workflow file.
     *
     * @throws IOException                  if the file cannot be read or bound
     * @throws SchemaValidationException    if the document does not fit the schema
     * @throws WorkflowValidationException  if the bound workflow breaks a structural rule
     */
    public static Workflow read(Path path) throws IOException {
        log.debug("Reading workflow from: {}", path);
        String json = Files.readString(path);
        validateSchema(json, path.toString());
        Workflow workflow = MAPPER.readValue(json, Workflow.class);
        WorkflowValidator.validate(workflow);
        log.info("Loaded workflow '{}' with {} steps from {}", workflow.getName(),
                workflow.getStepCount(), path);
        return workflow;
    }

    /** Writes the workflow pretty-printed, creating parent directories. */
    public static void write(Workflow workflow, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), workflow);
        log.info("Wrote workflow '{}' ({} steps) to {}", workflow.getName(),
                workflow.getStepCount(), path);
    }

    public static String toJson(Object value) throws IOException {
        return MAPPER.writeValueAsString(value);
    }

    public static Workflow fromJson(String json) throws IOException {
        return MAPPER.readValue(json, Workflow.class);
    }

    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(String json, String source) throws IOException {
        JsonSchema s = getSchema();
        if (s == null) {
            log.warn("{} not found on classpath, skipping schema validation", SCHEMA_RESOURCE);
            return;
        }
        Set<ValidationMessage> errors = s.validate(MAPPER.readTree(json));
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(':');
            errors.forEach(e -> sb.append("\n  ").append(e.getMessage()));
            throw new SchemaValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (schema == null) {
            synchronized (WorkflowIO.class) {
                if (schema == null) {
                    try (InputStream is = WorkflowIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            return null;
                        }
                        schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return schema;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
