package io.infrautomater.serialization.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.infrautomater.core.engine.ToolOutputParseException;
import io.infrautomater.core.engine.ToolOutputParser;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Jackson-based implementation of {@link ToolOutputParser}.
///
/// Reads the document printed by `output -json`:
///
/// ```json
/// {
///   "endpoint": {"sensitive": false, "type": "string", "value": "db.example:5432"},
///   "password": {"sensitive": true,  "type": "string", "value": "..."}
/// }
/// ```
///
/// and renders one `name = value` line per output, sorted by name. String
/// values are printed bare, other values as compact JSON. Values flagged
/// `sensitive` are replaced by `(sensitive)` and never leave this class.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
/// @see io.infrautomater.core.engine.ExecutionEngine for the caller
public class JacksonToolOutputParser implements ToolOutputParser {

    static final String SENSITIVE = "(sensitive)";
    static final String NO_OUTPUTS = "(no outputs)";

    private final ObjectMapper objectMapper;

    public JacksonToolOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String summarize(String rawOutput) throws ToolOutputParseException {
        if (rawOutput == null || rawOutput.isBlank()) {
            return NO_OUTPUTS;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawOutput);
        } catch (JsonProcessingException e) {
            throw new ToolOutputParseException("Invalid tool output JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ToolOutputParseException("Tool output must be a JSON object");
        }

        Map<String, String> lines = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            lines.put(field.getKey(), render(field.getValue()));
        }
        if (lines.isEmpty()) {
            return NO_OUTPUTS;
        }

        StringBuilder summary = new StringBuilder();
        for (Map.Entry<String, String> line : lines.entrySet()) {
            if (summary.length() > 0) {
                summary.append('\n');
            }
            summary.append(line.getKey()).append(" = ").append(line.getValue());
        }
        return summary.toString();
    }

    private String render(JsonNode output) throws ToolOutputParseException {
        if (output.path("sensitive").asBoolean(false)) {
            return SENSITIVE;
        }
        // bare values are accepted for outputs printed without the wrapper object
        JsonNode value = output.isObject() && output.has("value") ? output.get("value") : output;
        if (value.isTextual()) {
            return value.asText();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ToolOutputParseException("Could not render output value: " + e.getOriginalMessage(), e);
        }
    }
}
