package work.lcod.use.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the entries a context has materialized.
 */
public record ContextSnapshot(int depth, List<EntrySnapshot> entries) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ContextSnapshot {
        entries = List.copyOf(entries);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("depth", depth);
        var items = new ArrayList<Map<String, Object>>();
        for (var entry : entries) {
            items.add(entry.toSerializableMap());
        }
        serializable.put("entries", items);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize context snapshot: " + ex.getMessage(), ex);
        }
    }

    /**
     * One key: its state, the type of its value when it holds one, and the keys its
     * value was built from.
     */
    public record EntrySnapshot(String key, String state, String valueType, List<String> dependencies) {
        public EntrySnapshot {
            dependencies = List.copyOf(dependencies);
        }

        Map<String, Object> toSerializableMap() {
            Map<String, Object> serializable = new LinkedHashMap<>();
            serializable.put("key", key);
            serializable.put("state", state.toLowerCase());
            if (valueType != null) {
                serializable.put("valueType", valueType);
            }
            if (!dependencies.isEmpty()) {
                serializable.put("dependencies", dependencies);
            }
            return serializable;
        }
    }
}
