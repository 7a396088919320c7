package provisio.coordinator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Helpers for the opaque task payload. The coordinator reads only
 * {@code instanceName} and writes only {@code sessionId}; everything else
 * is passed through to the driver untouched.
 */
public final class TaskPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TaskPayloads() {
    }

    /**
     * Blank payload becomes {@code {}}; anything else must be a JSON object.
     *
     * @throws IllegalArgumentException on malformed payloads
     */
    public static String normalize(String payload) {
        return readObject(payload).toString();
    }

    public static String withSessionId(String payload, String sessionId) {
        ObjectNode root = readObject(payload);
        root.put("sessionId", sessionId);
        return root.toString();
    }

    /** Instance name requested by a CREATE payload, or null. */
    public static String instanceName(String payload) {
        JsonNode name = readObject(payload).get("instanceName");
        return name != null && name.isTextual() && !name.asText().isBlank() ? name.asText() : null;
    }

    private static ObjectNode readObject(String payload) {
        if (payload == null || payload.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            JsonNode node = MAPPER.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Task payload must be a JSON object");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed task payload: " + e.getOriginalMessage(), e);
        }
    }
}
