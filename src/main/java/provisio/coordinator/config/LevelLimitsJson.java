package provisio.coordinator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import provisio.coordinator.model.LevelLimit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-node level overrides, stored on the node row as JSON:
 *
 * <pre>
 * {"1": {"max-instances": 1, "max-resources": {"cpu": 1, "memory": 350, "disk": 1024, "bandwidth": 100}}}
 * </pre>
 */
public final class LevelLimitsJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(
            @JsonProperty("max-instances") int maxInstances,
            @JsonProperty("max-resources") MaxResources maxResources) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MaxResources(
            @JsonProperty("cpu") int cpu,
            @JsonProperty("memory") long memory,
            @JsonProperty("disk") long disk,
            @JsonProperty("bandwidth") int bandwidth) {
    }

    private LevelLimitsJson() {
    }

    /**
     * Parse an override document. Blank input means no overrides.
     *
     * @throws IllegalArgumentException if the document is not valid JSON of the expected shape
     */
    public static Map<Integer, LevelLimit> parse(String json) {
        Map<Integer, LevelLimit> result = new TreeMap<>();
        if (json == null || json.isBlank()) {
            return result;
        }
        try {
            Map<String, Entry> raw = MAPPER.readValue(json, new TypeReference<Map<String, Entry>>() {
            });
            raw.forEach((level, entry) -> {
                if (entry == null) {
                    return;
                }
                MaxResources r = entry.maxResources();
                result.put(Integer.parseInt(level.trim()), r == null
                        ? new LevelLimit(entry.maxInstances(), 0, 0, 0, 0)
                        : new LevelLimit(entry.maxInstances(), r.cpu(), r.memory(), r.disk(), r.bandwidth()));
            });
            return result;
        } catch (JsonProcessingException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid level limits JSON: " + e.getMessage(), e);
        }
    }

    public static String write(Map<Integer, LevelLimit> limits) {
        Map<String, Entry> raw = new LinkedHashMap<>();
        new TreeMap<>(limits).forEach((level, l) -> raw.put(String.valueOf(level), new Entry(
                l.maxInstances(),
                new MaxResources(l.maxCpu(), l.maxMemoryMb(), l.maxDiskMb(), l.maxBandwidthMbps()))));
        try {
            return MAPPER.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize level limits", e);
        }
    }
}
