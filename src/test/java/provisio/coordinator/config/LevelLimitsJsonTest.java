package provisio.coordinator.config;

import provisio.coordinator.model.LevelLimit;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LevelLimitsJsonTest {

    @Test
    void parsesOverrideDocument() {
        String json = """
                {
                  "1": {"max-instances": 2, "max-resources": {"cpu": 2, "memory": 1024, "disk": 4096, "bandwidth": 50}},
                  "3": {"max-instances": 4}
                }
                """;

        Map<Integer, LevelLimit> limits = LevelLimitsJson.parse(json);

        assertEquals(new LevelLimit(2, 2, 1024, 4096, 50), limits.get(1));
        assertEquals(new LevelLimit(4, 0, 0, 0, 0), limits.get(3));
    }

    @Test
    void blankMeansNoOverrides() {
        assertTrue(LevelLimitsJson.parse(null).isEmpty());
        assertTrue(LevelLimitsJson.parse("  ").isEmpty());
    }

    @Test
    void unknownFieldsAreIgnored() {
        Map<Integer, LevelLimit> limits = LevelLimitsJson.parse("{\"2\": {\"max-instances\": 1, \"note\": \"x\"}}");

        assertEquals(1, limits.get(2).maxInstances());
    }

    @Test
    void malformedDocumentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> LevelLimitsJson.parse("{not json"));
        assertThrows(IllegalArgumentException.class, () -> LevelLimitsJson.parse("{\"two\": {\"max-instances\": 1}}"));
    }

    @Test
    void writtenDocumentParsesBack() {
        Map<Integer, LevelLimit> limits = Map.of(2, new LevelLimit(3, 2, 1024, 20480, 200));

        String json = LevelLimitsJson.write(limits);

        assertTrue(json.contains("\"max-resources\""));
        assertEquals(limits, LevelLimitsJson.parse(json));
    }
}
