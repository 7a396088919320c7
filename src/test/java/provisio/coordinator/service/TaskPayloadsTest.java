package provisio.coordinator.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskPayloadsTest {

    @Test
    void blankPayloadBecomesEmptyObject() {
        assertEquals("{}", TaskPayloads.normalize(null));
        assertEquals("{}", TaskPayloads.normalize(" "));
    }

    @Test
    void sessionIdIsAddedWithoutLosingFields() {
        String payload = TaskPayloads.withSessionId("{\"image\":\"ubuntu:22.04\"}", "s-1");

        assertTrue(payload.contains("\"image\":\"ubuntu:22.04\""));
        assertTrue(payload.contains("\"sessionId\":\"s-1\""));
    }

    @Test
    void instanceNameIsOptional() {
        assertEquals("web", TaskPayloads.instanceName("{\"instanceName\":\"web\"}"));
        assertNull(TaskPayloads.instanceName("{\"instanceName\":\"\"}"));
        assertNull(TaskPayloads.instanceName("{\"instanceName\":42}"));
        assertNull(TaskPayloads.instanceName("{}"));
    }

    @Test
    void nonObjectPayloadIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TaskPayloads.normalize("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> TaskPayloads.normalize("{broken"));
    }
}
