package provisio.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LevelLimitTest {

    @Test
    void stricterValueWinsPerDimension() {
        LevelLimit global = new LevelLimit(5, 4, 2048, 40960, 500);
        LevelLimit node = new LevelLimit(2, 8, 0, 10240, 0);

        assertEquals(new LevelLimit(2, 4, 2048, 10240, 500), global.min(node));
        assertEquals(global.min(node), node.min(global));
    }

    @Test
    void unlimitedNeverWins() {
        LevelLimit limit = new LevelLimit(1, 1, 350, 1024, 100);

        assertEquals(limit, LevelLimit.UNLIMITED.min(limit));
        assertEquals(limit, limit.min(null));
    }
}
