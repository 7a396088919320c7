package provisio.coordinator.config;

import provisio.coordinator.model.LevelLimit;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Global per-level resource ceilings. Levels run from 1 to 5.
 * A level without an entry has no quota and admission for it is refused.
 */
public final class QuotaConfig {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 5;

    private final Map<Integer, LevelLimit> limits = new TreeMap<>();

    private QuotaConfig() {
    }

    /** Built-in ceilings used when no quota file is configured. */
    public static QuotaConfig defaults() {
        return new QuotaConfig()
                .withLevel(1, new LevelLimit(1, 1, 350, 1024, 100))
                .withLevel(2, new LevelLimit(3, 2, 1024, 20480, 200))
                .withLevel(3, new LevelLimit(5, 4, 2048, 40960, 500))
                .withLevel(4, new LevelLimit(10, 8, 4096, 81920, 1000))
                .withLevel(5, new LevelLimit(20, 16, 8192, 163840, 2000));
    }

    public static QuotaConfig empty() {
        return new QuotaConfig();
    }

    public QuotaConfig withLevel(int level, LevelLimit limit) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Level out of range 1..5: " + level);
        }
        limits.put(level, limit);
        return this;
    }

    public Optional<LevelLimit> limitFor(int level) {
        return Optional.ofNullable(limits.get(level));
    }

    public Map<Integer, LevelLimit> levels() {
        return Collections.unmodifiableMap(limits);
    }

    @Override
    public String toString() {
        return "QuotaConfig" + limits;
    }
}
