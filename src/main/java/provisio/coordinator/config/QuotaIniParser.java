package provisio.coordinator.config;

import provisio.coordinator.model.LevelLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads level quotas from lines of the form {@code level.<n>.<key> = value}
 * where key is one of max-instances, cpu, memory, disk, bandwidth.
 * Keys left out of a level stay unlimited (0).
 */
public final class QuotaIniParser {

    private static final Logger log = LoggerFactory.getLogger(QuotaIniParser.class);

    private QuotaIniParser() {
    }

    public static QuotaConfig parse(Path iniPath) throws IOException {
        return parse(Files.readAllLines(iniPath));
    }

    public static QuotaConfig parse(List<String> lines) {
        Map<Integer, long[]> values = new TreeMap<>();

        for (var raw : lines) {
            var line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";") || !line.contains("=")) continue;
            var kv = line.split("=", 2);
            var key = kv[0].trim().toLowerCase();
            var value = kv[1].trim();

            var parts = key.split("\\.", 3);
            if (parts.length != 3 || !parts[0].equals("level")) {
                log.warn("Ignoring quota line: {}", line);
                continue;
            }

            int level;
            try {
                level = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                log.warn("Ignoring quota line with bad level: {}", line);
                continue;
            }
            if (level < QuotaConfig.MIN_LEVEL || level > QuotaConfig.MAX_LEVEL) {
                log.warn("Ignoring quota for level {} (allowed 1..5)", level);
                continue;
            }

            long[] slot = values.computeIfAbsent(level, l -> new long[5]);
            long amount = toLong(value);
            switch (parts[2]) {
                case "max-instances", "max_instances" -> slot[0] = amount;
                case "cpu" -> slot[1] = amount;
                case "memory" -> slot[2] = amount;
                case "disk" -> slot[3] = amount;
                case "bandwidth" -> slot[4] = amount;
                default -> log.warn("Unknown quota key '{}' for level {}", parts[2], level);
            }
        }

        QuotaConfig config = QuotaConfig.empty();
        values.forEach((level, v) -> config.withLevel(level,
                new LevelLimit((int) v[0], (int) v[1], v[2], v[3], (int) v[4])));
        return config;
    }

    private static long toLong(String s) {
        try {
            return Math.max(0, Long.parseLong(s));
        } catch (NumberFormatException e) {
            log.warn("Invalid quota value '{}', treating as unlimited", s);
            return 0;
        }
    }
}
