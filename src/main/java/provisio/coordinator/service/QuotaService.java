package provisio.coordinator.service;

import provisio.coordinator.config.LevelLimitsJson;
import provisio.coordinator.config.QuotaConfig;
import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.LevelLimit;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.Resources;
import provisio.coordinator.model.Usage;
import provisio.coordinator.model.UserAccount;
import provisio.coordinator.repository.InstanceRepository;
import provisio.coordinator.repository.ReservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * User quota evaluation. The ceiling for a user on a node is the stricter of
 * the global level limit and the node's own override for that level.
 * Usage is the user's non-deleted instances plus unexpired reservations.
 */
public class QuotaService {

    private static final Logger log = LoggerFactory.getLogger(QuotaService.class);

    private final QuotaConfig quotaConfig;
    private final InstanceRepository instances;
    private final ReservationRepository reservations;

    public QuotaService(QuotaConfig quotaConfig, InstanceRepository instances, ReservationRepository reservations) {
        this.quotaConfig = quotaConfig;
        this.instances = instances;
        this.reservations = reservations;
    }

    /**
     * Effective ceiling, or empty when the user's level has no global limit.
     */
    public Optional<LevelLimit> effectiveLimit(UserAccount user, Node node) {
        Optional<LevelLimit> global = quotaConfig.limitFor(user.level());
        if (global.isEmpty()) {
            return Optional.empty();
        }
        LevelLimit override = nodeOverride(node, user.level());
        return Optional.of(global.get().min(override));
    }

    public Usage currentUsage(String userId, Instant now) {
        return instances.sumActiveForUser(userId).plus(reservations.sumActiveForUser(userId, now));
    }

    /**
     * Check whether one more instance with {@code footprint} fits the user's quota.
     *
     * @return the violation message, or empty if the request fits
     */
    public Optional<String> check(UserAccount user, Node node, InstanceKind kind, Resources footprint, Instant now) {
        Optional<LevelLimit> limit = effectiveLimit(user, node);
        if (limit.isEmpty()) {
            return Optional.of("No quota configured for level " + user.level());
        }
        LevelLimit l = limit.get();
        Usage after = currentUsage(user.id(), now).plus(Usage.single(kind, footprint));
        Resources r = after.resources();

        if (l.maxInstances() > 0 && after.instances() > l.maxInstances()) {
            return Optional.of("Instance quota exceeded: " + after.instances() + " > " + l.maxInstances());
        }
        if (l.maxCpu() > 0 && r.cpu() > l.maxCpu()) {
            return Optional.of("CPU quota exceeded: " + r.cpu() + " > " + l.maxCpu());
        }
        if (l.maxMemoryMb() > 0 && r.memoryMb() > l.maxMemoryMb()) {
            return Optional.of("Memory quota exceeded: " + r.memoryMb() + "MB > " + l.maxMemoryMb() + "MB");
        }
        if (l.maxDiskMb() > 0 && r.diskMb() > l.maxDiskMb()) {
            return Optional.of("Disk quota exceeded: " + r.diskMb() + "MB > " + l.maxDiskMb() + "MB");
        }
        if (l.maxBandwidthMbps() > 0 && r.bandwidthMbps() > l.maxBandwidthMbps()) {
            return Optional.of("Bandwidth quota exceeded: " + r.bandwidthMbps() + "Mbps > "
                    + l.maxBandwidthMbps() + "Mbps");
        }
        return Optional.empty();
    }

    private LevelLimit nodeOverride(Node node, int level) {
        if (node.levelLimits() == null || node.levelLimits().isBlank()) {
            return null;
        }
        try {
            return LevelLimitsJson.parse(node.levelLimits()).get(level);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed level limits on node {}: {}", node.id(), e.getMessage());
            return null;
        }
    }
}
