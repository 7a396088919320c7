package provisio.coordinator.health;

import provisio.coordinator.model.Node;
import provisio.coordinator.model.Reachability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Probe that opens a TCP connection to the SSH port and, when configured,
 * the API port. A port that accepts the connection counts as reachable.
 */
public class TcpReachabilityProbe implements NodeProbe {

    private static final Logger log = LoggerFactory.getLogger(TcpReachabilityProbe.class);

    private final int connectTimeoutMs;

    public TcpReachabilityProbe(Duration connectTimeout) {
        this.connectTimeoutMs = (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis());
    }

    @Override
    public ProbeResult probe(Node node) {
        Reachability ssh = reach(node.host(), node.sshPort());
        if (!node.hasApi()) {
            return ProbeResult.sshOnly(ssh);
        }
        return new ProbeResult(ssh, reach(node.host(), node.apiPort()));
    }

    private Reachability reach(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            return Reachability.ONLINE;
        } catch (IOException e) {
            log.debug("{}:{} unreachable: {}", host, port, e.getMessage());
            return Reachability.OFFLINE;
        }
    }
}
