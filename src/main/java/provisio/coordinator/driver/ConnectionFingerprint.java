package provisio.coordinator.driver;

import provisio.coordinator.model.Node;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over the node fields that decide how a connection is made.
 * A cached handle is valid only while the fingerprint is unchanged.
 */
public final class ConnectionFingerprint {

    private ConnectionFingerprint() {
    }

    public static String of(Node node) {
        String material = String.join("\n",
                node.kind().name(),
                nullToEmpty(node.host()),
                String.valueOf(node.sshPort()),
                String.valueOf(node.apiPort()),
                nullToEmpty(node.username()),
                nullToEmpty(node.credential()));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
