package provisio.coordinator.model;

/**
 * Account the coordinator admits work for. Only the tier matters here.
 */
public record UserAccount(String id, String username, int level) {
}
