package provisio.coordinator.repository;

import provisio.coordinator.model.UserAccount;

import java.util.Optional;

/**
 * Read access to user accounts. Accounts are written by collaborators;
 * {@link #save} exists for bootstrap and tests.
 */
public interface UserRepository {

    void save(UserAccount user);

    Optional<UserAccount> findById(String userId);

    /**
     * Lock the user row until the surrounding transaction ends.
     * Must be called inside a transaction.
     */
    Optional<UserAccount> lockById(String userId);
}
