package provisio.coordinator.driver;

import java.util.Optional;
import java.util.Set;

/**
 * Storage behind a process-local cache. Never a source of truth: any entry
 * may be dropped and rebuilt.
 */
public interface KeyedCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    Optional<V> remove(K key);

    Set<K> keys();

    int size();
}
