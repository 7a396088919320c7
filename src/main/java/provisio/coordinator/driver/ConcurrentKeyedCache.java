package provisio.coordinator.driver;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link KeyedCache} over a ConcurrentHashMap.
 */
public class ConcurrentKeyedCache<K, V> implements KeyedCache<K, V> {

    private final ConcurrentHashMap<K, V> map = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(map.get(key));
    }

    @Override
    public void put(K key, V value) {
        map.put(key, value);
    }

    @Override
    public Optional<V> remove(K key) {
        return Optional.ofNullable(map.remove(key));
    }

    @Override
    public Set<K> keys() {
        return Set.copyOf(map.keySet());
    }

    @Override
    public int size() {
        return map.size();
    }
}
