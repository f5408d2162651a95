package works.quill.schema;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unbounded; entries stay until {@link #clear}.
 */
public final class InMemoryCache<K, V> implements Cache<K, V> {
	private final Map<K, V> entries = new ConcurrentHashMap<>();

	@Override
	public Optional<V> get(K key) {
		return Optional.ofNullable(entries.get(key));
	}

	@Override
	public void put(K key, V value) {
		entries.put(key, value);
	}

	@Override
	public void clear() {
		entries.clear();
	}

	@Override
	public int size() {
		return entries.size();
	}
}
