package works.quill.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds at most <code>capacity</code> entries, evicting the least recently used.
 */
public final class LruCache<K, V> implements Cache<K, V> {
	private final Map<K, V> entries;

	public LruCache(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Capacity must be positive: " + capacity);
		}
		this.entries = new LinkedHashMap<>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
				return size() > capacity;
			}
		};
	}

	@Override
	public synchronized Optional<V> get(K key) {
		return Optional.ofNullable(entries.get(key));
	}

	@Override
	public synchronized void put(K key, V value) {
		entries.put(key, value);
	}

	@Override
	public synchronized void clear() {
		entries.clear();
	}

	@Override
	public synchronized int size() {
		return entries.size();
	}
}
