package works.quill.schema;

import java.util.Optional;

/**
 * Remembers nothing. Useful when every call should do the full work.
 */
public final class NoOpCache<K, V> implements Cache<K, V> {
	@Override
	public Optional<V> get(K key) {
		return Optional.empty();
	}

	@Override
	public void put(K key, V value) { }

	@Override
	public void clear() { }

	@Override
	public int size() {
		return 0;
	}
}
