package works.quill.schema;

import java.util.Optional;

/**
 * A keyed store for values that are expensive to recompute, such as compiled schemas
 * and validation reports. Implementations must be safe for concurrent use.
 */
public interface Cache<K, V> {
	Optional<V> get(K key);
	void put(K key, V value);
	void clear();
	int size();
}
