package works.quill;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import org.pcollections.HashTreePMap;
import org.pcollections.OrderedPSet;
import org.pcollections.PMap;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;
import static lombok.AccessLevel.PRIVATE;

/**
 * An immutable, insertion-ordered collection of {@link Identified} values.
 *
 * <p>
 * Behaves like a {@link LinkedHashMap}, except immutable, and we automatically
 * know the key for each entry: its {@link Identified#id}.
 * Replacing an entry with {@link #with} keeps its original position.
 */
@RequiredArgsConstructor(access = PRIVATE)
@EqualsAndHashCode
public final class Catalog<E extends Identified> implements Iterable<E> {
	private final PMap<Identifier, E> contents;
	private final OrderedPSet<Identifier> ids; // Preserves insertion order

	public int size() { return contents.size(); }

	public boolean isEmpty() { return contents.isEmpty(); }

	/**
	 * @return the entry with the given id, or null if there is none.
	 */
	public E get(Identifier key) {
		return contents.get(requireNonNull(key));
	}

	public Optional<E> find(Identifier key) {
		return Optional.ofNullable(get(key));
	}

	public Optional<E> findFirst(Predicate<? super E> predicate) {
		return stream().filter(predicate).findFirst();
	}

	public List<Identifier> ids() {
		return unmodifiableList(new ArrayList<>(ids));
	}

	public List<E> asList() {
		return unmodifiableList(stream().collect(toList()));
	}

	@Override
	public Iterator<E> iterator() {
		return stream().iterator();
	}

	public Stream<Identifier> idStream() {
		return ids.stream();
	}

	public Stream<E> stream() {
		return ids.stream().map(contents::get);
	}

	public boolean containsID(Identifier key) {
		return ids.contains(key);
	}

	public boolean contains(E entry) {
		return containsID(entry.id());
	}

	public static <TT extends Identified> Catalog<TT> empty() {
		return new Catalog<>(HashTreePMap.empty(), OrderedPSet.empty());
	}

	@SafeVarargs
	@SuppressWarnings("varargs")
	public static <TT extends Identified> Catalog<TT> of(TT... entries) {
		return Catalog.of(Arrays.asList(entries));
	}

	public static <TT extends Identified> Catalog<TT> of(Collection<TT> entries) {
		Map<Identifier, TT> newValues = new LinkedHashMap<>(entries.size());
		for (TT entry: entries) {
			TT old = newValues.put(requireNonNull(entry.id()), entry);
			if (old != null) {
				throw new IllegalArgumentException("Multiple entries with id " + old.id());
			}
		}
		return new Catalog<>(
			HashTreePMap.from(newValues),
			OrderedPSet.from(newValues.keySet()));
	}

	public Catalog<E> with(E entry) {
		return new Catalog<>(contents.plus(entry.id(), entry), ids.plus(entry.id()));
	}

	public Catalog<E> without(Identifier id) {
		return new Catalog<>(contents.minus(id), ids.minus(id));
	}

	@Override
	public String toString() {
		return asList().toString();
	}

}
