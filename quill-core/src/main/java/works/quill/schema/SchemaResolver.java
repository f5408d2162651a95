package works.quill.schema;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.exceptions.SchemaLoadException;
import works.quill.logging.DiagnosticContext;

import static works.quill.logging.MdcKeys.SCHEMA;

/**
 * Turns schema ids into compiled {@link ConstraintTable}s, compiling each schema at most once
 * per cache lifetime.
 */
@RequiredArgsConstructor
public final class SchemaResolver {
	@Getter private final SchemaCatalog catalog;
	private final SchemaSource source;
	private final Cache<String, ConstraintTable> cache;

	public static SchemaResolver withDefaults() {
		return new SchemaResolver(SchemaCatalog.defaultCatalog(), new ClasspathSchemaSource(), new InMemoryCache<>());
	}

	public ConstraintTable resolve(String schemaId) throws SchemaLoadException {
		Optional<ConstraintTable> cached = cache.get(schemaId);
		if (cached.isPresent()) {
			LOGGER.trace("Cache hit for schema \"{}\"", schemaId);
			return cached.get();
		}
		ConstraintTable table = load(schemaId);
		cache.put(schemaId, table);
		return table;
	}

	/**
	 * Compiles on <code>executor</code>. Cancelling the returned future before compilation
	 * finishes leaves the cache untouched.
	 */
	public CompletableFuture<ConstraintTable> resolveAsync(String schemaId, Executor executor) {
		Optional<ConstraintTable> cached = cache.get(schemaId);
		if (cached.isPresent()) {
			return CompletableFuture.completedFuture(cached.get());
		}
		CompletableFuture<ConstraintTable> result = new CompletableFuture<>();
		executor.execute(() -> {
			if (result.isDone()) {
				LOGGER.debug("Compilation of \"{}\" cancelled before it started", schemaId);
				return;
			}
			try {
				ConstraintTable table = load(schemaId);
				if (result.isCancelled()) {
					LOGGER.debug("Discarding compiled \"{}\"; request was cancelled", schemaId);
				} else {
					cache.put(schemaId, table);
					result.complete(table);
				}
			} catch (SchemaLoadException | RuntimeException e) {
				result.completeExceptionally(e);
			}
		});
		return result;
	}

	public void clearCache() {
		cache.clear();
	}

	private ConstraintTable load(String schemaId) throws SchemaLoadException {
		try (var __ = DiagnosticContext.withAttribute(SCHEMA, schemaId)) {
			SchemaInfo info = catalog.get(schemaId)
				.orElseThrow(() -> new SchemaLoadException(schemaId, "Unknown schema \"" + schemaId + "\""));
			String grammar = source.fetch(info);
			ConstraintTable table = new ConstraintCompiler().compile(schemaId, grammar);
			LOGGER.info("Compiled schema \"{}\": {} elements, {} warnings",
				schemaId, table.tagNames().size(), table.warnings().size());
			return table;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaResolver.class);
}
