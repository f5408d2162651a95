package works.quill.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.document.Document;
import works.quill.exceptions.SchemaConfigurationException;
import works.quill.exceptions.SchemaLoadException;
import works.quill.logging.DiagnosticContext;
import works.quill.schema.Cache;
import works.quill.schema.ConstraintTable;
import works.quill.schema.SchemaResolver;

import static works.quill.logging.MdcKeys.REVISION;
import static works.quill.logging.MdcKeys.SCHEMA;

/**
 * Finds the strictest schema a document conforms to.
 * <p>
 * Schemas are tried in the given order, strictest first, and the first with no critical
 * issues is reported as passed. If none passes, the report carries the issues from the first
 * schema that could be loaded, which are the most informative.
 * Schemas that fail to load are logged and skipped.
 */
@RequiredArgsConstructor
public final class ProgressiveValidator {
	private final SchemaResolver resolver;
	private final DocumentValidator validator;
	private final Cache<ValidationCacheKey, List<ValidationIssue>> cache;

	/**
	 * @throws SchemaConfigurationException if not one of the schemas could be loaded
	 */
	public ValidationReport validate(Document document, List<String> schemaOrder) {
		List<String> skipped = new ArrayList<>();
		List<SchemaLoadException> failures = new ArrayList<>();
		List<ValidationIssue> strictestIssues = null;
		String fingerprint = document.fingerprint();
		try (var __ = DiagnosticContext.withAttribute(REVISION, Long.toString(document.revision()))) {
			for (String schemaId: schemaOrder) {
				ConstraintTable table;
				try {
					table = resolver.resolve(schemaId);
				} catch (SchemaLoadException e) {
					LOGGER.warn("Skipping schema \"{}\": {}", schemaId, e.getMessage(), e);
					skipped.add(schemaId);
					failures.add(e);
					continue;
				}
				List<ValidationIssue> issues = issuesFor(document, fingerprint, schemaId, table);
				if (strictestIssues == null) {
					strictestIssues = issues;
				}
				if (issues.stream().noneMatch(ValidationIssue::isCritical)) {
					LOGGER.debug("Revision {} passes \"{}\"", document.revision(), schemaId);
					return new ValidationReport(Optional.of(schemaId), List.of(), issues, skipped);
				}
			}
		}
		if (strictestIssues == null) {
			throw new SchemaConfigurationException("None of the schemas " + schemaOrder + " could be loaded", failures);
		}
		return new ValidationReport(
			Optional.empty(),
			strictestIssues.stream().filter(ValidationIssue::isCritical).collect(Collectors.toList()),
			strictestIssues.stream().filter(i -> !i.isCritical()).collect(Collectors.toList()),
			skipped);
	}

	public void clearCache() {
		cache.clear();
	}

	private List<ValidationIssue> issuesFor(Document document, String fingerprint, String schemaId, ConstraintTable table) {
		ValidationCacheKey key = new ValidationCacheKey(schemaId, document.revision(), fingerprint);
		Optional<List<ValidationIssue>> cached = cache.get(key);
		if (cached.isPresent()) {
			LOGGER.trace("Cache hit for {}", key);
			return cached.get();
		}
		try (var __ = DiagnosticContext.withAttribute(SCHEMA, schemaId)) {
			List<ValidationIssue> issues = List.copyOf(validator.validate(document, table));
			cache.put(key, issues);
			return issues;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ProgressiveValidator.class);
}
