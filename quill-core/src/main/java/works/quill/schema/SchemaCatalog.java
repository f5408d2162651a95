package works.quill.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The schemas available to an engine, strictest first.
 */
public final class SchemaCatalog {
	private final Map<String, SchemaInfo> schemas;

	public SchemaCatalog(List<SchemaInfo> schemas) {
		Map<String, SchemaInfo> map = new LinkedHashMap<>();
		for (SchemaInfo info: schemas) {
			if (map.put(info.id(), info) != null) {
				throw new IllegalArgumentException("Duplicate schema id \"" + info.id() + "\"");
			}
		}
		this.schemas = map;
	}

	public static SchemaCatalog defaultCatalog() {
		return new SchemaCatalog(List.of(
			new SchemaInfo("tei-all", "TEI All",
				"Full TEI vocabulary for dialogue and named-entity annotation; every pointer must resolve",
				"/schemas/tei-all.rng", List.of("strict")),
			new SchemaInfo("tei-novel", "TEI Novel",
				"The subset of TEI used for annotating prose fiction",
				"/schemas/tei-novel.rng", List.of("domain")),
			new SchemaInfo("tei-minimal", "TEI Minimal",
				"Structural elements only, with permissive content",
				"/schemas/tei-minimal.rng", List.of("permissive"))));
	}

	public boolean has(String id) {
		return schemas.containsKey(id);
	}

	public Optional<SchemaInfo> get(String id) {
		return Optional.ofNullable(schemas.get(id));
	}

	/**
	 * Strictest first.
	 */
	public List<String> ids() {
		return new ArrayList<>(schemas.keySet());
	}

	public List<SchemaInfo> list() {
		return new ArrayList<>(schemas.values());
	}
}
