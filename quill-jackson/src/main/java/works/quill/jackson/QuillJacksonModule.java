package works.quill.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import works.quill.Catalog;
import works.quill.Identifier;
import works.quill.entities.Character;
import works.quill.entities.CreateEntity;
import works.quill.entities.DeleteEntity;
import works.quill.entities.Entity;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityDelta;
import works.quill.entities.EntityType;
import works.quill.entities.Organization;
import works.quill.entities.Place;
import works.quill.entities.Relate;
import works.quill.entities.Relationship;
import works.quill.entities.Unrelate;
import works.quill.entities.UpdateEntity;
import works.quill.history.DeltaLog;

/**
 * Reads and writes entity collections and delta logs as JSON.
 * <p>
 * Everything is written as flat lists of tagged objects:
 * each entity carries an <code>"entityType"</code> field
 * and each delta carries an <code>"op"</code> field.
 * Empty optional fields are omitted.
 *
 * <pre>
 * ObjectMapper mapper = new ObjectMapper().registerModule(new QuillJacksonModule());
 * String json = mapper.writeValueAsString(session.getLog());
 * DeltaLog log = mapper.readValue(json, DeltaLog.class);
 * </pre>
 */
public final class QuillJacksonModule extends Module {
	@Override
	public String getModuleName() {
		return "quill";
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new QuillSerializers());
		context.addDeserializers(new QuillDeserializers());
	}

	private static final class QuillSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Identifier.class.isAssignableFrom(theClass)) {
				return identifierSerializer();
			} else if (Entity.class.isAssignableFrom(theClass)) {
				return entitySerializer();
			} else if (Relationship.class.isAssignableFrom(theClass)) {
				return relationshipSerializer();
			} else if (EntityCollection.class.isAssignableFrom(theClass)) {
				return entityCollectionSerializer();
			} else if (EntityDelta.class.isAssignableFrom(theClass)) {
				return deltaSerializer();
			} else if (DeltaLog.class.isAssignableFrom(theClass)) {
				return deltaLogSerializer();
			} else {
				return null;
			}
		}

		private JsonSerializer<Identifier> identifierSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(Identifier value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeString(value.toString());
				}
			};
		}

		private JsonSerializer<Entity> entitySerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(Entity value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					writeEntity(value, gen);
				}
			};
		}

		private JsonSerializer<Relationship> relationshipSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(Relationship value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					writeRelationship(value, gen);
				}
			};
		}

		private JsonSerializer<EntityCollection> entityCollectionSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(EntityCollection value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					writeEntityCollection(value, gen);
				}
			};
		}

		private JsonSerializer<EntityDelta> deltaSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(EntityDelta value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					writeDelta(value, gen);
				}
			};
		}

		private JsonSerializer<DeltaLog> deltaLogSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(DeltaLog value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					gen.writeFieldName(BASE);
					writeEntityCollection(value.base(), gen);
					gen.writeArrayFieldStart(DELTAS);
					for (EntityDelta delta: value.deltas()) {
						writeDelta(delta, gen);
					}
					gen.writeEndArray();
					gen.writeNumberField(POSITION, value.position());
					gen.writeEndObject();
				}
			};
		}
	}

	private static final class QuillDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Identifier.class.isAssignableFrom(theClass)) {
				return identifierDeserializer();
			} else if (Entity.class.isAssignableFrom(theClass)) {
				return entityDeserializer(theClass);
			} else if (Relationship.class.isAssignableFrom(theClass)) {
				return relationshipDeserializer();
			} else if (EntityCollection.class.isAssignableFrom(theClass)) {
				return entityCollectionDeserializer();
			} else if (EntityDelta.class.isAssignableFrom(theClass)) {
				return deltaDeserializer(theClass);
			} else if (DeltaLog.class.isAssignableFrom(theClass)) {
				return deltaLogDeserializer();
			} else {
				return null;
			}
		}

		private JsonDeserializer<Identifier> identifierDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public Identifier deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					return identifier(ctxt.readTree(p), p);
				}
			};
		}

		private JsonDeserializer<Entity> entityDeserializer(Class<?> expectedClass) {
			return new JsonDeserializer<>() {
				@Override
				public Entity deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					Entity result = readEntity(ctxt.readTree(p), p);
					if (!expectedClass.isInstance(result)) {
						throw new JsonParseException(p, "Expected " + expectedClass.getSimpleName() + "; found " + result.entityType().externalName());
					}
					return result;
				}
			};
		}

		private JsonDeserializer<Relationship> relationshipDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public Relationship deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					return readRelationship(ctxt.readTree(p), p);
				}
			};
		}

		private JsonDeserializer<EntityCollection> entityCollectionDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public EntityCollection deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					return readEntityCollection(ctxt.readTree(p), p);
				}
			};
		}

		private JsonDeserializer<EntityDelta> deltaDeserializer(Class<?> expectedClass) {
			return new JsonDeserializer<>() {
				@Override
				public EntityDelta deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					EntityDelta result = readDelta(ctxt.readTree(p), p);
					if (!expectedClass.isInstance(result)) {
						throw new JsonParseException(p, "Expected " + expectedClass.getSimpleName() + "; found \"" + result.op() + "\"");
					}
					return result;
				}
			};
		}

		private JsonDeserializer<DeltaLog> deltaLogDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public DeltaLog deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					JsonNode node = ctxt.readTree(p);
					EntityCollection base = readEntityCollection(required(node, BASE, p), p);
					List<EntityDelta> deltas = new ArrayList<>();
					for (JsonNode element: node.path(DELTAS)) {
						deltas.add(readDelta(element, p));
					}
					int position = node.has(POSITION) ? node.get(POSITION).asInt() : deltas.size();
					try {
						return DeltaLog.of(base, deltas, position);
					} catch (IllegalArgumentException e) {
						throw new JsonParseException(p, "Invalid delta log: " + e.getMessage(), e);
					}
				}
			};
		}
	}

	//
	// Writing
	//

	static void writeEntity(Entity entity, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		gen.writeStringField(ENTITY_TYPE, entity.entityType().externalName());
		gen.writeStringField("id", entity.id().toString());
		gen.writeStringField("xmlId", entity.xmlId());
		gen.writeStringField("name", entity.name());
		if (entity instanceof Character c) {
			writeOptional(gen, "sex", c.sex());
			if (c.age().isPresent()) {
				gen.writeNumberField("age", c.age().get());
			}
			writeOptional(gen, "occupation", c.occupation());
			if (!c.traits().isEmpty()) {
				gen.writeArrayFieldStart("traits");
				for (String trait: c.traits()) {
					gen.writeString(trait);
				}
				gen.writeEndArray();
			}
			writeOptional(gen, "socialStatus", c.socialStatus());
			writeOptional(gen, "maritalStatus", c.maritalStatus());
		} else if (entity instanceof Place place) {
			writeOptional(gen, "country", place.country());
			writeOptional(gen, "coordinates", place.coordinates());
		} else if (entity instanceof Organization org) {
			writeOptional(gen, "orgType", org.orgType());
		}
		gen.writeBooleanField("archived", entity.archived());
		gen.writeEndObject();
	}

	static void writeRelationship(Relationship relationship, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		gen.writeStringField(ENTITY_TYPE, EntityType.RELATIONSHIP.externalName());
		gen.writeStringField("id", relationship.id().toString());
		gen.writeStringField("from", relationship.from().toString());
		gen.writeStringField("to", relationship.to().toString());
		gen.writeStringField("type", relationship.type());
		writeOptional(gen, "subtype", relationship.subtype());
		gen.writeBooleanField("mutual", relationship.mutual());
		gen.writeEndObject();
	}

	static void writeEntityCollection(EntityCollection entities, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		gen.writeArrayFieldStart(ENTITIES);
		for (Entity entity: entities.entities().toList()) {
			writeEntity(entity, gen);
		}
		gen.writeEndArray();
		gen.writeArrayFieldStart(RELATIONSHIPS);
		for (Relationship relationship: entities.relationships()) {
			writeRelationship(relationship, gen);
		}
		gen.writeEndArray();
		gen.writeEndObject();
	}

	static void writeDelta(EntityDelta delta, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		gen.writeStringField(OP, delta.op());
		gen.writeStringField("timestamp", delta.timestamp().toString());
		if (delta instanceof CreateEntity d) {
			gen.writeFieldName(ENTITY);
			writeEntity(d.entity(), gen);
		} else if (delta instanceof UpdateEntity d) {
			gen.writeFieldName(ENTITY);
			writeEntity(d.entity(), gen);
		} else if (delta instanceof DeleteEntity d) {
			gen.writeFieldName(ENTITY);
			writeEntity(d.entity(), gen);
		} else if (delta instanceof Relate d) {
			gen.writeFieldName(RELATIONSHIP);
			writeRelationship(d.relationship(), gen);
		} else if (delta instanceof Unrelate d) {
			gen.writeFieldName(RELATIONSHIP);
			writeRelationship(d.relationship(), gen);
		}
		gen.writeEndObject();
	}

	private static void writeOptional(JsonGenerator gen, String fieldName, Optional<String> value) throws IOException {
		if (value.isPresent()) {
			gen.writeStringField(fieldName, value.get());
		}
	}

	//
	// Reading
	//

	static Entity readEntity(JsonNode node, JsonParser p) throws IOException {
		EntityType type = entityType(required(node, ENTITY_TYPE, p).asText(), p);
		Identifier id = identifier(required(node, "id", p), p);
		String xmlId = required(node, "xmlId", p).asText();
		String name = required(node, "name", p).asText();
		boolean archived = node.path("archived").asBoolean(false);
		switch (type) {
			case CHARACTER:
				List<String> traits = new ArrayList<>();
				for (JsonNode trait: node.path("traits")) {
					traits.add(trait.asText());
				}
				Optional<Integer> age = node.hasNonNull("age") ? Optional.of(node.get("age").asInt()) : Optional.empty();
				return new Character(id, xmlId, name,
					optionalText(node, "sex"), age, optionalText(node, "occupation"), traits,
					optionalText(node, "socialStatus"), optionalText(node, "maritalStatus"), archived);
			case PLACE:
				return new Place(id, xmlId, name, optionalText(node, "country"), optionalText(node, "coordinates"), archived);
			case ORGANIZATION:
				return new Organization(id, xmlId, name, optionalText(node, "orgType"), archived);
			default:
				throw new JsonParseException(p, "Expected an entity; found " + type.externalName());
		}
	}

	static Relationship readRelationship(JsonNode node, JsonParser p) throws IOException {
		if (node.has(ENTITY_TYPE) && entityType(node.get(ENTITY_TYPE).asText(), p) != EntityType.RELATIONSHIP) {
			throw new JsonParseException(p, "Expected a relationship; found " + node.get(ENTITY_TYPE).asText());
		}
		return new Relationship(
			identifier(required(node, "id", p), p),
			identifier(required(node, "from", p), p),
			identifier(required(node, "to", p), p),
			required(node, "type", p).asText(),
			optionalText(node, "subtype"),
			node.path("mutual").asBoolean(false));
	}

	static EntityCollection readEntityCollection(JsonNode node, JsonParser p) throws IOException {
		List<Character> characters = new ArrayList<>();
		List<Place> places = new ArrayList<>();
		List<Organization> organizations = new ArrayList<>();
		for (JsonNode element: node.path(ENTITIES)) {
			Entity entity = readEntity(element, p);
			if (entity instanceof Character c) {
				characters.add(c);
			} else if (entity instanceof Place place) {
				places.add(place);
			} else if (entity instanceof Organization org) {
				organizations.add(org);
			}
		}
		List<Relationship> relationships = new ArrayList<>();
		for (JsonNode element: node.path(RELATIONSHIPS)) {
			relationships.add(readRelationship(element, p));
		}
		try {
			return new EntityCollection(
				Catalog.of(characters),
				Catalog.of(places),
				Catalog.of(organizations),
				Catalog.of(relationships));
		} catch (IllegalArgumentException e) {
			throw new JsonParseException(p, "Invalid entity collection: " + e.getMessage(), e);
		}
	}

	static EntityDelta readDelta(JsonNode node, JsonParser p) throws IOException {
		String op = required(node, OP, p).asText();
		Instant timestamp;
		try {
			timestamp = Instant.parse(required(node, "timestamp", p).asText());
		} catch (DateTimeParseException e) {
			throw new JsonParseException(p, "Invalid timestamp: " + e.getParsedString(), e);
		}
		switch (op) {
			case "create":
				return new CreateEntity(readEntity(required(node, ENTITY, p), p), timestamp);
			case "update":
				return new UpdateEntity(readEntity(required(node, ENTITY, p), p), timestamp);
			case "delete":
				return new DeleteEntity(readEntity(required(node, ENTITY, p), p), timestamp);
			case "relate":
				return new Relate(readRelationship(required(node, RELATIONSHIP, p), p), timestamp);
			case "unrelate":
				return new Unrelate(readRelationship(required(node, RELATIONSHIP, p), p), timestamp);
			default:
				throw new JsonParseException(p, "Unrecognized delta op: \"" + op + "\"");
		}
	}

	//
	// Helpers
	//

	private static JsonNode required(JsonNode node, String fieldName, JsonParser p) throws JsonParseException {
		JsonNode result = node.get(fieldName);
		if (result == null || result.isNull()) {
			throw new JsonParseException(p, "Missing field \"" + fieldName + "\"");
		}
		return result;
	}

	private static Optional<String> optionalText(JsonNode node, String fieldName) {
		JsonNode result = node.get(fieldName);
		if (result == null || result.isNull()) {
			return Optional.empty();
		} else {
			return Optional.of(result.asText());
		}
	}

	private static Identifier identifier(JsonNode node, JsonParser p) throws JsonParseException {
		if (!node.isTextual()) {
			throw new JsonParseException(p, "Expected an identifier string; found " + node.getNodeType());
		}
		try {
			return Identifier.from(node.asText());
		} catch (IllegalArgumentException e) {
			throw new JsonParseException(p, "Invalid identifier: " + e.getMessage(), e);
		}
	}

	private static EntityType entityType(String name, JsonParser p) throws JsonParseException {
		try {
			return EntityType.fromExternalName(name);
		} catch (IllegalArgumentException e) {
			throw new JsonParseException(p, e.getMessage(), e);
		}
	}

	static final String ENTITY_TYPE = "entityType";
	static final String OP = "op";
	static final String ENTITIES = "entities";
	static final String RELATIONSHIPS = "relationships";
	static final String ENTITY = "entity";
	static final String RELATIONSHIP = "relationship";
	static final String BASE = "base";
	static final String DELTAS = "deltas";
	static final String POSITION = "position";
}
