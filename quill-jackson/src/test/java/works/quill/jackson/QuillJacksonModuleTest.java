package works.quill.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.quill.Identifier;
import works.quill.entities.Character;
import works.quill.entities.CreateEntity;
import works.quill.entities.Entity;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityDelta;
import works.quill.entities.EntityOperations;
import works.quill.entities.Place;
import works.quill.entities.Relationship;
import works.quill.exceptions.ValidationException;
import works.quill.history.DeltaLog;
import works.quill.history.UndoRedoEngine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuillJacksonModuleTest {
	static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

	final ObjectMapper mapper = new ObjectMapper().registerModule(new QuillJacksonModule());
	final EntityOperations ops = new EntityOperations(Clock.fixed(NOW, ZoneOffset.UTC));
	final UndoRedoEngine history = new UndoRedoEngine(100);

	Character alice;
	Character bob;
	DeltaLog log;

	@BeforeEach
	void setupHistory() throws ValidationException {
		alice = Character.named("Alice").withSex("F").withAge(30).withTraits(List.of("curious", "brave"));
		bob = Character.named("Bob");
		log = DeltaLog.startingFrom(EntityCollection.empty());
		for (EntityDelta delta: List.of(
			ops.create(alice),
			ops.create(bob),
			ops.create(Place.named("London").withCountry("England")),
			ops.createOrganization("Royal Society"),
			ops.relate(alice.id(), bob.id(), "friend", true),
			ops.update(bob.withOccupation("baker")))) {
			log = history.apply(log, delta).log();
		}
	}

	@Test
	void entity_fieldLayout() throws JsonProcessingException {
		JsonNode node = mapper.readTree(mapper.writeValueAsString(alice));
		assertEquals("character", node.get("entityType").asText());
		assertEquals("char-alice", node.get("id").asText());
		assertEquals("alice", node.get("xmlId").asText());
		assertEquals(30, node.get("age").asInt());
		assertEquals(2, node.get("traits").size());
		assertFalse(node.has("occupation"));
		assertFalse(node.get("archived").asBoolean());
	}

	@Test
	void identifier_plainString() throws JsonProcessingException {
		assertEquals("\"char-alice\"", mapper.writeValueAsString(alice.id()));
		assertEquals(alice.id(), mapper.readValue("\"char-alice\"", Identifier.class));
	}

	@Test
	void entityCollection_roundTrip() throws JsonProcessingException {
		EntityCollection entities = history.replay(log);
		String json = mapper.writeValueAsString(entities);
		assertEquals(entities, mapper.readValue(json, EntityCollection.class));
	}

	@Test
	void entity_readAsInterface() throws JsonProcessingException {
		Entity entity = mapper.readValue(mapper.writeValueAsString(alice), Entity.class);
		assertEquals(alice, entity);
	}

	@Test
	void entity_wrongConcreteType_rejected() throws JsonProcessingException {
		String json = mapper.writeValueAsString(Place.named("Paris"));
		assertThrows(JsonProcessingException.class, () -> mapper.readValue(json, Character.class));
	}

	@Test
	void relationship_roundTrip() throws JsonProcessingException {
		Relationship friends = history.replay(log).relationships().asList().get(1).withSubtype("childhood");
		assertEquals(friends, mapper.readValue(mapper.writeValueAsString(friends), Relationship.class));
	}

	@Test
	void delta_roundTrip() throws JsonProcessingException {
		for (EntityDelta delta: log.deltas()) {
			EntityDelta read = mapper.readValue(mapper.writeValueAsString(delta), EntityDelta.class);
			assertEquals(delta, read);
		}
		CreateEntity create = (CreateEntity) log.deltas().get(0);
		JsonNode node = mapper.readTree(mapper.writeValueAsString(create));
		assertEquals("create", node.get("op").asText());
		assertEquals("2024-05-01T12:00:00Z", node.get("timestamp").asText());
	}

	@Test
	void deltaLog_replaysToSameState() throws JsonProcessingException {
		DeltaLog undone = history.undo(log).log();
		DeltaLog read = mapper.readValue(mapper.writeValueAsString(undone), DeltaLog.class);
		assertEquals(undone, read);
		assertEquals(history.replay(undone), history.replay(read));
		assertTrue(read.canRedo());
		assertEquals(history.replay(log), history.redo(read).entities());
	}

	@Test
	void deltaLog_missingPosition_endOfLog() throws JsonProcessingException {
		String json = "{\"base\":{\"entities\":[],\"relationships\":[]},\"deltas\":"
			+ mapper.writeValueAsString(log.deltas().subList(0, 2)) + "}";
		DeltaLog read = mapper.readValue(json, DeltaLog.class);
		assertEquals(2, read.position());
		assertEquals(2, history.replay(read).characters().size());
	}

	@Test
	void deltaLog_positionOutOfRange_rejected() {
		String json = "{\"base\":{\"entities\":[],\"relationships\":[]},\"deltas\":[],\"position\":1}";
		assertThrows(JsonProcessingException.class, () -> mapper.readValue(json, DeltaLog.class));
	}

	@Test
	void unknownOp_rejected() {
		String json = "{\"op\":\"merge\",\"timestamp\":\"2024-05-01T12:00:00Z\"}";
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> mapper.readValue(json, EntityDelta.class));
		assertTrue(e.getMessage().contains("merge"), e.getMessage());
	}

	@Test
	void missingField_rejected() {
		String json = "{\"entityType\":\"character\",\"id\":\"char-alice\",\"name\":\"Alice\"}";
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> mapper.readValue(json, Entity.class));
		assertTrue(e.getMessage().contains("xmlId"), e.getMessage());
	}

	@Test
	void badTimestamp_rejected() {
		String json = "{\"op\":\"create\",\"timestamp\":\"yesterday\",\"entity\":{}}";
		assertThrows(JsonProcessingException.class, () -> mapper.readValue(json, EntityDelta.class));
	}

	@Test
	void duplicateIds_rejected() throws JsonProcessingException {
		String entity = mapper.writeValueAsString(bob);
		String json = "{\"entities\":[" + entity + "," + entity + "],\"relationships\":[]}";
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> mapper.readValue(json, EntityCollection.class));
		assertInstanceOf(IllegalArgumentException.class, e.getCause());
	}
}
