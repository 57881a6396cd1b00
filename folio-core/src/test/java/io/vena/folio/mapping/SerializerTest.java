package io.vena.folio.mapping;

import io.vena.folio.AbstractFolioCoreTest;
import io.vena.folio.Reference;
import io.vena.folio.Saveable;
import io.vena.folio.annotations.Ref;
import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.InvalidValueException;
import java.io.StringReader;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SerializerTest extends AbstractFolioCoreTest {

	@Test
	void scalars_useStoredNames() {
		User user = new User("Ann", "ann@example.com");
		user.id = new ObjectId();
		user.score = 7;
		user.tags = List.of("a", "b");
		user.address = new Address("Toronto", "M5V");
		user.secret("s3cret");

		BsonDocument expected = new BsonDocument("_id", new BsonObjectId(user.id))
			.append("name", new BsonString("Ann"))
			.append("email", new BsonString("ann@example.com"))
			.append("score", new BsonInt32(7))
			.append("tags", new BsonArray(List.of(new BsonString("a"), new BsonString("b"))))
			.append("address", new BsonDocument("city", new BsonString("Toronto")).append("zip", new BsonString("M5V")))
			.append("secret", new BsonString("s3cret"));
		assertEquals(expected, folio.toDocument(user, true, false));
	}

	@Test
	void transientAndInternalFields_omitted() {
		User user = new User("Ann", "ann@example.com");
		user.scratch = "scratch";
		user.internal("internal");
		BsonDocument document = folio.toDocument(user, false, false);
		assertFalse(document.containsKey("scratch"));
		assertFalse(document.containsKey("__internal"));
		assertFalse(document.containsKey("_id"), "No identifier until one is generated");
	}

	@Test
	void declaredScalarType_coerces() {
		Account account = new Account();
		account.number = "A-1";
		account.balance = 10;
		account.level = "5";
		account.codes = new ArrayList<>(List.of("1", 2, "x"));
		BsonDocument document = folio.toDocument(account, false, false);
		assertEquals(new BsonString("A-1"), document.get("_id"));
		assertEquals(new BsonInt64(10), document.get("bal"));
		assertEquals(new BsonInt32(5), document.get("level"));
		assertEquals(new BsonArray(List.of(new BsonInt32(1), new BsonInt32(2), new BsonString("x"))), document.get("codes"),
			"Values that can't be coerced are kept as they are");
	}

	@Test
	void generateId_assignsBackToObject() {
		User user = new User("Ann", "ann@example.com");
		BsonDocument document = folio.toDocument(user, true, true);
		assertNotNull(user.id);
		assertEquals(new BsonObjectId(user.id), document.get("_id"));
	}

	@Test
	void generateId_keepsExistingId() {
		User user = new User("Ann", "ann@example.com");
		ObjectId id = new ObjectId();
		user.id = id;
		folio.toDocument(user, true, true);
		assertEquals(id, user.id);
	}

	@Test
	void generateId_withoutIdFieldIsRemembered() {
		Note note = new Note();
		note.text = "hi";
		BsonDocument document = folio.toDocument(note, false, true);
		assertTrue(document.get("_id").isObjectId());
		assertEquals(document.get("_id"), folio.idOf(note));
		assertEquals(document, folio.toDocument(note, false, false), "Remembered identifier is serialized next time");
	}

	@Test
	void reference_wireShape() {
		Member member = new Member();
		member.id = 5;
		member.email = "x@y";
		Invite invite = new Invite();
		invite.member = member;

		BsonDocument expected = new BsonDocument("$ref", new BsonString("members"))
			.append("$id", new BsonInt32(5))
			.append("__cache", new BsonDocument("email", new BsonString("x@y")));
		assertEquals(expected, folio.toDocument(invite, true, false).get("member"));
	}

	@Test
	void reference_wrapperSerializesLikeTarget() {
		User author = new User("Ann", "ann@example.com");
		author.id = new ObjectId();
		Post post = new Post();
		post.title = "Hello";
		post.author = Reference.to(author);

		BsonDocument pointer = folio.toDocument(post, false, false).getDocument("author");
		assertEquals(new BsonString("users"), pointer.get("$ref"));
		assertEquals(new BsonObjectId(author.id), pointer.get("$id"));
		assertEquals(new BsonString("ann@example.com"), pointer.getDocument("__cache").get("email"));
	}

	public static class SelfSaving implements Saveable {
		public ObjectId id;
		public transient int saves;

		@Override
		public void save() {
			saves++;
		}
	}

	public static class Holder {
		public ObjectId id;
		@Ref public Object target;
	}

	@Test
	void reference_savesSaveableTargetOnlyWhenValidating() {
		SelfSaving target = new SelfSaving();
		target.id = new ObjectId();
		Holder holder = new Holder();
		holder.target = target;

		folio.toDocument(holder, false, false);
		assertEquals(0, target.saves, "Snapshots must not save anything");
		folio.toDocument(holder, true, false);
		assertEquals(1, target.saves);
	}

	@Test
	void polymorphicEmbedded_carriesDiscriminator() {
		Dog dog = new Dog();
		dog.name = "Rex";
		dog.goodBoy = true;
		Shop shop = new Shop();
		shop.pet = dog;

		BsonDocument pet = folio.toDocument(shop, false, false).getDocument("pet");
		assertEquals(new BsonDocument("class", new BsonString(Dog.class.getName())), pet.get("__type"));
		assertEquals(BsonBoolean.TRUE, pet.get("goodBoy"));
	}

	@Test
	void singleCollectionDescendant_alwaysCarriesDiscriminator() {
		Cat cat = new Cat();
		cat.name = "Tom";
		cat.lives = 9;
		assertEquals(new BsonString(Cat.class.getName()),
			folio.toDocument(cat, false, false).getDocument("__type").get("class"));

		Animal animal = new Animal();
		animal.name = "Generic";
		assertFalse(folio.toDocument(animal, false, false).containsKey("__type"),
			"The root of a single collection has its own collection");
	}

	@Test
	void untypedValues_mapsListsAndDates() {
		Shop shop = new Shop();
		Map<String, Object> attributes = new LinkedHashMap<>();
		attributes.put("opened", Instant.ofEpochMilli(1000));
		attributes.put("since", LocalDate.of(1970, 1, 2));
		attributes.put("flags", List.of(true, false));
		attributes.put("nothing", null);
		shop.attributes = attributes;
		shop.payload = new Address("Ottawa", null);

		BsonDocument document = folio.toDocument(shop, false, false);
		BsonDocument stored = document.getDocument("attributes");
		assertEquals(new BsonDateTime(1000), stored.get("opened"));
		assertEquals(new BsonDateTime(86_400_000L), stored.get("since"));
		assertEquals(new BsonArray(List.of(BsonBoolean.TRUE, BsonBoolean.FALSE)), stored.get("flags"));
		assertEquals(BsonNull.VALUE, stored.get("nothing"));
		assertEquals(new BsonString(Address.class.getName()),
			document.getDocument("payload").getDocument("__type").get("class"),
			"Untyped objects record their class");
	}

	public static class WithResource {
		public ObjectId id;
		public StringReader reader = new StringReader("open");
		public String kept = "kept";
	}

	@Test
	void resources_skipped() {
		BsonDocument document = folio.toDocument(new WithResource(), false, false);
		assertFalse(document.containsKey("reader"));
		assertEquals(new BsonString("kept"), document.get("kept"));
	}

	public static class Node {
		public ObjectId id;
		public Node next;
	}

	@Test
	void cycle_throws() {
		Node a = new Node();
		Node b = new Node();
		a.next = b;
		b.next = a;
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> folio.toDocument(a, false, false));
		assertThat(e.getMessage(), containsString("Cycle detected"));
	}

	@Test
	void sharedButAcyclic_isFine() {
		Address shared = new Address("Paris", "75001");
		Shop shop = new Shop();
		shop.payload = List.of(shared, shared);
		BsonArray payload = folio.toDocument(shop, false, false).getArray("payload");
		assertEquals(payload.get(0), payload.get(1));
	}

	@Test
	void validation_runsOnlyWhenRequested() {
		User user = new User(null, "ann@example.com");
		assertNotNull(folio.toDocument(user, false, false), "Snapshots never validate");
		InvalidValueException e = assertThrows(InvalidValueException.class, () -> folio.toDocument(user, true, false));
		assertEquals(InvalidValueException.Kind.MISSING_REQUIRED, e.kind());
		assertEquals("name", e.field());
	}

	@Test
	void superclassDefinition_serializesExtraFieldsRaw() {
		Dog dog = new Dog();
		dog.name = "Rex";
		dog.goodBoy = true;
		Serializer serializer = new Serializer(folio.registry(), new PropertyAccess(new SnapshotStore()), folio.settings());
		BsonDocument document = serializer.toDocument(folio.metadata(Animal.class), dog, false, false);
		assertEquals(BsonBoolean.TRUE, document.get("goodBoy"));
		assertNull(document.get("__type"));
	}
}
