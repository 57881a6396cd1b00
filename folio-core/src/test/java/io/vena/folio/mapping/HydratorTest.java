package io.vena.folio.mapping;

import io.vena.folio.AbstractFolioCoreTest;
import io.vena.folio.Reference;
import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.ReferenceResolutionException;
import java.util.Date;
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HydratorTest extends AbstractFolioCoreTest {

	@Test
	void roundTrip_reproducesDocument() {
		User user = new User("Ann", "ann@example.com");
		user.id = new ObjectId();
		user.score = 12;
		user.tags = List.of("x", "y");
		user.address = new Address("Toronto", "M5V");
		user.secret("hidden");
		BsonDocument document = folio.toDocument(user, true, false);

		User loaded = folio.newInstance(User.class, document);
		assertEquals(user.id, loaded.id);
		assertEquals("Ann", loaded.name);
		assertEquals(12, loaded.score);
		assertEquals(List.of("x", "y"), loaded.tags);
		assertEquals("Toronto", loaded.address.city);
		assertEquals("hidden", loaded.secret(), "Private fields are injected");
		assertEquals(document, folio.toDocument(loaded, false, false));
	}

	@Test
	void constructor_notRun() {
		ObjectId id = new ObjectId();
		Strict strict = folio.newInstance(Strict.class, new BsonDocument("_id", new BsonObjectId(id))
			.append("value", new BsonString("v")));
		assertEquals(id, strict.id);
		assertEquals("v", strict.value);
	}

	@Test
	void loaded_isSnapshotted() {
		Tag tag = folio.newInstance(Tag.class, new BsonDocument("_id", new BsonInt32(1)).append("name", new BsonString("a")));
		assertTrue(folio.isPersisted(tag));
		assertFalse(folio.isDirty(tag));
		tag.name = "b";
		assertTrue(folio.isDirty(tag));
	}

	@Test
	void storedNamesAndCoercion() {
		Account account = folio.newInstance(Account.class, new BsonDocument("_id", new BsonString("A-7"))
			.append("bal", new BsonInt32(40))
			.append("level", new BsonInt32(3))
			.append("codes", new BsonArray(List.of(new BsonInt32(1), new BsonInt32(2)))));
		assertEquals("A-7", account.number);
		assertEquals(40L, account.balance, "Int32 widens to a long field");
		assertEquals(3, account.level);
		assertEquals(List.of(1, 2), account.codes);
	}

	@Test
	void nullValues_leavePrimitiveDefaults() {
		User user = folio.newInstance(User.class, new BsonDocument("name", BsonNull.VALUE)
			.append("score", BsonNull.VALUE));
		assertNull(user.name);
		assertEquals(0, user.score);
	}

	@Test
	void synthesizedId_isRemembered() {
		ObjectId id = new ObjectId();
		Note note = folio.newInstance(Note.class, new BsonDocument("_id", new BsonObjectId(id))
			.append("text", new BsonString("hello")));
		assertEquals("hello", note.text);
		assertEquals(new BsonObjectId(id), folio.idOf(note));
	}

	@Test
	void discriminator_selectsSubclass() {
		BsonDocument document = new BsonDocument("_id", new BsonObjectId(new ObjectId()))
			.append("name", new BsonString("Rex"))
			.append("goodBoy", BsonBoolean.TRUE)
			.append("__type", new BsonDocument("class", new BsonString(Dog.class.getName())));
		Animal animal = folio.newInstance(Animal.class, document);
		Dog dog = assertInstanceOf(Dog.class, animal);
		assertEquals("Rex", dog.name);
		assertTrue(dog.goodBoy);
	}

	@Test
	void discriminator_mustBeSubtype() {
		BsonDocument document = new BsonDocument("name", new BsonString("Tom"))
			.append("__type", new BsonDocument("class", new BsonString(Cat.class.getName())));
		assertThrows(ConfigurationException.class, () -> folio.newInstance(Dog.class, document));
	}

	@Test
	void discriminator_unknownClass() {
		BsonDocument document = new BsonDocument("name", new BsonString("Tom"))
			.append("__type", new BsonDocument("class", new BsonString("com.example.NoSuchAnimal")));
		assertThrows(ConfigurationException.class, () -> folio.newInstance(Animal.class, document));
	}

	@Test
	void embedded_polymorphicAndUntyped() {
		BsonDocument pet = new BsonDocument("name", new BsonString("Tom"))
			.append("lives", new BsonInt32(9))
			.append("__type", new BsonDocument("class", new BsonString(Cat.class.getName())));
		BsonDocument document = new BsonDocument("_id", new BsonObjectId(new ObjectId()))
			.append("pet", pet)
			.append("payload", new BsonDocument("city", new BsonString("Lyon")))
			.append("attributes", new BsonDocument("count", new BsonInt64(4))
				.append("opened", new BsonDateTime(1000)));
		Shop shop = folio.newInstance(Shop.class, document);

		Cat cat = assertInstanceOf(Cat.class, shop.pet);
		assertEquals(9, cat.lives);
		assertEquals(Map.of("city", "Lyon"), shop.payload, "Untyped documents become maps");
		assertEquals(4L, shop.attributes.get("count"));
		assertEquals(new Date(1000), shop.attributes.get("opened"));
	}

	@Test
	void unknownKeys_skipped() {
		User user = folio.newInstance(User.class, new BsonDocument("name", new BsonString("Ann"))
			.append("legacy", new BsonString("gone")));
		assertEquals("Ann", user.name);
		assertFalse(folio.toDocument(user, false, false).containsKey("legacy"));
	}

	@Test
	void reference_isLazy() {
		User author = new User("Ann", "ann@example.com");
		folio.save(author);
		store.clearCommands();

		BsonDocument document = new BsonDocument("_id", new BsonObjectId(new ObjectId()))
			.append("title", new BsonString("Hello"))
			.append("author", folio.makeReference(author, "email"));
		Post post = folio.newInstance(Post.class, document);

		assertFalse(post.author.isResolved());
		assertEquals(new BsonString("ann@example.com"), post.author.cachedField("email"));
		assertTrue(store.commands().isEmpty(), "Nothing is read until the reference is dereferenced");

		User resolved = post.author.get();
		assertEquals(author.id, resolved.id);
		assertEquals("Ann", resolved.name);
		assertSame(resolved, post.author.get());
	}

	@Test
	void reference_untypedField() {
		Member member = new Member();
		member.id = 5;
		member.email = "x@y";
		folio.save(member);

		Invite invite = new Invite();
		invite.member = member;
		folio.save(invite);

		Invite loaded = folio.repository(Invite.class).findById(invite.id).orElseThrow();
		Reference<?> reference = assertInstanceOf(Reference.class, loaded.member);
		assertEquals(new BsonInt32(5), reference.id());
		assertEquals("x@y", ((Member) reference.get()).email);
	}

	@Test
	void reference_missingTarget() {
		folio.metadata(User.class);
		BsonDocument document = new BsonDocument("_id", new BsonObjectId(new ObjectId()))
			.append("author", new BsonDocument("$ref", new BsonString("users"))
				.append("$id", new BsonObjectId(new ObjectId())));
		Post post = folio.newInstance(Post.class, document);
		assertThrows(ReferenceResolutionException.class, post.author::get);
	}
}
