package io.vena.folio.events;

import io.vena.folio.AbstractFolioCoreTest;
import io.vena.folio.annotations.Hook;
import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.EventHookException;
import java.io.IOException;
import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventDispatcherTest extends AbstractFolioCoreTest {

	@Test
	void fromAlias_allSpellings() {
		assertEquals(EventKind.SAVING, EventKind.fromAlias("saving").orElseThrow());
		assertEquals(EventKind.SAVING, EventKind.fromAlias("before_save").orElseThrow());
		assertEquals(EventKind.SAVING, EventKind.fromAlias("beforeSave").orElseThrow());
		assertEquals(EventKind.DELETED, EventKind.fromAlias("afterDelete").orElseThrow());
		assertEquals("retrieved", EventKind.RETRIEVED.canonicalName());
		assertTrue(EventKind.fromAlias("before_retrieve").isEmpty());
	}

	@Test
	void create_hooksThenObserversInOrder() {
		folio.registerObserver(Audited.class, AuditObserver.class);
		Audited audited = new Audited();
		audited.name = "first";
		folio.save(audited);

		assertEquals(List.of(
			"saving",
			"saving[a, b]",
			"observer:saving",
			"creating",
			"created",
			"saved",
			"observer:afterSave"
		), EVENTS);
	}

	@Test
	void update_firesUpdateEvents() {
		Audited audited = new Audited();
		audited.name = "first";
		folio.save(audited);
		EVENTS.clear();

		audited.name = "second";
		folio.save(audited);
		assertEquals(List.of("saving", "saving[a, b]", "updating", "updated", "saved"), EVENTS);
	}

	@Test
	void update_withoutChangesStillFiresEvents() {
		Audited audited = new Audited();
		folio.save(audited);
		store.clearCommands();
		EVENTS.clear();

		folio.save(audited);
		assertTrue(store.commands().isEmpty(), "Nothing changed, so nothing is sent");
		assertEquals(List.of("saving", "saving[a, b]", "updating", "updated", "saved"), EVENTS);
	}

	@Test
	void delete_firesBeforeAndAfter() {
		folio.registerObserver(Audited.class, AuditObserver.class);
		Audited audited = new Audited();
		folio.save(audited);
		EVENTS.clear();

		folio.delete(audited);
		assertEquals(List.of("delete", "delete", "observer:deleted"), EVENTS);
	}

	@Test
	void retrieved_firedOnLoad() {
		folio.newInstance(Audited.class, new BsonDocument("_id", new BsonObjectId(new ObjectId()))
			.append("name", new BsonString("loaded")));
		assertEquals(List.of("retrieved"), EVENTS);
	}

	@Test
	void triggerEvent_manually() {
		folio.triggerEvent(new Audited(), EventKind.UPDATED);
		assertEquals(List.of("updated"), EVENTS);
	}

	@Test
	void observer_registeredPerType() {
		Object observer = folio.registerObserver(Audited.class, AuditObserver.class);
		assertInstanceOf(AuditObserver.class, observer);
		assertEquals(List.of(observer), folio.metadata(Audited.class).observers());
		assertTrue(folio.metadata(User.class).observers().isEmpty());
	}

	public static class NeedsArgs {
		public NeedsArgs(String unused) { }
	}

	@Test
	void observer_needsNoArgConstructor() {
		assertThrows(ConfigurationException.class, () -> folio.registerObserver(Audited.class, NeedsArgs.class));
	}

	public static class Hidden {
		public ObjectId id;

		@Hook("saving")
		void notPublic() {
			EVENTS.add("hidden");
		}
	}

	@Test
	void nonPublicHook_rejectedWhenFired() {
		Hidden hidden = new Hidden();
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> folio.save(hidden));
		assertThat(e.getMessage(), containsString("Only public methods are supported as event hooks"));
		assertTrue(store.documents(folio.metadata(Hidden.class).collectionName()).isEmpty());
		assertTrue(EVENTS.isEmpty());
	}

	public static class TooManyParameters {
		public ObjectId id;

		@Hook("saving")
		public void hook(List<String> args, String extra) { }
	}

	@Test
	void hookParameters_checked() {
		assertThrows(ConfigurationException.class, () -> folio.save(new TooManyParameters()));
	}

	public static class Vetoing {
		public ObjectId id;

		@Hook("creating")
		public void veto() {
			throw new IllegalStateException("Not today");
		}
	}

	@Test
	void uncheckedException_abortsSave() {
		IllegalStateException e = assertThrows(IllegalStateException.class, () -> folio.save(new Vetoing()));
		assertEquals("Not today", e.getMessage());
		assertTrue(store.documents(folio.metadata(Vetoing.class).collectionName()).isEmpty());
	}

	public static class Failing {
		public ObjectId id;

		@Hook("saved")
		public void fail() throws IOException {
			throw new IOException("disk full");
		}
	}

	@Test
	void checkedException_wrapped() {
		EventHookException e = assertThrows(EventHookException.class, () -> folio.save(new Failing()));
		assertInstanceOf(IOException.class, e.getCause());
		assertEquals(1, store.documents(folio.metadata(Failing.class).collectionName()).size(), "The document was written before the saved hook ran");
	}

	public static class Parent {
		public ObjectId id;

		@Hook("saving")
		public void parentHook() {
			EVENTS.add("parent");
		}
	}

	public static class Child extends Parent {
		@Hook("saving")
		public void childHook() {
			EVENTS.add("child");
		}
	}

	@Test
	void inheritedHooks_runFirst() {
		folio.save(new Child());
		assertEquals(List.of("parent", "child"), EVENTS);
	}

	public static class Stamped {
		public ObjectId id;

		@Hook("saving")
		public void touch() {
			EVENTS.add("stamped:touch");
		}

		@Hook("saving")
		public void wrapUp() {
			EVENTS.add("stamped:wrapUp");
		}
	}

	public static class Restamped extends Stamped {
		@Override
		@Hook("saving")
		public void touch() {
			EVENTS.add("restamped:touch");
		}

		@Override
		public void wrapUp() {
			EVENTS.add("restamped:wrapUp");
		}
	}

	@Test
	void overriddenHook_runsOnceInInheritedPosition() {
		folio.save(new Restamped());
		assertEquals(List.of("restamped:touch", "restamped:wrapUp"), EVENTS);
		assertEquals(2, folio.metadata(Restamped.class).events().get(EventKind.SAVING).size());
	}

	public static class Sequenced {
		public ObjectId id;

		@Hook("saving")
		public void zulu() {
			EVENTS.add("zulu");
		}

		@Hook("saving")
		public void alpha() {
			EVENTS.add("alpha");
		}
	}

	@Test
	void ownHooks_runInDeclarationOrder() {
		folio.save(new Sequenced());
		assertEquals(List.of("zulu", "alpha"), EVENTS);
	}
}
