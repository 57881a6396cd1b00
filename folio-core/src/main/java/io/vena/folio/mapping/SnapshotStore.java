package io.vena.folio.mapping;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;

/**
 * Per-object persistence state, keyed by object identity and held weakly
 * so it disappears along with the object.
 */
public final class SnapshotStore {
	private final Map<IdentityKey, State> states = new HashMap<>();
	private final ReferenceQueue<Object> collected = new ReferenceQueue<>();

	private static final class State {
		@Nullable BsonDocument snapshot;
		@Nullable BsonValue generatedId;
	}

	/**
	 * @return the document as of the last load or save, or null if the object was never persisted
	 */
	public synchronized @Nullable BsonDocument lastPersistedDocument(Object object) {
		State state = states.get(new IdentityKey(object));
		return state == null ? null : state.snapshot;
	}

	public synchronized void store(Object object, BsonDocument document) {
		stateOf(object).snapshot = document;
	}

	/**
	 * Forgets the snapshot. An identifier remembered with {@link #rememberId} is kept.
	 */
	public synchronized void clear(Object object) {
		State state = states.get(new IdentityKey(object));
		if (state != null) {
			state.snapshot = null;
		}
	}

	/**
	 * @return the identifier of an object whose type has no identifier field
	 */
	public synchronized @Nullable BsonValue generatedId(Object object) {
		State state = states.get(new IdentityKey(object));
		return state == null ? null : state.generatedId;
	}

	public synchronized void rememberId(Object object, BsonValue id) {
		stateOf(object).generatedId = id;
	}

	synchronized int size() {
		expunge();
		return states.size();
	}

	private State stateOf(Object object) {
		expunge();
		return states.computeIfAbsent(new IdentityKey(object, collected), k -> new State());
	}

	private void expunge() {
		java.lang.ref.Reference<?> ref;
		while ((ref = collected.poll()) != null) {
			states.remove(ref);
		}
	}

	private static final class IdentityKey extends WeakReference<Object> {
		private final int hash;

		IdentityKey(Object referent) {
			super(referent);
			this.hash = System.identityHashCode(referent);
		}

		IdentityKey(Object referent, ReferenceQueue<Object> queue) {
			super(referent, queue);
			this.hash = System.identityHashCode(referent);
		}

		@Override
		public int hashCode() {
			return hash;
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj) {
				return true;
			}
			if (obj instanceof IdentityKey other) {
				Object referent = get();
				return referent != null && referent == other.get();
			}
			return false;
		}
	}
}
