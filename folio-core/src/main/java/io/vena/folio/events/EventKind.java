package io.vena.folio.events;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;

/**
 * Lifecycle events, each with the names it answers to.
 * The first alias is the canonical name.
 */
public enum EventKind {
	RETRIEVED("retrieved"),
	CREATING("creating", "before_create", "beforeCreate"),
	CREATED("created", "after_create", "afterCreate"),
	UPDATING("updating", "before_update", "beforeUpdate"),
	UPDATED("updated", "after_update", "afterUpdate"),
	SAVING("saving", "before_save", "beforeSave"),
	SAVED("saved", "after_save", "afterSave"),
	DELETING("deleting", "before_delete", "beforeDelete"),
	DELETED("deleted", "after_delete", "afterDelete"),
	;

	private final List<String> aliases;

	EventKind(String... aliases) {
		this.aliases = unmodifiableList(asList(aliases));
	}

	public List<String> aliases() {
		return aliases;
	}

	public String canonicalName() {
		return aliases.get(0);
	}

	public static Optional<EventKind> fromAlias(String alias) {
		return Optional.ofNullable(BY_ALIAS.get(alias));
	}

	private static final Map<String, EventKind> BY_ALIAS = new HashMap<>();
	static {
		for (EventKind kind: values()) {
			for (String alias: kind.aliases) {
				BY_ALIAS.put(alias, kind);
			}
		}
	}
}
