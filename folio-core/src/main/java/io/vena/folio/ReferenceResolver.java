package io.vena.folio;

import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;

@FunctionalInterface
public interface ReferenceResolver {
	/**
	 * @return the hydrated object, or null if no such document exists
	 */
	@Nullable Object resolve(String collection, BsonValue id);
}
