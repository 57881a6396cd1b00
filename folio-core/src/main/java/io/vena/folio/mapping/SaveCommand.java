package io.vena.folio.mapping;

import java.util.List;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;

/**
 * What a save needs to send to the database: either an insert of the whole
 * document, or an update of one document by its identifier.
 *
 * @param document for {@link Kind#CREATE}, the full document; for {@link Kind#UPDATE},
 *                 the update operators, which may be empty
 * @param selector null for {@link Kind#CREATE}
 */
public record SaveCommand(
	Kind kind,
	String database,
	String namespace,
	String collection,
	@Nullable BsonDocument selector,
	BsonDocument document
) {
	public enum Kind { CREATE, UPDATE }

	public static SaveCommand create(String database, String collection, BsonDocument document) {
		return new SaveCommand(Kind.CREATE, database, database + "." + collection, collection, null, document);
	}

	public static SaveCommand update(String database, String collection, BsonDocument selector, BsonDocument diff) {
		return new SaveCommand(Kind.UPDATE, database, database + "." + collection, collection, selector, diff);
	}

	/**
	 * @return true for an update with nothing to change
	 */
	public boolean isEmpty() {
		return kind == Kind.UPDATE && document.isEmpty();
	}

	public BsonDocument toCommand() {
		switch (kind) {
			case CREATE:
				return new BsonDocument("insert", new BsonString(collection))
					.append("documents", new BsonArray(List.of(document)))
					.append("ordered", BsonBoolean.TRUE);
			case UPDATE:
				BsonDocument statement = new BsonDocument("q", selector)
					.append("u", document)
					.append("upsert", BsonBoolean.FALSE)
					.append("multi", BsonBoolean.FALSE);
				return new BsonDocument("update", new BsonString(collection))
					.append("updates", new BsonArray(List.of(statement)))
					.append("ordered", BsonBoolean.TRUE);
			default:
				throw new AssertionError("Unknown kind " + kind);
		}
	}
}
