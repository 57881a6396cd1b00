package io.vena.folio;

import org.bson.BsonDocument;

/**
 * The connection to the database, reduced to what Folio needs:
 * running commands and iterating query results.
 *
 * <p>
 * Implementations report failures by throwing; Folio doesn't catch them.
 */
public interface DocumentStore {
	String databaseName();

	/**
	 * Runs a database command such as <code>insert</code>, <code>update</code>,
	 * <code>delete</code>, <code>count</code> or <code>createIndexes</code>.
	 *
	 * @return the command's reply
	 */
	BsonDocument execute(BsonDocument command);

	DocumentCursor find(String collection, BsonDocument filter);
}
