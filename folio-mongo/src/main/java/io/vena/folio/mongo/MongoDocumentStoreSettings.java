package io.vena.folio.mongo;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class MongoDocumentStoreSettings {
	String database;

	/**
	 * Server-side time limit for each <code>find</code>. Zero means no limit.
	 */
	@Default long queryTimeoutMS = 0;

	public void validate() {
		if (database == null || database.isBlank()) {
			throw new IllegalArgumentException("MongoDocumentStoreSettings requires a database name");
		}
		if (queryTimeoutMS < 0) {
			throw new IllegalArgumentException("queryTimeoutMS must not be negative");
		}
	}
}
