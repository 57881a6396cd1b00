package io.vena.folio.mongo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MongoDocumentStoreSettingsTest {
	@Test
	void defaults() {
		MongoDocumentStoreSettings settings = MongoDocumentStoreSettings.builder().database("db").build();
		assertEquals(0, settings.queryTimeoutMS());
		assertDoesNotThrow(settings::validate);
	}

	@Test
	void validate_rejectsBadValues() {
		assertThrows(IllegalArgumentException.class, () -> MongoDocumentStoreSettings.builder().build().validate());
		assertThrows(IllegalArgumentException.class, () -> MongoDocumentStoreSettings.builder().database(" ").build().validate());
		assertThrows(IllegalArgumentException.class, () -> MongoDocumentStoreSettings.builder().database("db").queryTimeoutMS(-1).build().validate());
	}
}
