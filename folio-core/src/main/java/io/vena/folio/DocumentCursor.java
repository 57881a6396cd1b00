package io.vena.folio;

import java.util.Iterator;
import org.bson.BsonDocument;

public interface DocumentCursor extends Iterator<BsonDocument>, AutoCloseable {
	@Override
	void close();
}
