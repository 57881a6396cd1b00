package io.vena.folio.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import io.vena.folio.DocumentCursor;
import io.vena.folio.DocumentStore;
import io.vena.folio.exceptions.CommandFailedException;
import java.io.Closeable;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * A {@link DocumentStore} backed by a MongoDB database.
 *
 * <p>
 * Commands go through {@link MongoDatabase#runCommand}. Write errors reported
 * in a command's reply, which the driver doesn't raise as exceptions,
 * are thrown as {@link CommandFailedException}, as are commands the server rejects outright.
 */
public final class MongoDocumentStore implements DocumentStore, Closeable {
	private final MongoDocumentStoreSettings settings;
	private final MongoClient client;
	private final boolean ownsClient;
	private final MongoDatabase database;

	/**
	 * Creates a client that is closed along with this store.
	 */
	public MongoDocumentStore(MongoClientSettings clientSettings, MongoDocumentStoreSettings settings) {
		this(MongoClients.create(clientSettings), settings, true);
	}

	/**
	 * Uses a client owned by the caller, who remains responsible for closing it.
	 */
	public MongoDocumentStore(MongoClient client, MongoDocumentStoreSettings settings) {
		this(client, settings, false);
	}

	private MongoDocumentStore(MongoClient client, MongoDocumentStoreSettings settings, boolean ownsClient) {
		settings.validate();
		this.settings = settings;
		this.client = client;
		this.ownsClient = ownsClient;
		this.database = client.getDatabase(settings.database());
		LOGGER.debug("Using database \"{}\"", settings.database());
	}

	@Override
	public String databaseName() {
		return settings.database();
	}

	@Override
	public BsonDocument execute(BsonDocument command) {
		LOGGER.debug("Execute {} on {}", command.getFirstKey(), command.get(command.getFirstKey()));
		BsonDocument result;
		try {
			result = database.runCommand(command, BsonDocument.class);
		} catch (MongoCommandException e) {
			throw new CommandFailedException(e.getErrorCode(), e.getErrorMessage(), e);
		}
		checkWriteErrors(command, result);
		return result;
	}

	@Override
	public DocumentCursor find(String collection, BsonDocument filter) {
		FindIterable<BsonDocument> iterable = database
			.getCollection(collection, BsonDocument.class)
			.find(filter);
		if (settings.queryTimeoutMS() > 0) {
			iterable = iterable.maxTime(settings.queryTimeoutMS(), MILLISECONDS);
		}
		MongoCursor<BsonDocument> cursor = iterable.iterator();
		return new DocumentCursor() {
			@Override
			public boolean hasNext() {
				return cursor.hasNext();
			}

			@Override
			public BsonDocument next() {
				return cursor.next();
			}

			@Override
			public void close() {
				cursor.close();
			}
		};
	}

	/**
	 * Drops the whole database. Meant for tests.
	 */
	public void dropDatabase() {
		LOGGER.info("Dropping database \"{}\"", settings.database());
		database.drop();
	}

	@Override
	public void close() {
		if (ownsClient) {
			client.close();
		}
	}

	private static void checkWriteErrors(BsonDocument command, BsonDocument result) {
		BsonValue writeErrors = result.get("writeErrors");
		if (writeErrors instanceof BsonArray errors && !errors.isEmpty()) {
			BsonDocument first = errors.get(0).asDocument();
			int code = first.getNumber("code").intValue();
			String message = first.getString("errmsg").getValue();
			LOGGER.debug("{} failed with {} write error{}", command.getFirstKey(), errors.size(), errors.size() == 1 ? "" : "s");
			throw new CommandFailedException(code, message);
		}
		BsonValue concernError = result.get("writeConcernError");
		if (concernError instanceof BsonDocument error) {
			throw new CommandFailedException(error.getNumber("code").intValue(), error.getString("errmsg").getValue());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoDocumentStore.class);
}
