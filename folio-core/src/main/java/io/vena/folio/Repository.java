package io.vena.folio;

import io.vena.folio.exceptions.MappingException;
import io.vena.folio.metadata.SchemaDefinition;
import io.vena.folio.metadata.TypeDescriptor;
import io.vena.folio.util.BsonCodecs;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.metadata.SchemaDefinition.ID_KEY;
import static io.vena.folio.metadata.SchemaDefinition.TYPE_CLASS_KEY;
import static io.vena.folio.metadata.SchemaDefinition.TYPE_KEY;
import static io.vena.folio.util.ReflectionHelpers.instantiateWithoutConstructor;
import static io.vena.folio.util.ReflectionHelpers.setAccessible;

/**
 * Collection-level operations for one mapped type.
 *
 * <p>
 * For a subclass stored in an ancestor's single collection, every filter is
 * narrowed to documents whose <code>__type</code> names exactly that subclass.
 *
 * @see Folio#repository
 */
public final class Repository<T> {
	private final Folio folio;
	private final Class<T> type;
	private final SchemaDefinition definition;

	Repository(Folio folio, Class<T> type) {
		this.folio = folio;
		this.type = type;
		this.definition = folio.metadata(type);
	}

	public SchemaDefinition definition() {
		return definition;
	}

	public Class<T> type() {
		return type;
	}

	public Query<T> find() {
		return new Query<>(folio, this, new BsonDocument());
	}

	public Query<T> find(Bson filter) {
		return find().where(filter);
	}

	public Query<T> where(Bson filter) {
		return find(filter);
	}

	/**
	 * @param id the identifier in its Java form; a hex string is taken to be an
	 *           {@link ObjectId} when the identifier property is declared as one
	 */
	public Optional<T> findById(Object id) {
		return find(new BsonDocument(ID_KEY, idValue(id))).first();
	}

	/**
	 * @throws NoSuchElementException if no document matches
	 */
	public T findOrFail(Bson filter) {
		return find(filter).firstOrFail();
	}

	/**
	 * @param attributes values keyed by Java field name
	 * @return the first object whose stored values equal <code>attributes</code>, or a new,
	 * unsaved object with those values
	 */
	public T firstOrNew(Map<String, ?> attributes) {
		return find(filterOf(attributes)).first().orElseGet(() -> newObject(attributes));
	}

	public T firstOrCreate(Map<String, ?> attributes) {
		return find(filterOf(attributes)).first().orElseGet(() -> create(attributes));
	}

	public T create(Map<String, ?> attributes) {
		T result = newObject(attributes);
		folio.save(result);
		return result;
	}

	public long count() {
		return count(new BsonDocument());
	}

	public long count(Bson filter) {
		BsonDocument command = new BsonDocument("count", new BsonString(definition.collectionName()))
			.append("query", scoped(BsonCodecs.render(filter)));
		return folio.store().execute(command).getNumber("n").longValue();
	}

	/**
	 * Sets the given fields on every matching document, bypassing hooks and snapshots.
	 *
	 * @param values keyed by Java field name
	 * @return the number of documents matched
	 */
	public long update(Bson filter, Map<String, ?> values) {
		BsonDocument set = new BsonDocument();
		values.forEach((field, value) -> set.put(definition.storedNameOf(field), folio.serializeValue(value)));
		BsonDocument statement = new BsonDocument("q", scoped(BsonCodecs.render(filter)))
			.append("u", new BsonDocument("$set", set))
			.append("upsert", BsonBoolean.FALSE)
			.append("multi", BsonBoolean.TRUE);
		BsonDocument result = folio.store().execute(new BsonDocument("update", new BsonString(definition.collectionName()))
			.append("updates", new BsonArray(List.of(statement)))
			.append("ordered", BsonBoolean.TRUE));
		LOGGER.debug("Updated {} in {}", result.get("n"), definition.collectionName());
		return result.getNumber("n").longValue();
	}

	/**
	 * Deletes every matching document, bypassing hooks.
	 *
	 * @return the number of documents deleted
	 */
	public long delete(Bson filter) {
		BsonDocument statement = new BsonDocument("q", scoped(BsonCodecs.render(filter)))
			.append("limit", new BsonInt32(0));
		BsonDocument result = folio.store().execute(new BsonDocument("delete", new BsonString(definition.collectionName()))
			.append("deletes", new BsonArray(List.of(statement)))
			.append("ordered", BsonBoolean.TRUE));
		return result.getNumber("n").longValue();
	}

	/**
	 * Deletes every document of this type, keeping the collection and its indexes.
	 */
	public long truncate() {
		LOGGER.info("Truncating {}", definition.collectionName());
		return delete(new BsonDocument());
	}

	public void createIndexes() {
		folio.registry().createIndexes(definition);
	}

	public Object observe(Class<?> observerClass) {
		return folio.registerObserver(type, observerClass);
	}

	/**
	 * @return the Java field name of the identifier
	 */
	public String keyName() {
		return definition.idPropertyKey();
	}

	BsonDocument scoped(BsonDocument filter) {
		if (definition.hasOwnCollection()) {
			return filter;
		}
		BsonDocument discriminator = new BsonDocument(TYPE_KEY + "." + TYPE_CLASS_KEY, new BsonString(definition.typeName()));
		return filter.isEmpty() ? discriminator : new BsonDocument("$and", new BsonArray(List.of(filter, discriminator)));
	}

	private BsonValue idValue(Object id) {
		if (id instanceof String s && ObjectId.isValid(s) && definition.idProperty().typeDescriptor() instanceof TypeDescriptor.IdType) {
			return new BsonObjectId(new ObjectId(s));
		}
		return folio.serializeValue(id);
	}

	private BsonDocument filterOf(Map<String, ?> attributes) {
		BsonDocument result = new BsonDocument();
		attributes.forEach((field, value) -> result.put(definition.storedNameOf(field), folio.serializeValue(value)));
		return result;
	}

	/**
	 * Uses the type's no-argument constructor if it has one, so field initializers run.
	 */
	private T newObject(Map<String, ?> attributes) {
		T result = construct();
		attributes.forEach((field, value) -> folio.setPropertyValue(result, field, value));
		return result;
	}

	private T construct() {
		Constructor<T> constructor;
		try {
			constructor = type.getDeclaredConstructor();
		} catch (NoSuchMethodException e) {
			return instantiateWithoutConstructor(type);
		}
		if (Modifier.isAbstract(type.getModifiers())) {
			throw new MappingException("Cannot instantiate abstract type " + type.getName());
		}
		try {
			return setAccessible(constructor).newInstance();
		} catch (ReflectiveOperationException e) {
			throw new MappingException("Unable to construct " + type.getName(), e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Repository.class);
}
