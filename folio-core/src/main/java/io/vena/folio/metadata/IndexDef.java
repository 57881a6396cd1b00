package io.vena.folio.metadata;

import java.util.List;
import java.util.Locale;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

import static java.util.stream.Collectors.joining;

public record IndexDef(
	List<Key> keys,
	boolean unique,
	boolean sparse,
	boolean background,
	String name
) {
	public record Key(String field, Direction direction) { }

	public enum Direction {
		ASC(1), DESC(-1);

		private final int order;

		Direction(int order) {
			this.order = order;
		}

		public int order() {
			return order;
		}
	}

	/**
	 * Names the index after its kind and key fields, for example
	 * <code>unique_email_asc</code> or <code>index_score_desc</code>.
	 */
	public static IndexDef of(List<Key> keys, boolean unique, boolean sparse) {
		String name = (unique ? "unique" : "index") + keys.stream()
			.map(k -> "_" + k.field() + "_" + k.direction().name().toLowerCase(Locale.ROOT))
			.collect(joining());
		return new IndexDef(List.copyOf(keys), unique, sparse, true, name);
	}

	public BsonDocument toBson() {
		BsonDocument key = new BsonDocument();
		keys.forEach(k -> key.append(k.field(), new BsonInt32(k.direction().order())));
		return new BsonDocument("key", key)
			.append("name", new BsonString(name))
			.append("unique", BsonBoolean.valueOf(unique))
			.append("sparse", BsonBoolean.valueOf(sparse))
			.append("background", BsonBoolean.valueOf(background));
	}

	static BsonArray toBson(List<IndexDef> indexes) {
		BsonArray result = new BsonArray();
		indexes.forEach(i -> result.add(i.toBson()));
		return result;
	}
}
