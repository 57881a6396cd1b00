package io.vena.folio.util;

import org.bson.BsonDocument;
import org.bson.codecs.BsonValueCodecProvider;
import org.bson.codecs.DocumentCodecProvider;
import org.bson.codecs.IterableCodecProvider;
import org.bson.codecs.MapCodecProvider;
import org.bson.codecs.ValueCodecProvider;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.codecs.jsr310.Jsr310CodecProvider;
import org.bson.conversions.Bson;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

import static org.bson.codecs.configuration.CodecRegistries.fromProviders;

public final class BsonCodecs {
	private BsonCodecs() { }

	/**
	 * Enough codecs to render the filters built with the driver's <code>Filters</code> helpers.
	 */
	public static final CodecRegistry CODEC_REGISTRY = fromProviders(
		new BsonValueCodecProvider(),
		new ValueCodecProvider(),
		new Jsr310CodecProvider(),
		new DocumentCodecProvider(),
		new IterableCodecProvider(),
		new MapCodecProvider());

	public static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
		.outputMode(JsonMode.RELAXED)
		.build();

	public static BsonDocument render(Bson filter) {
		if (filter instanceof BsonDocument document) {
			return document;
		}
		return filter.toBsonDocument(BsonDocument.class, CODEC_REGISTRY);
	}
}
