package io.vena.folio.mapping;

import io.vena.folio.annotations.ValueType;
import io.vena.folio.exceptions.MappingException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.UUID;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.Nullable;

import static io.vena.folio.util.Types.boxed;

/**
 * Conversions between Java scalars and their BSON counterparts.
 */
public final class BsonConversions {
	private BsonConversions() { }

	/**
	 * @return the BSON form of a scalar, or null if <code>value</code> isn't one
	 */
	public static @Nullable BsonValue scalarToBson(@Nullable Object value) {
		if (value == null) {
			return BsonNull.VALUE;
		} else if (value instanceof BsonValue b) {
			return b;
		} else if (value instanceof String s) {
			return new BsonString(s);
		} else if (value instanceof Character c) {
			return new BsonString(c.toString());
		} else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return new BsonInt32(((Number) value).intValue());
		} else if (value instanceof Long l) {
			return new BsonInt64(l);
		} else if (value instanceof Double || value instanceof Float) {
			return new BsonDouble(((Number) value).doubleValue());
		} else if (value instanceof BigDecimal d) {
			return new BsonDecimal128(new Decimal128(d));
		} else if (value instanceof BigInteger i) {
			return new BsonDecimal128(new Decimal128(new BigDecimal(i)));
		} else if (value instanceof Boolean b) {
			return BsonBoolean.valueOf(b);
		} else if (value instanceof Enum<?> e) {
			return new BsonString(e.name());
		} else if (value instanceof ObjectId id) {
			return new BsonObjectId(id);
		} else if (value instanceof Decimal128 d) {
			return new BsonDecimal128(d);
		} else if (value instanceof byte[] bytes) {
			return new BsonBinary(bytes);
		} else if (value instanceof UUID uuid) {
			return new BsonString(uuid.toString());
		}
		Instant instant = instantOf(value);
		return instant == null ? null : new BsonDateTime(instant.toEpochMilli());
	}

	/**
	 * Local date-times are taken to be UTC; local dates become UTC midnight.
	 */
	static @Nullable Instant instantOf(Object value) {
		if (value instanceof Date d) {
			return d.toInstant();
		} else if (value instanceof Instant i) {
			return i;
		} else if (value instanceof ZonedDateTime z) {
			return z.toInstant();
		} else if (value instanceof OffsetDateTime o) {
			return o.toInstant();
		} else if (value instanceof LocalDateTime l) {
			return l.toInstant(ZoneOffset.UTC);
		} else if (value instanceof LocalDate l) {
			return l.atStartOfDay(ZoneOffset.UTC).toInstant();
		} else {
			return null;
		}
	}

	/**
	 * Converts <code>value</code> to the given scalar kind where that makes sense.
	 * Values that can't be converted are returned unchanged.
	 */
	public static Object coerce(Object value, ValueType kind) {
		switch (kind.canonical()) {
			case STRING:
				if (value instanceof Number || value instanceof Boolean || value instanceof Character || value instanceof ObjectId) {
					return value.toString();
				} else if (value instanceof Enum<?> e) {
					return e.name();
				}
				return value;
			case INT:
				if (value instanceof Number n && !(value instanceof Integer)) {
					return n.intValue();
				} else if (value instanceof Boolean b) {
					return b ? 1 : 0;
				} else if (value instanceof CharSequence s) {
					try {
						return Integer.parseInt(s.toString().trim());
					} catch (NumberFormatException e) {
						return value;
					}
				}
				return value;
			case LONG:
				if (value instanceof Number n && !(value instanceof Long)) {
					return n.longValue();
				} else if (value instanceof Boolean b) {
					return b ? 1L : 0L;
				} else if (value instanceof CharSequence s) {
					try {
						return Long.parseLong(s.toString().trim());
					} catch (NumberFormatException e) {
						return value;
					}
				}
				return value;
			case DOUBLE:
				if (value instanceof Number n && !(value instanceof Double)) {
					return n.doubleValue();
				} else if (value instanceof CharSequence s) {
					try {
						return Double.parseDouble(s.toString().trim());
					} catch (NumberFormatException e) {
						return value;
					}
				}
				return value;
			case BOOLEAN:
				if (value instanceof Number n) {
					return n.doubleValue() != 0;
				} else if (value instanceof CharSequence s) {
					String text = s.toString().trim();
					if (text.equalsIgnoreCase("true") || text.equals("1")) {
						return true;
					} else if (text.equalsIgnoreCase("false") || text.equals("0") || text.isEmpty()) {
						return false;
					}
				}
				return value;
			case DATE:
				if (value instanceof Long || value instanceof Integer) {
					return new Date(((Number) value).longValue());
				} else if (value instanceof CharSequence s) {
					try {
						return Instant.parse(s);
					} catch (DateTimeParseException e) {
						return value;
					}
				}
				return value;
			default:
				return value;
		}
	}

	/**
	 * @return the Java value a BSON scalar naturally corresponds to, or the value
	 * itself for BSON types with no better Java counterpart
	 */
	public static @Nullable Object naturalValue(BsonValue value) {
		switch (value.getBsonType()) {
			case NULL:
			case UNDEFINED:
				return null;
			case STRING:
				return value.asString().getValue();
			case SYMBOL:
				return value.asSymbol().getSymbol();
			case INT32:
				return value.asInt32().getValue();
			case INT64:
				return value.asInt64().getValue();
			case DOUBLE:
				return value.asDouble().getValue();
			case DECIMAL128:
				return value.asDecimal128().getValue().bigDecimalValue();
			case BOOLEAN:
				return value.asBoolean().getValue();
			case DATE_TIME:
				return new Date(value.asDateTime().getValue());
			case OBJECT_ID:
				return value.asObjectId().getValue();
			case BINARY:
				return value.asBinary().getData();
			default:
				return value;
		}
	}

	/**
	 * Converts a BSON scalar to <code>target</code>.
	 *
	 * @throws MappingException if no sensible conversion exists
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	public static @Nullable Object scalarFromBson(BsonValue value, Class<?> target) {
		if (value.isNull() || value.getBsonType() == org.bson.BsonType.UNDEFINED) {
			return target.isPrimitive() ? primitiveDefault(target) : null;
		}
		Class<?> boxed = boxed(target);
		if (boxed != Object.class && boxed.isInstance(value)) {
			return value;
		}
		Object natural = naturalValue(value);
		if (boxed.isInstance(natural)) {
			return natural;
		}
		if (boxed == String.class) {
			if (natural instanceof ObjectId id) {
				return id.toHexString();
			} else if (natural instanceof Number || natural instanceof Boolean) {
				return natural.toString();
			}
		} else if (boxed == Integer.class || boxed == Long.class || boxed == Double.class
			|| boxed == Float.class || boxed == Short.class || boxed == Byte.class || boxed == BigDecimal.class) {
			Object number = natural instanceof Boolean b ? (b ? 1 : 0) : natural;
			if (number instanceof CharSequence s) {
				try {
					number = new BigDecimal(s.toString().trim());
				} catch (NumberFormatException e) {
					throw cannotConvert(value, target);
				}
			}
			if (number instanceof Number n) {
				return convertNumber(n, boxed);
			}
		} else if (boxed == Boolean.class) {
			if (natural instanceof Number n) {
				return n.doubleValue() != 0;
			} else if (natural instanceof String s) {
				return Boolean.parseBoolean(s.trim());
			}
		} else if (boxed == Character.class) {
			if (natural instanceof String s && s.length() == 1) {
				return s.charAt(0);
			}
		} else if (boxed == BigInteger.class) {
			if (natural instanceof Number n) {
				return new BigDecimal(n.toString()).toBigInteger();
			}
		} else if (boxed == ObjectId.class) {
			if (natural instanceof String s && ObjectId.isValid(s)) {
				return new ObjectId(s);
			}
		} else if (boxed == UUID.class) {
			if (natural instanceof String s) {
				return UUID.fromString(s);
			}
		} else if (boxed.isEnum()) {
			if (natural instanceof String s) {
				try {
					return Enum.valueOf((Class<? extends Enum>) boxed, s);
				} catch (IllegalArgumentException e) {
					throw new MappingException("No constant " + s + " in " + boxed.getSimpleName(), e);
				}
			}
		} else if (natural instanceof Date date) {
			Instant instant = date.toInstant();
			if (boxed == Instant.class) {
				return instant;
			} else if (boxed == ZonedDateTime.class) {
				return instant.atZone(ZoneOffset.UTC);
			} else if (boxed == OffsetDateTime.class) {
				return instant.atOffset(ZoneOffset.UTC);
			} else if (boxed == LocalDateTime.class) {
				return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
			} else if (boxed == LocalDate.class) {
				return LocalDate.ofInstant(instant, ZoneOffset.UTC);
			}
		}
		throw cannotConvert(value, target);
	}

	private static Object convertNumber(Number n, Class<?> boxed) {
		if (boxed == Integer.class) {
			return n.intValue();
		} else if (boxed == Long.class) {
			return n.longValue();
		} else if (boxed == Double.class) {
			return n.doubleValue();
		} else if (boxed == Float.class) {
			return n.floatValue();
		} else if (boxed == Short.class) {
			return n.shortValue();
		} else if (boxed == Byte.class) {
			return n.byteValue();
		} else {
			return new BigDecimal(n.toString());
		}
	}

	private static Object primitiveDefault(Class<?> primitive) {
		if (primitive == boolean.class) {
			return false;
		} else if (primitive == char.class) {
			return '\0';
		} else {
			return convertNumber(0, boxed(primitive));
		}
	}

	private static MappingException cannotConvert(BsonValue value, Class<?> target) {
		return new MappingException("Cannot convert " + value.getBsonType() + " " + value + " to " + target.getSimpleName());
	}
}
