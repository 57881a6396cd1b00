package io.vena.folio.annotations;

/**
 * The type vocabulary accepted by {@link Type}. Several constants are
 * synonyms; {@link #canonical()} folds them together.
 */
public enum ValueType {
	INT, INTEGER, LONG, FLOAT, DOUBLE, BOOL, BOOLEAN, STRING, DATE,
	ARRAY, OBJECT, CLASS, ID,

	/**
	 * Only meaningful as {@link Type#element()}: no element type declared.
	 */
	NONE;

	public ValueType canonical() {
		switch (this) {
			case INTEGER: return INT;
			case FLOAT: return DOUBLE;
			case BOOL: return BOOLEAN;
			case CLASS: return OBJECT;
			default: return this;
		}
	}
}
