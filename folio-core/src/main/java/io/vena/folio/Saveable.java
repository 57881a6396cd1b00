package io.vena.folio;

/**
 * Implemented by objects that know how to persist themselves. When a reference
 * to such an object is serialized for a save, the target is saved first.
 */
public interface Saveable {
	void save();
}
