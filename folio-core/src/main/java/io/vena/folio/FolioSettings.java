package io.vena.folio;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class FolioSettings {
	/**
	 * Whether building a type's metadata for the first time also sends
	 * <code>createIndexes</code> for the indexes it declares.
	 */
	@Default boolean createIndexes = true;

	/**
	 * Non-public fields whose names start with this prefix are never persisted.
	 */
	@Default String reservedPrefix = "__";

	/**
	 * Whether saving an object first saves the {@link Saveable} targets of its references.
	 */
	@Default boolean cascadeReferenceSaves = true;

	public static FolioSettings defaults() {
		return FolioSettings.builder().build();
	}

	public void validate() {
		if (reservedPrefix == null || reservedPrefix.isEmpty()) {
			throw new IllegalArgumentException("reservedPrefix must not be empty");
		}
	}
}
