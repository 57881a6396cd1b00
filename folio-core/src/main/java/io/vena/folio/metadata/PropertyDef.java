package io.vena.folio.metadata;

import io.vena.folio.validation.ValidationRule;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One persisted property of a mapped type.
 *
 * @param storedName the key used in stored documents
 * @param fieldName the Java field name
 * @param field the backing field, or null for an identifier Folio synthesized
 *              because the type declares none
 */
public record PropertyDef(
	String storedName,
	String fieldName,
	TypeDescriptor typeDescriptor,
	boolean required,
	List<ValidationRule> validations,
	Visibility visibility,
	@Nullable ReferenceSpec reference,
	List<Annotation> annotations,
	@Nullable Field field
) {
	public enum Visibility { PUBLIC, PRIVATE }

	/**
	 * @param with target fields to cache inside the stored pointer
	 */
	public record ReferenceSpec(List<String> with) { }

	public boolean isReference() {
		return reference != null;
	}

	public boolean isPublic() {
		return visibility == Visibility.PUBLIC;
	}

	public boolean isSynthesized() {
		return field == null;
	}

	public PropertyDef withStoredName(String newName) {
		return new PropertyDef(newName, fieldName, typeDescriptor, required, validations, visibility, reference, annotations, field);
	}

	public PropertyDef withTypeDescriptor(TypeDescriptor newDescriptor) {
		return new PropertyDef(storedName, fieldName, newDescriptor, required, validations, visibility, reference, annotations, field);
	}

	static PropertyDef synthesizedId() {
		return new PropertyDef(SchemaDefinition.ID_KEY, "id", TypeDescriptor.ID, false, List.of(), Visibility.PUBLIC, null, List.of(), null);
	}
}
