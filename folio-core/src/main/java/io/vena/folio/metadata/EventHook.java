package io.vena.folio.metadata;

import io.vena.folio.events.EventKind;
import java.lang.reflect.Method;
import java.util.List;

/**
 * A method on a mapped type registered with {@link io.vena.folio.annotations.Hook}.
 * Non-public hooks are recorded here and rejected when the event fires.
 */
public record EventHook(
	EventKind kind,
	String methodName,
	boolean isPublic,
	List<String> args,
	Method method
) { }
