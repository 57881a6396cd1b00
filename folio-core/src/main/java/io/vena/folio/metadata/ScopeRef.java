package io.vena.folio.metadata;

import java.lang.reflect.Method;

/**
 * A named, reusable query refinement declared as a method called
 * <code>scope&lt;Name&gt;</code>. The method receives the current filter
 * followed by {@link #arity} caller-supplied arguments and returns the refined filter.
 */
public record ScopeRef(
	String name,
	String methodName,
	int arity,
	Method method
) { }
