package io.vena.folio;

import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.MappingException;
import io.vena.folio.metadata.SchemaDefinition;
import io.vena.folio.metadata.ScopeRef;
import io.vena.folio.util.BsonCodecs;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Consumer;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;

import static io.vena.folio.util.ReflectionHelpers.setAccessible;

/**
 * An immutable filter on one mapped type. Each refinement returns a new query.
 */
public final class Query<T> {
	private final Folio folio;
	private final Repository<T> repository;
	private final BsonDocument filter;

	Query(Folio folio, Repository<T> repository, BsonDocument filter) {
		this.folio = folio;
		this.repository = repository;
		this.filter = filter;
	}

	public BsonDocument filter() {
		return filter;
	}

	public Query<T> where(Bson condition) {
		BsonDocument rendered = BsonCodecs.render(condition);
		if (rendered.isEmpty()) {
			return this;
		} else if (filter.isEmpty()) {
			return new Query<>(folio, repository, rendered);
		} else {
			return new Query<>(folio, repository, new BsonDocument("$and", new BsonArray(List.of(filter, rendered))));
		}
	}

	/**
	 * Applies the scope method named <code>scope&lt;Name&gt;</code>, passing the
	 * current filter followed by <code>args</code>. The method's result becomes
	 * the new filter.
	 *
	 * @param name case-insensitive, without the <code>scope</code> prefix
	 * @throws ConfigurationException if there is no such scope
	 * @throws IllegalArgumentException if the number of arguments doesn't match
	 */
	public Query<T> scope(String name, Object... args) {
		SchemaDefinition definition = repository.definition();
		ScopeRef scope = definition.scope(name).orElseThrow(() ->
			new ConfigurationException("No scope \"" + name + "\" in " + definition.typeName()));
		if (args.length != scope.arity()) {
			throw new IllegalArgumentException("Scope " + scope.methodName() + " expects " + scope.arity()
				+ " argument" + (scope.arity() == 1 ? "" : "s") + ", got " + args.length);
		}
		Method method = scope.method();
		if (!method.getParameterTypes()[0].isAssignableFrom(BsonDocument.class) || !Bson.class.isAssignableFrom(method.getReturnType())) {
			throw new ConfigurationException("Scope " + scope.methodName() + " must take a Bson filter first and return a Bson filter");
		}
		Object receiver = definition.prototype();
		if (receiver == null) {
			throw new ConfigurationException("Scope " + scope.methodName() + " is declared on abstract type " + definition.typeName());
		}
		Object[] callArgs = new Object[args.length + 1];
		callArgs[0] = filter;
		System.arraycopy(args, 0, callArgs, 1, args.length);
		Object result;
		try {
			result = setAccessible(method).invoke(receiver, callArgs);
		} catch (IllegalAccessException e) {
			throw new MappingException("Unable to call scope " + scope.methodName(), e);
		} catch (InvocationTargetException e) {
			if (e.getCause() instanceof RuntimeException r) {
				throw r;
			}
			throw new IllegalStateException("Scope " + scope.methodName() + " failed", e.getCause());
		}
		if (result == null) {
			throw new ConfigurationException("Scope " + scope.methodName() + " returned null");
		}
		return new Query<>(folio, repository, BsonCodecs.render((Bson) result));
	}

	public Optional<T> first() {
		try (DocumentCursor cursor = open()) {
			return cursor.hasNext() ? Optional.of(hydrate(cursor.next())) : Optional.empty();
		}
	}

	/**
	 * @throws NoSuchElementException if no document matches
	 */
	public T firstOrFail() {
		return first().orElseThrow(() -> new NoSuchElementException(
			"No " + repository.type().getSimpleName() + " matches " + filter.toJson()));
	}

	public List<T> toList() {
		List<T> result = new ArrayList<>();
		forEach(result::add);
		return result;
	}

	public void forEach(Consumer<? super T> action) {
		try (DocumentCursor cursor = open()) {
			while (cursor.hasNext()) {
				action.accept(hydrate(cursor.next()));
			}
		}
	}

	public long count() {
		return repository.count(filter);
	}

	private DocumentCursor open() {
		return folio.store().find(repository.definition().collectionName(), repository.scoped(filter));
	}

	private T hydrate(BsonDocument document) {
		return repository.type().cast(folio.newInstance(repository.definition(), document));
	}

	@Override
	public String toString() {
		return "Query(" + repository.type().getSimpleName() + ", " + filter.toJson() + ")";
	}
}
