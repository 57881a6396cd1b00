package io.vena.folio.events;

import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.EventHookException;
import io.vena.folio.exceptions.MappingException;
import io.vena.folio.metadata.EventHook;
import io.vena.folio.metadata.MetadataRegistry;
import io.vena.folio.metadata.SchemaDefinition;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.util.ReflectionHelpers.setAccessible;

/**
 * Runs the hooks and observers registered for a lifecycle event.
 *
 * <p>
 * Hooks declared on the object's type run first, in order, followed by each
 * observer in registration order. The first failure aborts the dispatch.
 */
@RequiredArgsConstructor
public final class EventDispatcher {
	private final MetadataRegistry registry;

	public void triggerEvent(Object object, EventKind kind) {
		triggerEvent(registry.of(object.getClass()), object, kind);
	}

	public void triggerEvent(SchemaDefinition definition, Object object, EventKind kind) {
		for (EventHook hook: definition.hooks(kind)) {
			runHook(definition, object, hook);
		}
		for (Object observer: definition.observers()) {
			notifyObserver(observer, object, kind);
		}
	}

	/**
	 * Instantiates <code>observerClass</code> with its no-argument constructor
	 * and adds it to the definition's observers.
	 *
	 * @return the new observer
	 */
	public Object registerObserver(SchemaDefinition definition, Class<?> observerClass) {
		Object observer;
		try {
			Constructor<?> constructor = observerClass.getDeclaredConstructor();
			observer = setAccessible(constructor).newInstance();
		} catch (NoSuchMethodException | InstantiationException | IllegalAccessException | MappingException e) {
			throw new ConfigurationException("Unable to instantiate observer " + observerClass.getName(), e);
		} catch (InvocationTargetException e) {
			throw new ConfigurationException("Constructor of observer " + observerClass.getName() + " failed", e.getCause());
		}
		definition.addObserver(observer);
		LOGGER.info("Registered observer {} on {}", observerClass.getSimpleName(), definition.typeName());
		return observer;
	}

	private void runHook(SchemaDefinition definition, Object object, EventHook hook) {
		if (!hook.isPublic()) {
			throw new ConfigurationException("Only public methods are supported as event hooks: "
				+ definition.type().getSimpleName() + "." + hook.methodName());
		}
		Method method = hook.method();
		LOGGER.debug("| Hook {}.{} for {}", definition.type().getSimpleName(), hook.methodName(), hook.kind().canonicalName());
		switch (method.getParameterCount()) {
			case 0:
				invoke(method, object);
				break;
			case 1:
				if (!method.getParameterTypes()[0].isAssignableFrom(List.class)) {
					throw new ConfigurationException("Hook " + hook.methodName() + " must take no parameters or a List<String>");
				}
				invoke(method, object, hook.args());
				break;
			default:
				throw new ConfigurationException("Hook " + hook.methodName() + " must take no parameters or a List<String>");
		}
	}

	private void notifyObserver(Object observer, Object object, EventKind kind) {
		for (String alias: kind.aliases()) {
			for (Method method: observer.getClass().getMethods()) {
				if (method.getName().equals(alias)
					&& method.getParameterCount() == 1
					&& method.getParameterTypes()[0].isInstance(object)) {
					LOGGER.debug("| Observer {}.{}", observer.getClass().getSimpleName(), alias);
					invoke(method, observer, object);
				}
			}
		}
	}

	private static void invoke(Method method, Object receiver, Object... args) {
		try {
			setAccessible(method).invoke(receiver, args);
		} catch (IllegalAccessException e) {
			throw new MappingException("Unable to call " + method, e);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException r) {
				throw r;
			} else if (cause instanceof Error err) {
				throw err;
			}
			throw new EventHookException("Hook " + method.getName() + " threw " + cause.getClass().getSimpleName(), cause);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventDispatcher.class);
}
