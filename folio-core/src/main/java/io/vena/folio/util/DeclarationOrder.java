package io.vena.folio.util;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Arrays.asList;
import static org.objectweb.asm.Type.getMethodDescriptor;

/**
 * Recovers the order in which a class declares its methods.
 * {@link Class#getDeclaredMethods()} makes no promise about order,
 * but the compiler writes methods to the class file in source order.
 */
public final class DeclarationOrder {
	private DeclarationOrder() { }

	/**
	 * @return the methods <code>type</code> declares, in class-file order.
	 * Falls back to method-name order when the class file can't be read.
	 */
	public static List<Method> declaredMethods(Class<?> type) {
		List<Method> result = new ArrayList<>(asList(type.getDeclaredMethods()));
		result.sort(Comparator.comparing(Method::getName).thenComparing(Method::getParameterCount));
		Map<String, Integer> positions = classFilePositions(type);
		if (!positions.isEmpty()) {
			// Stable, so anything the class file doesn't list stays in name order at the end
			result.sort(Comparator.comparing((Method m) ->
				positions.getOrDefault(m.getName() + getMethodDescriptor(m), Integer.MAX_VALUE)));
		}
		return result;
	}

	private static Map<String, Integer> classFilePositions(Class<?> type) {
		String name = type.getName();
		String resource = name.substring(name.lastIndexOf('.') + 1) + ".class";
		try (InputStream in = type.getResourceAsStream(resource)) {
			if (in == null) {
				LOGGER.debug("No class file for {}; methods are taken in name order", name);
				return Map.of();
			}
			Map<String, Integer> result = new HashMap<>();
			new ClassReader(in).accept(new ClassVisitor(Opcodes.ASM9) {
				@Override
				public MethodVisitor visitMethod(int access, String methodName, String descriptor, String signature, String[] exceptions) {
					result.putIfAbsent(methodName + descriptor, result.size());
					return null;
				}
			}, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
			return result;
		} catch (IOException | IllegalArgumentException e) {
			LOGGER.warn("Unable to read the class file of {}; methods are taken in name order", name, e);
			return Map.of();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DeclarationOrder.class);
}
