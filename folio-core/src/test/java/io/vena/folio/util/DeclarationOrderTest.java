package io.vena.folio.util;

import java.lang.reflect.Method;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DeclarationOrderTest {

	@SuppressWarnings("unused")
	static class Declared {
		void mike() { }
		void charlie(int x) { }
		void charlie() { }
		static void alpha() { }
		private void bravo() { }
	}

	@Test
	void declaredMethods_followClassFile() {
		List<String> names = DeclarationOrder.declaredMethods(Declared.class).stream()
			.map(m -> m.getName() + m.getParameterCount())
			.toList();
		assertEquals(List.of("mike0", "charlie1", "charlie0", "alpha0", "bravo0"), names);
	}

	@Test
	void declaredMethods_includesEveryDeclaredMethod() {
		List<Method> methods = DeclarationOrder.declaredMethods(DeclarationOrderTest.class);
		assertEquals(DeclarationOrderTest.class.getDeclaredMethods().length, methods.size());
	}
}
