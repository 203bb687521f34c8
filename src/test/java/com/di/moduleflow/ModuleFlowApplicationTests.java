package com.di.moduleflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for ModuleFlowApplication.
 */
@DisplayName("ModuleFlowApplication Tests")
class ModuleFlowApplicationTests {

	@Test
	@DisplayName("Should have a public static main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = ModuleFlowApplication.class.getMethod("main", String[].class);
		assertTrue(Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(Modifier.isPublic(mainMethod.getModifiers()));
	}
}
