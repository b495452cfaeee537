package com.obsinity.errors.receivers;

import java.util.Objects;

/**
 * A hook given as a receiver plus a method name, e.g. {@code new BoundMethod(auditService, "onErrorSent")}.
 *
 * <p>When {@code target} is a {@link Class} the method is looked up as a static method of that class. The method is
 * resolved once, when the {@link HookInvoker} is built; it must take exactly the hook's arguments.
 */
public record BoundMethod(Object target, String methodName) {

	public BoundMethod {
		Objects.requireNonNull(target, "target");
		Objects.requireNonNull(methodName, "methodName");
	}

	/** Static method of {@code type}. */
	public static BoundMethod ofStatic(Class<?> type, String methodName) {
		return new BoundMethod(type, methodName);
	}

	@Override
	public String toString() {
		String owner = (target instanceof Class<?> c) ? c.getName() : target.getClass().getName();
		return owner + "#" + methodName;
	}
}
