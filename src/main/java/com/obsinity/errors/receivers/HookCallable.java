package com.obsinity.errors.receivers;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.obsinity.errors.configuration.ReporterConfigurationException;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.SendResult;

/**
 * A configured hook, validated and resolved to a uniform call shape.
 *
 * <p>Two shapes are accepted, both checked against the slot's arity (1 for before-send, 2 for after-send):
 * <ul>
 *   <li><b>function</b>: {@link BeforeSendHook} / {@link Function} for arity 1, {@link AfterSendHook} /
 *       {@link BiFunction} / {@link BiConsumer} for arity 2;
 *   <li><b>bound method</b>: a {@link BoundMethod}, or a {@code "fully.qualified.Class#method"} string naming a
 *       static method.
 * </ul>
 * Anything else raises {@link ReporterConfigurationException}.
 */
public interface HookCallable {

	/** Calls the hook. Exceptions thrown by the hook itself propagate unchanged. */
	Object invoke(Object... args);

	int arity();

	/**
	 * @param setting    setting name used in error messages, e.g. {@code before-send}
	 * @param configured the configured value; {@code null} means no hook
	 * @param arity      number of arguments the slot passes
	 * @return the resolved hook, or {@code null} when none is configured
	 */
	static HookCallable resolve(String setting, Object configured, int arity) {
		if (configured == null) return null;
		if (configured instanceof HookCallable h) {
			if (h.arity() != arity) throw invalid(setting, configured, arity);
			return h;
		}
		if (arity == 1) {
			if (configured instanceof BeforeSendHook hook) {
				return new FunctionHook(1, args -> hook.beforeSend((ErrorEvent) args[0]), configured);
			}
			if (configured instanceof Function<?, ?> f) {
				@SuppressWarnings("unchecked") Function<Object, Object> fn = (Function<Object, Object>) f;
				return new FunctionHook(1, args -> fn.apply(args[0]), configured);
			}
		}
		if (arity == 2) {
			if (configured instanceof AfterSendHook hook) {
				return new FunctionHook(2, args -> {
					hook.afterSend((ErrorEvent) args[0], (SendResult) args[1]);
					return null;
				}, configured);
			}
			if (configured instanceof BiFunction<?, ?, ?> f) {
				@SuppressWarnings("unchecked") BiFunction<Object, Object, Object> fn = (BiFunction<Object, Object, Object>) f;
				return new FunctionHook(2, args -> fn.apply(args[0], args[1]), configured);
			}
			if (configured instanceof BiConsumer<?, ?> c) {
				@SuppressWarnings("unchecked") BiConsumer<Object, Object> fn = (BiConsumer<Object, Object>) c;
				return new FunctionHook(2, args -> {
					fn.accept(args[0], args[1]);
					return null;
				}, configured);
			}
		}
		if (configured instanceof BoundMethod bm) {
			return MethodHook.bind(setting, bm, arity);
		}
		if (configured instanceof String s && !s.isBlank()) {
			return MethodHook.bind(setting, parse(setting, s.trim(), arity), arity);
		}
		throw invalid(setting, configured, arity);
	}

	private static BoundMethod parse(String setting, String reference, int arity) {
		int hash = reference.indexOf('#');
		if (hash <= 0 || hash == reference.length() - 1) {
			throw invalid(setting, reference, arity);
		}
		String className = reference.substring(0, hash);
		try {
			ClassLoader cl = Thread.currentThread().getContextClassLoader();
			Class<?> type = Class.forName(className, true, cl != null ? cl : HookCallable.class.getClassLoader());
			return BoundMethod.ofStatic(type, reference.substring(hash + 1));
		} catch (ClassNotFoundException e) {
			throw new ReporterConfigurationException(setting, setting + ": class not found: " + className, e);
		}
	}

	private static ReporterConfigurationException invalid(String setting, Object configured, int arity) {
		String expected = (arity == 1) ? "a BeforeSendHook/Function" : "an AfterSendHook/BiFunction/BiConsumer";
		return new ReporterConfigurationException(setting,
			setting + " must be " + expected + ", a BoundMethod or a \"Class#method\" string taking "
				+ arity + " argument(s); got " + configured.getClass().getName());
	}

	/** Function shape. */
	record FunctionHook(int arity, Function<Object[], Object> call, Object source) implements HookCallable {
		@Override
		public Object invoke(Object... args) {
			return call.apply(args);
		}

		@Override
		public String toString() {
			return "function:" + source.getClass().getName();
		}
	}

	/** Bound-method shape, resolved once. */
	record MethodHook(Object target, Method method) implements HookCallable {

		static MethodHook bind(String setting, BoundMethod bm, int arity) {
			boolean isStatic = bm.target() instanceof Class<?>;
			Class<?> type = isStatic ? (Class<?>) bm.target() : bm.target().getClass();
			List<Method> candidates = new ArrayList<>();
			for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
				for (Method m : c.getDeclaredMethods()) {
					if (m.getName().equals(bm.methodName())
						&& !m.isSynthetic()
						&& m.getParameterCount() == arity
						&& Modifier.isStatic(m.getModifiers()) == isStatic
						&& acceptsHookArgs(m)) {
						candidates.add(m);
					}
				}
				if (!candidates.isEmpty()) break;
			}
			if (candidates.isEmpty()) {
				throw new ReporterConfigurationException(setting,
					setting + ": no " + (isStatic ? "static " : "") + "method " + bm + " taking " + arity
						+ " argument(s) compatible with the hook arguments");
			}
			if (candidates.size() > 1) {
				throw new ReporterConfigurationException(setting, setting + ": method " + bm + " is ambiguous");
			}
			Method method = candidates.get(0);
			// Non-public declaring classes (e.g. test inner classes) still need to be callable.
			method.setAccessible(true);
			return new MethodHook(isStatic ? null : bm.target(), method);
		}

		private static boolean acceptsHookArgs(Method m) {
			Class<?>[] p = m.getParameterTypes();
			if (!p[0].isAssignableFrom(ErrorEvent.class)) return false;
			return p.length < 2 || p[1].isAssignableFrom(SendResult.class);
		}

		@Override
		public int arity() {
			return method.getParameterCount();
		}

		@Override
		public Object invoke(Object... args) {
			try {
				return method.invoke(target, args);
			} catch (InvocationTargetException e) {
				Throwable cause = e.getCause();
				if (cause instanceof RuntimeException re) throw re;
				if (cause instanceof Error err) throw err;
				throw new UndeclaredThrowableException(cause, "hook " + this + " failed");
			} catch (IllegalAccessException e) {
				throw new IllegalStateException("hook " + this + " is not accessible", e);
			}
		}

		@Override
		public String toString() {
			return method.getDeclaringClass().getName() + "#" + method.getName();
		}
	}
}
