package com.leaprnd.signal4j;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Method;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.leaprnd.signal4j.Exceptions.rethrow;
import static java.lang.String.format;
import static java.lang.invoke.MethodHandles.lookup;
import static java.lang.invoke.MethodHandles.publicLookup;
import static java.lang.reflect.Modifier.isPublic;
import static java.lang.reflect.Modifier.isStatic;

record MethodListener(Object target, String methodName, MethodHandle handle) implements Listener {

	static MethodListener resolve(Object target, String methodName) {
		if (target == null || methodName == null) {
			throw new InvalidListenerException("A method listener needs both a target and a method name!");
		}
		final var type = target.getClass();
		Method found = null;
		for (final var method : type.getMethods()) {
			if (!method.getName().equals(methodName) || isStatic(method.getModifiers())) {
				continue;
			}
			if (method.isBridge() || method.isSynthetic()) {
				continue;
			}
			if (found != null) {
				throw new InvalidListenerException(
					format("%s has more than one public method named %s!", type.getName(), methodName)
				);
			}
			found = method;
		}
		if (found == null) {
			throw new InvalidListenerException(
				format("%s has no public method named %s!", type.getName(), methodName)
			);
		}
		try {
			final var handle = unreflect(found).bindTo(target);
			return new MethodListener(target, methodName, handle);
		} catch (IllegalAccessException exception) {
			throw new InvalidListenerException(
				format("%s.%s is not accessible!", type.getName(), methodName),
				exception
			);
		}
	}

	/**
	 * Public methods of non-public classes, such as anonymous classes, are reached
	 * through a public supertype declaring the same method when there is one.
	 */
	private static MethodHandle unreflect(Method method) throws IllegalAccessException {
		final var name = method.getName();
		final var parameterTypes = method.getParameterTypes();
		for (final var type : supertypesOf(method.getDeclaringClass())) {
			if (!isPublic(type.getModifiers())) {
				continue;
			}
			try {
				final var declaration = type.getMethod(name, parameterTypes);
				if (isPublic(declaration.getDeclaringClass().getModifiers())) {
					return publicLookup().unreflect(declaration);
				}
			} catch (NoSuchMethodException | IllegalAccessException exception) {
				continue;
			}
		}
		if (method.trySetAccessible()) {
			return lookup().unreflect(method);
		}
		throw new IllegalAccessException(format("%s is declared in a class that is not public", method));
	}

	private static Set<Class<?>> supertypesOf(Class<?> type) {
		final var supertypes = new LinkedHashSet<Class<?>>();
		collectSupertypes(type, supertypes);
		return supertypes;
	}

	private static void collectSupertypes(Class<?> type, Set<Class<?>> supertypes) {
		if (type == null || !supertypes.add(type)) {
			return;
		}
		collectSupertypes(type.getSuperclass(), supertypes);
		for (final var implemented : type.getInterfaces()) {
			collectSupertypes(implemented, supertypes);
		}
	}

	@Override
	public void onDispatch(Object... arguments) {
		try {
			handle.invokeWithArguments(arguments);
		} catch (Throwable throwable) {
			throw rethrow(throwable);
		}
	}

	@Override
	public String toString() {
		return target.getClass().getName() + "::" + methodName;
	}

}
