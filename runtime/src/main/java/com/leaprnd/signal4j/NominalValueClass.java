package com.leaprnd.signal4j;

import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodType;

import static java.lang.invoke.MethodType.methodType;
import static java.util.Objects.requireNonNull;

/**
 * Satisfied by instances of {@link #type()} and of its subclasses and
 * implementations. Primitive types are checked against their wrappers.
 */
public record NominalValueClass(Class<?> type) implements ValueClass {

	public NominalValueClass {
		requireNonNull(type);
	}

	@Override
	public boolean isSatisfiedBy(@Nullable Object value) {
		return wrap(type).isInstance(value);
	}

	private static Class<?> wrap(Class<?> type) {
		if (type.isPrimitive()) {
			final MethodType wrapped = methodType(type).wrap();
			return wrapped.returnType();
		}
		return type;
	}

	@Override
	public String toString() {
		return type.getName();
	}

}
