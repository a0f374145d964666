package com.leaprnd.signal4j;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

import static com.leaprnd.signal4j.PrimitiveValueClass.ARRAY;
import static com.leaprnd.signal4j.PrimitiveValueClass.BOOLEAN;
import static com.leaprnd.signal4j.PrimitiveValueClass.FLOAT;
import static com.leaprnd.signal4j.PrimitiveValueClass.INTEGER;
import static com.leaprnd.signal4j.PrimitiveValueClass.NULL;
import static com.leaprnd.signal4j.PrimitiveValueClass.NUMERIC;
import static com.leaprnd.signal4j.PrimitiveValueClass.OBJECT;
import static com.leaprnd.signal4j.PrimitiveValueClass.SCALAR;
import static com.leaprnd.signal4j.PrimitiveValueClass.STRING;
import static java.util.Objects.requireNonNull;

/**
 * A constraint on one positional argument of {@link OnceSignal#dispatch}.
 */
public sealed interface ValueClass permits PrimitiveValueClass,NominalValueClass {

	boolean isSatisfiedBy(@Nullable Object value);

	/**
	 * @throws TypeMismatchException If the value does not satisfy this value class.
	 */
	default void validate(int position, @Nullable Object value) {
		if (!isSatisfiedBy(value)) {
			throw new TypeMismatchException(this, describeType(value), position);
		}
	}

	static ValueClass of(Class<?> type) {
		return new NominalValueClass(type);
	}

	/**
	 * Resolves a value class by name. Primitive kinds are matched without regard
	 * to case and accept the usual aliases ({@code int}, {@code integer} and
	 * {@code long} all name {@link PrimitiveValueClass#INTEGER}); anything else is
	 * loaded as a fully qualified class name.
	 *
	 * @throws IllegalArgumentException If the name is neither a primitive kind nor
	 *                                  a loadable class.
	 */
	static ValueClass named(String name) {
		requireNonNull(name);
		final var primitive = switch (name.toLowerCase(Locale.ROOT)) {
			case "array" -> ARRAY;
			case "bool", "boolean" -> BOOLEAN;
			case "double", "float", "real" -> FLOAT;
			case "int", "integer", "long" -> INTEGER;
			case "null" -> NULL;
			case "numeric" -> NUMERIC;
			case "object" -> OBJECT;
			case "scalar" -> SCALAR;
			case "string" -> STRING;
			default -> null;
		};
		if (primitive != null) {
			return primitive;
		}
		try {
			return of(Class.forName(name));
		} catch (ClassNotFoundException exception) {
			throw new IllegalArgumentException("Unknown value class: " + name, exception);
		}
	}

	static String describeType(@Nullable Object value) {
		if (value == null) {
			return "null";
		}
		return value.getClass().getName();
	}

}
