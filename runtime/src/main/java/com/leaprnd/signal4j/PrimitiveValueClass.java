package com.leaprnd.signal4j;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static java.util.Locale.ROOT;

public enum PrimitiveValueClass implements ValueClass {

	BOOLEAN {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return value instanceof Boolean;
		}
	},

	INTEGER {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return value instanceof Integer
				|| value instanceof Long
				|| value instanceof Short
				|| value instanceof Byte
				|| value instanceof BigInteger;
		}
	},

	FLOAT {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return value instanceof Double || value instanceof Float || value instanceof BigDecimal;
		}
	},

	STRING {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return value instanceof CharSequence || value instanceof Character;
		}
	},

	ARRAY {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return value instanceof List || value instanceof Map || value != null && value.getClass().isArray();
		}
	},

	OBJECT {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return value != null && !SCALAR.isSatisfiedBy(value) && !ARRAY.isSatisfiedBy(value);
		}
	},

	NULL {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return value == null;
		}
	},

	/**
	 * Any {@link Number}, or a string holding a decimal number.
	 */
	NUMERIC {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			if (value instanceof Number) {
				return true;
			}
			if (value instanceof CharSequence sequence) {
				final var text = sequence.toString().strip();
				if (text.isEmpty()) {
					return false;
				}
				try {
					new BigDecimal(text);
					return true;
				} catch (NumberFormatException exception) {
					return false;
				}
			}
			return false;
		}
	},

	SCALAR {
		@Override
		public boolean isSatisfiedBy(@Nullable Object value) {
			return BOOLEAN.isSatisfiedBy(value) || value instanceof Number || STRING.isSatisfiedBy(value);
		}
	};

	@Override
	public String toString() {
		return name().toLowerCase(ROOT);
	}

}
