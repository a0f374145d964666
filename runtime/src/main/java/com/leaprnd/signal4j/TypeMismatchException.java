package com.leaprnd.signal4j;

import static java.lang.String.format;

public final class TypeMismatchException extends SignalException {

	private static final long serialVersionUID = 1L;

	private final transient ValueClass expected;
	private final String actual;
	private final int position;

	public TypeMismatchException(ValueClass expected, String actual, int position) {
		super(
			format(
				"Argument %d does not match required value class, expected %s, received %s",
				position,
				expected,
				actual
			)
		);
		this.expected = expected;
		this.actual = actual;
		this.position = position;
	}

	public ValueClass getExpected() {
		return expected;
	}

	/**
	 * @return A description of the type of the rejected argument, either
	 *         {@code null} or the name of its runtime class.
	 */
	public String getActual() {
		return actual;
	}

	/**
	 * @return The zero-based position of the rejected argument.
	 */
	public int getPosition() {
		return position;
	}

}
