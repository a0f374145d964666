package com.leaprnd.signal4j;

import static java.lang.String.format;

public final class ArityMismatchException extends SignalException {

	private static final long serialVersionUID = 1L;

	private final int expected;
	private final int actual;

	public ArityMismatchException(int expected, int actual) {
		super(format("Value class mismatch, expected %d got %d", expected, actual));
		this.expected = expected;
		this.actual = actual;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}

}
