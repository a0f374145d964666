package com.leaprnd.signal4j;

final class Exceptions {

	private Exceptions() {}

	/**
	 * Rethrows the throwable without wrapping it, even when it is checked.
	 */
	public static RuntimeException rethrow(Throwable throwable) {
		if (throwable instanceof RuntimeException exception) {
			throw exception;
		}
		if (throwable instanceof Error error) {
			throw error;
		}
		throw Exceptions.<RuntimeException>unchecked(throwable);
	}

	@SuppressWarnings("unchecked")
	private static <T extends Throwable> RuntimeException unchecked(Throwable toThrow) throws T {
		throw (T) toThrow;
	}

}
