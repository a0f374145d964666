package com.leaprnd.signal4j;

/**
 * Raised synchronously to the caller of a registration or dispatch that a
 * {@link OnceSignal} rejects. No listener has been invoked when one of these is
 * thrown by {@link OnceSignal#dispatch(Object...)}.
 */
public abstract sealed class SignalException
	extends IllegalArgumentException permits InvalidListenerException,ArityMismatchException,TypeMismatchException {

	private static final long serialVersionUID = 1L;

	protected SignalException(String message) {
		super(message);
	}

	protected SignalException(String message, Throwable cause) {
		super(message, cause);
	}

}
