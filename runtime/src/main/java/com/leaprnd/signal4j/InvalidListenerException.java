package com.leaprnd.signal4j;

public final class InvalidListenerException extends SignalException {

	private static final long serialVersionUID = 1L;

	public InvalidListenerException(String message) {
		super(message);
	}

	public InvalidListenerException(String message, Throwable cause) {
		super(message, cause);
	}

}
