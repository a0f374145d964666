package com.leaprnd.signal4j;

import java.util.List;

/**
 * A {@link OnceSignal} whose listeners can also stay registered across any
 * number of dispatches.
 */
public class Signal extends OnceSignal {

	public Signal(ValueClass ... valueClasses) {
		super(valueClasses);
	}

	public Signal(List<? extends ValueClass> valueClasses) {
		super(valueClasses);
	}

	public static Signal newSignal() {
		return new Signal();
	}

	public static Signal newSignal(ValueClass ... valueClasses) {
		return new Signal(valueClasses);
	}

	public static Signal newSignal(Class<?> ... valueClasses) {
		return new Signal(toValueClasses(valueClasses));
	}

	/**
	 * Registers a listener that will be executed by every dispatch until it is
	 * removed.
	 *
	 * @throws InvalidListenerException If the listener is {@code null}.
	 */
	public final Slot add(Listener listener) {
		return register(listener, false);
	}

	@Override
	public Signal setValueClasses(ValueClass ... valueClasses) {
		super.setValueClasses(valueClasses);
		return this;
	}

	@Override
	public Signal remove(long id) {
		super.remove(id);
		return this;
	}

	@Override
	public Signal removeAll() {
		super.removeAll();
		return this;
	}

	@Override
	public Signal dispatch(Object ... arguments) {
		super.dispatch(arguments);
		return this;
	}

}
