package com.leaprnd.signal4j;

import org.jetbrains.annotations.NonBlocking;

/**
 * A function attached to a {@link OnceSignal} through a {@link Slot}.
 */
@FunctionalInterface
public interface Listener {

	/**
	 * Invoked sequentially, on the dispatching thread, for every enabled slot of a
	 * signal each time it is dispatched. Anything thrown from here aborts the
	 * dispatch and propagates to its caller.
	 *
	 * @param arguments The dispatch arguments followed by the bound parameters of
	 *                  the slot.
	 */
	@NonBlocking
	void onDispatch(Object... arguments);

	/**
	 * Adapts the public method named {@code methodName} of {@code target} into a
	 * {@link Listener}. The dispatch arguments are spread over the parameters of
	 * the method.
	 *
	 * @throws InvalidListenerException If the target does not have exactly one
	 *                                  public method with that name.
	 */
	static Listener method(Object target, String methodName) {
		return MethodListener.resolve(target, methodName);
	}

}
