package com.leaprnd.signal4j;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.lang.ref.WeakReference;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.System.arraycopy;
import static java.util.Arrays.asList;
import static java.util.Arrays.copyOf;
import static java.util.Collections.unmodifiableList;

/**
 * One registration of a {@link Listener} on a {@link OnceSignal}. A slot only
 * weakly references the signal that owns it.
 */
public final class Slot {

	private static final Object[] NO_PARAMS = new Object[0];
	private static final AtomicLong IDS = new AtomicLong();
	private static final VarHandle FIRED;

	static {
		try {
			FIRED = MethodHandles.lookup().findVarHandle(Slot.class, "fired", boolean.class);
		} catch (ReflectiveOperationException exception) {
			throw new ExceptionInInitializerError(exception);
		}
	}

	private final long id;
	private final boolean once;
	private final int priority;
	private final WeakReference<OnceSignal> signal;

	@NotNull
	private volatile Listener listener;
	@NotNull
	private volatile Object[] params = NO_PARAMS;
	private volatile boolean enabled = true;
	@SuppressWarnings("unused")
	private volatile boolean fired = false;

	Slot(Listener listener, OnceSignal signal, boolean once) {
		this(listener, signal, once, 0);
	}

	Slot(Listener listener, OnceSignal signal, boolean once, int priority) {
		if (listener == null) {
			throw new InvalidListenerException("Invalid listener for signal " + signal.describe() + ", expected Listener");
		}
		this.id = IDS.incrementAndGet();
		this.listener = listener;
		this.signal = new WeakReference<>(signal);
		this.once = once;
		this.priority = priority;
	}

	public long getId() {
		return id;
	}

	public Listener getListener() {
		return listener;
	}

	public Slot setListener(Listener listener) {
		if (listener == null) {
			throw new InvalidListenerException("Invalid listener for slot " + id + ", expected Listener");
		}
		this.listener = listener;
		return this;
	}

	/**
	 * @return The parameters appended to the dispatch arguments every time this
	 *         slot is executed.
	 */
	public List<Object> getParams() {
		return unmodifiableList(asList(params.clone()));
	}

	/**
	 * Passing {@code null} clears the parameters.
	 */
	public Slot setParams(Object... params) {
		this.params = params == null ? NO_PARAMS : params.clone();
		return this;
	}

	public boolean isOnce() {
		return once;
	}

	/**
	 * Slots are always executed in the order they were registered; the priority is
	 * recorded but does not change that order.
	 */
	public int getPriority() {
		return priority;
	}

	public boolean isEnabled() {
		return enabled;
	}

	/**
	 * A disabled slot stays registered but is skipped by every dispatch until it
	 * is enabled again.
	 */
	public Slot setEnabled(boolean enabled) {
		this.enabled = enabled;
		return this;
	}

	/**
	 * Removes this slot from the signal it was registered on. Removing a slot
	 * more than once has no further effect.
	 */
	public Slot remove() {
		final var owner = signal.get();
		if (owner != null) {
			owner.remove(id);
		}
		return this;
	}

	void execute(Object[] arguments) {
		if (!enabled) {
			return;
		}
		if (once) {
			remove();
			if (!FIRED.compareAndSet(this, false, true)) {
				return;
			}
		}
		listener.onDispatch(merge(arguments, params));
	}

	private static Object[] merge(Object[] arguments, Object[] params) {
		final var merged = copyOf(arguments, arguments.length + params.length);
		arraycopy(params, 0, merged, arguments.length, params.length);
		return merged;
	}

	@Override
	public String toString() {
		return "Slot " + id + " (" + listener + (once ? ", once" : "") + (enabled ? "" : ", disabled") + ")";
	}

}
