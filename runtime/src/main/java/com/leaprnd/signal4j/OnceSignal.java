package com.leaprnd.signal4j;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.List;

import static com.leaprnd.signal4j.EmptySlotList.emptySlotList;
import static java.lang.String.format;
import static java.util.Arrays.stream;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * A signal whose listeners are each executed at most once: every slot is
 * removed just before its listener is invoked.
 *
 * <p>
 * When value classes are declared, {@link #dispatch(Object...)} requires one
 * argument per value class and checks every argument before any listener runs.
 * Listeners are executed synchronously, in registration order, against the
 * slots registered when the dispatch began; slots added or removed by a
 * listener take effect from the next dispatch onwards.
 */
public class OnceSignal {

	private static final VarHandle SLOTS_UPDATER;

	static {
		try {
			SLOTS_UPDATER = MethodHandles.lookup().findVarHandle(OnceSignal.class, "slots", SlotList.class);
		} catch (ReflectiveOperationException exception) {
			throw new ExceptionInInitializerError(exception);
		}
	}

	private static final Logger LOGGER = getLogger(OnceSignal.class);

	@NotNull
	private volatile SlotList slots = emptySlotList();
	@NotNull
	private volatile List<ValueClass> valueClasses;

	public OnceSignal(ValueClass ... valueClasses) {
		this.valueClasses = List.of(valueClasses);
	}

	public OnceSignal(List<? extends ValueClass> valueClasses) {
		this.valueClasses = List.copyOf(valueClasses);
	}

	public static OnceSignal newOnceOnlySignal() {
		return new OnceSignal();
	}

	public static OnceSignal newOnceOnlySignal(ValueClass ... valueClasses) {
		return new OnceSignal(valueClasses);
	}

	public static OnceSignal newOnceOnlySignal(Class<?> ... valueClasses) {
		return new OnceSignal(toValueClasses(valueClasses));
	}

	static List<ValueClass> toValueClasses(Class<?> ... types) {
		return stream(types).map(ValueClass::of).toList();
	}

	public final List<ValueClass> getValueClasses() {
		return valueClasses;
	}

	/**
	 * Replaces the value classes checked by subsequent dispatches. Passing no value
	 * classes turns validation off.
	 */
	public OnceSignal setValueClasses(ValueClass ... valueClasses) {
		this.valueClasses = List.of(valueClasses);
		return this;
	}

	/**
	 * @return The number of registered slots, including disabled ones.
	 */
	public final int getNumberOfListeners() {
		return slots.size();
	}

	/**
	 * Registers a listener that will be executed by the next dispatch only.
	 *
	 * @throws InvalidListenerException If the listener is {@code null}.
	 */
	public final Slot addOnce(Listener listener) {
		return register(listener, true);
	}

	protected final Slot register(Listener listener, boolean once) {
		final var slot = new Slot(listener, this, once);
		while (true) {
			final var oldSlots = slots;
			if (SLOTS_UPDATER.compareAndSet(this, oldSlots, oldSlots.with(slot))) {
				LOGGER.debug("Registered {} on {}", slot, this);
				return slot;
			}
		}
	}

	/**
	 * Removes the slot with the given id. Unknown ids are ignored.
	 */
	public OnceSignal remove(long id) {
		while (true) {
			final var oldSlots = slots;
			final var newSlots = oldSlots.without(id);
			if (newSlots == oldSlots) {
				return this;
			}
			if (SLOTS_UPDATER.compareAndSet(this, oldSlots, newSlots)) {
				LOGGER.debug("Removed slot {} from {}", id, this);
				return this;
			}
		}
	}

	public OnceSignal removeAll() {
		final var oldSlots = (SlotList) SLOTS_UPDATER.getAndSet(this, emptySlotList());
		if (!oldSlots.isEmpty()) {
			LOGGER.debug("Removed all {} slot(s) from {}", oldSlots.size(), this);
		}
		return this;
	}

	/**
	 * Validates the arguments against the value classes of this signal and then
	 * executes every enabled slot, in registration order, with the arguments
	 * followed by the slot's bound parameters.
	 *
	 * @throws ArityMismatchException If value classes are declared and the number
	 *                                of arguments differs from them.
	 * @throws TypeMismatchException  If an argument does not satisfy the value
	 *                                class at its position.
	 */
	public OnceSignal dispatch(Object ... arguments) {
		requireNonNull(arguments);
		validate(arguments);
		final var snapshot = slots;
		LOGGER.trace("Dispatching {} argument(s) to {} slot(s) of {}", arguments.length, snapshot.size(), this);
		snapshot.forEach(slot -> execute(slot, arguments));
		return this;
	}

	private void validate(Object[] arguments) {
		final var valueClasses = this.valueClasses;
		final var expected = valueClasses.size();
		if (expected == 0) {
			return;
		}
		if (arguments.length != expected) {
			throw new ArityMismatchException(expected, arguments.length);
		}
		for (int position = 0; position < expected; position ++) {
			valueClasses.get(position).validate(position, arguments[position]);
		}
	}

	private void execute(Slot slot, Object[] arguments) {
		try {
			slot.execute(arguments);
		} catch (Throwable throwable) {
			LOGGER.debug("{} threw while {} was dispatching; aborting the dispatch", slot, this, throwable);
			throw throwable;
		}
	}

	public String describe() {
		return format("Signal class: %s, number of listeners: %d", getClass().getSimpleName(), getNumberOfListeners());
	}

	@Override
	public String toString() {
		return describe();
	}

}
