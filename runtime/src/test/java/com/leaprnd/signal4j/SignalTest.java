package com.leaprnd.signal4j;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.leaprnd.signal4j.PrimitiveValueClass.INTEGER;
import static com.leaprnd.signal4j.PrimitiveValueClass.STRING;
import static com.leaprnd.signal4j.Signal.newSignal;
import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SignalTest {

	@Test
	public void testListenersAreExecutedInRegistrationOrder() {
		final var signal = newSignal();
		final var log = new ArrayList<String>();
		for (final var name : List.of("first", "second", "third", "fourth")) {
			signal.add(new RecordingListener(name, log));
		}
		signal.dispatch();
		signal.dispatch();
		assertEquals(List.of("first", "second", "third", "fourth", "first", "second", "third", "fourth"), log);
	}

	@Test
	public void testDispatchAppendsBoundParamsToArguments() {
		final var signal = newSignal(INTEGER, STRING);
		final var plain = new RecordingListener();
		final var bound = new RecordingListener();
		signal.add(plain);
		signal.add(bound).setParams("x", null);
		assertSame(signal, signal.dispatch(1, "a"));
		assertEquals(List.of(1, "a"), plain.lastCall());
		assertEquals(asList(1, "a", "x", null), bound.lastCall());
	}

	@Test
	public void testTypeMismatchInvokesNoListener() {
		final var signal = newSignal(INTEGER, STRING);
		final var listener = new RecordingListener();
		signal.add(listener);
		final var exception = assertThrows(TypeMismatchException.class, () -> signal.dispatch(1, 2));
		assertEquals(STRING, exception.getExpected());
		assertEquals(Integer.class.getName(), exception.getActual());
		assertEquals(1, exception.getPosition());
		assertEquals(0, listener.numberOfCalls());
	}

	@Test
	public void testArityMismatchInvokesNoListener() {
		final var signal = newSignal(INTEGER, STRING);
		final var listener = new RecordingListener();
		signal.add(listener);
		final var exception = assertThrows(ArityMismatchException.class, () -> signal.dispatch(1));
		assertEquals(2, exception.getExpected());
		assertEquals(1, exception.getActual());
		assertEquals("Value class mismatch, expected 2 got 1", exception.getMessage());
		assertEquals(0, listener.numberOfCalls());
	}

	@Test
	public void testFirstInvalidArgumentAbortsValidation() {
		final var signal = newSignal(STRING, STRING);
		final var exception = assertThrows(TypeMismatchException.class, () -> signal.dispatch(1, 2));
		assertEquals(0, exception.getPosition());
	}

	@Test
	public void testWithoutValueClassesAnyArgumentsAreAccepted() {
		final var signal = newSignal();
		final var listener = new RecordingListener();
		signal.add(listener);
		signal.dispatch();
		signal.dispatch(1, "two", 3.0, null);
		assertEquals(2, listener.numberOfCalls());
		assertEquals(4, listener.lastCall().size());
	}

	@Test
	public void testDisabledSlotIsSkippedButStaysRegistered() {
		final var signal = newSignal();
		final var listener = new RecordingListener();
		final var slot = signal.add(listener);
		assertSame(slot, slot.setEnabled(false));
		signal.dispatch();
		assertEquals(0, listener.numberOfCalls());
		assertEquals(1, signal.getNumberOfListeners());
		slot.setEnabled(true);
		signal.dispatch();
		assertEquals(1, listener.numberOfCalls());
	}

	@Test
	public void testAddOnceOnRepeatableSignal() {
		final var signal = newSignal();
		final var once = new RecordingListener();
		final var always = new RecordingListener();
		signal.addOnce(once);
		signal.add(always);
		assertEquals(2, signal.getNumberOfListeners());
		signal.dispatch().dispatch().dispatch();
		assertEquals(1, once.numberOfCalls());
		assertEquals(3, always.numberOfCalls());
		assertEquals(1, signal.getNumberOfListeners());
	}

	@Test
	public void testSelfRemovalDuringDispatchSkipsNoOtherSlot() {
		final var signal = newSignal();
		final var log = new ArrayList<String>();
		final var self = new AtomicReference<Slot>();
		signal.add(new RecordingListener("before", log));
		self.set(signal.add(arguments -> {
			log.add("self");
			self.get().remove();
		}));
		signal.add(new RecordingListener("after", log));
		signal.dispatch();
		assertEquals(List.of("before", "self", "after"), log);
		assertEquals(2, signal.getNumberOfListeners());
		signal.dispatch();
		assertEquals(List.of("before", "self", "after", "before", "after"), log);
	}

	@Test
	public void testMutationsDuringDispatchApplyToTheNextDispatch() {
		final var signal = newSignal();
		final var log = new ArrayList<String>();
		final var late = new RecordingListener("late", log);
		final var removed = new RecordingListener("removed", log);
		final var removedSlot = new AtomicReference<Slot>();
		signal.add(arguments -> {
			log.add("mutator");
			if (removedSlot.get() != null) {
				signal.remove(removedSlot.get().getId());
				removedSlot.set(null);
				signal.add(late);
			}
		});
		removedSlot.set(signal.add(removed));
		signal.dispatch();
		assertEquals(List.of("mutator", "removed"), log);
		log.clear();
		signal.dispatch();
		assertEquals(List.of("mutator", "late"), log);
	}

	@Test
	public void testRemoveAllDuringDispatchDoesNotShortenTheCurrentPass() {
		final var signal = newSignal();
		final var log = new ArrayList<String>();
		signal.add(arguments -> {
			log.add("clearing");
			signal.removeAll();
		});
		signal.add(new RecordingListener("still visited", log));
		signal.dispatch();
		assertEquals(List.of("clearing", "still visited"), log);
		assertEquals(0, signal.getNumberOfListeners());
	}

	@Test
	public void testReentrantDispatch() {
		final var signal = newSignal(INTEGER);
		final var log = new ArrayList<String>();
		signal.add(arguments -> {
			final var depth = (Integer) arguments[0];
			log.add("outer " + depth);
			if (depth == 0) {
				signal.dispatch(1);
			}
		});
		signal.addOnce(arguments -> log.add("once " + arguments[0]));
		signal.dispatch(0);
		assertEquals(List.of("outer 0", "outer 1", "once 1"), log);
		assertEquals(1, signal.getNumberOfListeners());
	}

	@Test
	public void testListenerExceptionAbortsDispatch() {
		final var signal = newSignal();
		final var failure = new IllegalStateException("listener failure");
		final var after = new RecordingListener();
		signal.add(arguments -> {
			throw failure;
		});
		signal.add(after);
		assertSame(failure, assertThrows(IllegalStateException.class, () -> signal.dispatch()));
		assertEquals(0, after.numberOfCalls());
		assertEquals(2, signal.getNumberOfListeners());
	}

	@Test
	public void testRemoveAllThenDispatch() {
		final var signal = newSignal();
		final var listener = new RecordingListener();
		signal.add(listener);
		signal.addOnce(listener);
		signal.removeAll().dispatch();
		assertEquals(0, listener.numberOfCalls());
		assertEquals(0, signal.getNumberOfListeners());
	}

	@Test
	public void testRemoveIsIdempotent() {
		final var signal = newSignal();
		final var kept = signal.add(new RecordingListener());
		final var slot = signal.add(new RecordingListener());
		signal.remove(slot.getId());
		signal.remove(slot.getId());
		slot.remove();
		signal.remove(Long.MAX_VALUE);
		assertEquals(1, signal.getNumberOfListeners());
		kept.remove();
		assertEquals(0, signal.getNumberOfListeners());
	}

	@Test
	public void testSameListenerCanBeRegisteredTwice() {
		final var signal = newSignal();
		final var listener = new RecordingListener();
		final var first = signal.add(listener);
		final var second = signal.add(listener);
		assertNotEquals(first.getId(), second.getId());
		signal.dispatch();
		assertEquals(2, listener.numberOfCalls());
		first.remove();
		signal.dispatch();
		assertEquals(3, listener.numberOfCalls());
	}

	@Test
	public void testNullListenerIsRejected() {
		final var signal = newSignal();
		final var exception = assertThrows(InvalidListenerException.class, () -> signal.add(null));
		assertTrue(exception.getMessage().contains("Signal class: Signal"));
		assertEquals(0, signal.getNumberOfListeners());
	}

	@Test
	public void testValueClassesCanBeReplaced() {
		final var signal = newSignal(Integer.class);
		final var calls = new AtomicInteger();
		signal.add(arguments -> calls.incrementAndGet());
		assertEquals(List.of(ValueClass.of(Integer.class)), signal.getValueClasses());
		assertThrows(TypeMismatchException.class, () -> signal.dispatch("one"));
		signal.setValueClasses(STRING).dispatch("one");
		signal.setValueClasses().dispatch(1, 2, 3);
		assertEquals(2, calls.get());
		assertTrue(signal.getValueClasses().isEmpty());
	}

	@Test
	public void testDescribe() {
		final var signal = newSignal();
		assertEquals("Signal class: Signal, number of listeners: 0", signal.describe());
		signal.add(arguments -> {});
		signal.addOnce(arguments -> {});
		assertEquals("Signal class: Signal, number of listeners: 2", signal.toString());
		assertFalse(signal.describe().isEmpty());
	}

}
