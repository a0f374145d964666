package com.leaprnd.signal4j;

import java.util.function.Consumer;

/**
 * An immutable, insertion-ordered sequence of {@link Slot}s. Every modification
 * returns a new list, so a list that is being iterated never changes.
 */
sealed interface SlotList permits EmptySlotList,NonEmptySlotList {
	SlotList with(Slot slot);
	SlotList without(long id);
	int size();
	boolean isEmpty();
	void forEach(Consumer<? super Slot> action);
}
