package com.leaprnd.signal4j;

import java.util.function.Consumer;

import static com.leaprnd.signal4j.EmptySlotList.emptySlotList;
import static java.lang.System.arraycopy;
import static java.util.Arrays.copyOf;

final class NonEmptySlotList implements SlotList {

	private final Slot[] slots;

	NonEmptySlotList(Slot ... slots) {
		this.slots = slots;
	}

	@Override
	public NonEmptySlotList with(Slot slot) {
		final var length = slots.length;
		final var newSlots = copyOf(slots, length + 1);
		newSlots[length] = slot;
		return new NonEmptySlotList(newSlots);
	}

	@Override
	public SlotList without(long id) {
		final var index = indexOf(id);
		if (index < 0) {
			return this;
		}
		final var newLength = slots.length - 1;
		if (newLength == 0) {
			return emptySlotList();
		}
		final var newSlots = new Slot[newLength];
		if (index > 0) {
			arraycopy(slots, 0, newSlots, 0, index);
		}
		if (index != newLength) {
			arraycopy(slots, index + 1, newSlots, index, newLength - index);
		}
		return new NonEmptySlotList(newSlots);
	}

	@Override
	public int size() {
		return slots.length;
	}

	@Override
	public boolean isEmpty() {
		return false;
	}

	@Override
	public void forEach(Consumer<? super Slot> action) {
		for (final var slot : slots) {
			action.accept(slot);
		}
	}

	private int indexOf(long id) {
		for (int index = 0; index < slots.length; index ++) {
			if (slots[index].getId() == id) {
				return index;
			}
		}
		return -1;
	}

}
