package com.leaprnd.signal4j;

import java.util.function.Consumer;

enum EmptySlotList implements SlotList {

	EMPTY_SLOT_LIST;

	public static SlotList emptySlotList() {
		return EMPTY_SLOT_LIST;
	}

	@Override
	public SlotList with(Slot slot) {
		return new NonEmptySlotList(slot);
	}

	@Override
	public SlotList without(long id) {
		return this;
	}

	@Override
	public int size() {
		return 0;
	}

	@Override
	public boolean isEmpty() {
		return true;
	}

	@Override
	public void forEach(Consumer<? super Slot> action) {}

}
