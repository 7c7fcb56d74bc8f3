package com.standcapacity.engine.slot;

/** Contiguous run of slots {@code [first, lastExclusive)}. */
public record SlotRange(int first, int lastExclusive) {
  public SlotRange {
    if (lastExclusive <= first) {
      throw new IllegalArgumentException("empty slot range " + first + ".." + lastExclusive);
    }
  }

  public int size() {
    return lastExclusive - first;
  }

  public boolean contains(int slotIndex) {
    return slotIndex >= first && slotIndex < lastExclusive;
  }
}
