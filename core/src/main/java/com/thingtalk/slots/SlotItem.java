package com.thingtalk.slots;

/**
 * An item produced by slot iteration: either a fillable value position
 * ({@link AbstractSlot}) or a device selector that may still need a device
 * to be chosen.
 */
public interface SlotItem {
}
