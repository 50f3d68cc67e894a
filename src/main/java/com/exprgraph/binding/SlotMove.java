package com.exprgraph.binding;

/**
 * A binding that survived an edit but now lives at a different input slot.
 * Slot numbers are node input indices (binding index + 1).
 */
public record SlotMove(String name, int fromSlot, int toSlot) {
}
