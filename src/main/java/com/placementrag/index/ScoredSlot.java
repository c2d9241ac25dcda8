package com.placementrag.index;

public record ScoredSlot(int slot, float score) {
}
