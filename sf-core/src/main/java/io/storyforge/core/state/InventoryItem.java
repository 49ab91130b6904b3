package io.storyforge.core.state;

import java.util.Map;

/** A positive holding of one item. Zero or negative quantities are never represented. */
public record InventoryItem(int quantity, Map<String, Object> attributes) {
    public InventoryItem {
        if (quantity <= 0) throw new IllegalArgumentException("quantity must be positive: " + quantity);
        attributes = Immutables.map(attributes);
    }

    public InventoryItem withQuantity(int newQuantity) {
        return new InventoryItem(newQuantity, attributes);
    }
}
