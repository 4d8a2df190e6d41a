package villagecompute.autopost.exceptions;

import java.util.List;

/**
 * Image synthesis finished with at least one empty slot. A partial image set is never published.
 */
public class IncompleteAssetSetException extends RuntimeException {

    private final List<Integer> emptySlots;

    public IncompleteAssetSetException(List<Integer> emptySlots, int expected) {
        super(String.format("%d of %d images missing (slots %s)", emptySlots.size(), expected, emptySlots));
        this.emptySlots = List.copyOf(emptySlots);
    }

    public List<Integer> getEmptySlots() {
        return emptySlots;
    }
}
