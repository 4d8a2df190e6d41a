package villagecompute.autopost.api.types;

import java.util.List;

/**
 * Steering material collected from a post's reference image groups.
 *
 * @param annotations
 *            free-text notes shown to the content generator
 * @param imageUrls
 *            reference image URLs passed to the image API
 */
public record ReferenceAssetType(List<String> annotations, List<String> imageUrls) {

    public static ReferenceAssetType none() {
        return new ReferenceAssetType(List.of(), List.of());
    }

    public boolean isEmpty() {
        return annotations.isEmpty() && imageUrls.isEmpty();
    }
}
