package villagecompute.autopost.services;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.autopost.api.types.ReferenceAssetType;
import villagecompute.autopost.data.models.ReferenceImageGroup;

/**
 * Collects annotations and image URLs from a post's reference groups. Unknown group ids are ignored.
 */
@ApplicationScoped
public class ReferenceAssetService {

    @Transactional
    public ReferenceAssetType collect(List<Long> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            return ReferenceAssetType.none();
        }
        List<String> annotations = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        for (ReferenceImageGroup group : ReferenceImageGroup.findByIds(groupIds)) {
            if (group.annotation != null && !group.annotation.isBlank()) {
                annotations.add("《" + group.name + "》" + group.annotation);
            }
            if (group.imageUrls != null) {
                urls.addAll(group.imageUrls);
            }
        }
        return new ReferenceAssetType(annotations, urls);
    }
}
