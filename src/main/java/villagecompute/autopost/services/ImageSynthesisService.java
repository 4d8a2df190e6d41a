package villagecompute.autopost.services;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import villagecompute.autopost.api.types.GeneratedImageType;
import villagecompute.autopost.config.ExecutorConfig;
import villagecompute.autopost.data.models.AspectRatio;
import villagecompute.autopost.data.models.VisualStyle;
import villagecompute.autopost.exceptions.IncompleteAssetSetException;
import villagecompute.autopost.integration.ai.ImageGenerationClient;

/**
 * Generates every image of a post under the post's visual style.
 *
 * <p>
 * <b>Poster:</b> strictly sequential. The first successful image is added to the reference list for every later call
 * so the set looks like one series. A failed call aborts the stage.
 *
 * <p>
 * <b>Photo:</b> all calls are issued at once on the image pool. A failed call leaves an empty slot instead of
 * cancelling the others.
 *
 * <p>
 * Either way the result is checked before returning: any empty slot throws {@link IncompleteAssetSetException}, so a
 * partial set never reaches download or publish.
 */
@ApplicationScoped
public class ImageSynthesisService {

    private static final Logger LOG = Logger.getLogger(ImageSynthesisService.class);

    @Inject
    ImageGenerationClient imageClient;

    @Inject
    @Named(ExecutorConfig.IMAGES)
    ExecutorService imageExecutor;

    /**
     * @param prompts
     *            resolved prompts, one per slot
     * @param style
     *            unified style of the post
     * @param ratio
     *            output ratio
     * @param referenceUrls
     *            reference images from the post's reference groups
     * @return one non-empty image per prompt, in slot order
     */
    public List<GeneratedImageType> synthesize(List<String> prompts, VisualStyle style, AspectRatio ratio,
            List<String> referenceUrls) {
        List<String> decorated = prompts.stream().map(style::decorate).toList();
        List<GeneratedImageType> images = style.requiresContinuity()
                ? sequential(decorated, ratio, referenceUrls)
                : concurrent(decorated, ratio, referenceUrls);

        List<Integer> emptySlots = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            if (images.get(i).isEmpty()) {
                emptySlots.add(i + 1);
            }
        }
        if (!emptySlots.isEmpty()) {
            throw new IncompleteAssetSetException(emptySlots, images.size());
        }
        return images;
    }

    private List<GeneratedImageType> sequential(List<String> prompts, AspectRatio ratio, List<String> references) {
        List<String> styleReferences = new ArrayList<>(references == null ? List.of() : references);
        List<GeneratedImageType> images = new ArrayList<>(prompts.size());
        boolean seeded = false;
        for (int i = 0; i < prompts.size(); i++) {
            LOG.infof("Poster image %d/%d", i + 1, prompts.size());
            GeneratedImageType image = imageClient.generate(prompts.get(i), ratio, List.copyOf(styleReferences));
            images.add(image);
            if (!seeded && !image.isEmpty()) {
                styleReferences.add(image.asReference());
                seeded = true;
            }
        }
        return images;
    }

    private List<GeneratedImageType> concurrent(List<String> prompts, AspectRatio ratio, List<String> references) {
        List<String> refs = references == null ? List.of() : List.copyOf(references);
        List<CompletableFuture<GeneratedImageType>> futures = new ArrayList<>(prompts.size());
        for (int i = 0; i < prompts.size(); i++) {
            int slot = i + 1;
            String prompt = prompts.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> imageClient.generate(prompt, ratio, refs), imageExecutor)
                    .exceptionally(e -> {
                        LOG.errorf(e, "Photo image %d failed, slot left empty", slot);
                        return GeneratedImageType.empty(prompt);
                    }));
        }
        List<GeneratedImageType> images = new ArrayList<>(futures.size());
        for (CompletableFuture<GeneratedImageType> future : futures) {
            images.add(future.join());
        }
        return images;
    }
}
