/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.autopost.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.autopost.api.types.GeneratedImageType;
import villagecompute.autopost.config.ExecutorConfig;
import villagecompute.autopost.data.models.AspectRatio;
import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.data.models.VisualStyle;
import villagecompute.autopost.exceptions.GenerationException;
import villagecompute.autopost.exceptions.IncompleteAssetSetException;
import villagecompute.autopost.integration.ai.ImageGenerationClient;

/**
 * Unit tests for {@link ImageSynthesisService}.
 */
class ImageSynthesisServiceTest {

    @Mock
    ImageGenerationClient imageClient;

    private ExecutorService executor;
    private ImageSynthesisService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        executor = Executors.newFixedThreadPool(4);
        service = new ImageSynthesisService();
        service.imageClient = imageClient;
        service.imageExecutor = executor;
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testSynthesize_posterFeedsFirstImageBack() {
        when(imageClient.generate(anyString(), any(), anyList())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            return new GeneratedImageType(prompt, "https://img/" + prompt.length(), null);
        });

        List<GeneratedImageType> images = service.synthesize(List.of("封面", "清单"), VisualStyle.POSTER,
                AspectRatio.PORTRAIT_3_4, List.of("https://ref/1"));

        assertEquals(2, images.size());
        String first = images.get(0).url();
        InOrder order = inOrder(imageClient);
        order.verify(imageClient).generate(eq("海报设计风格，画面无水印，封面"), eq(AspectRatio.PORTRAIT_3_4),
                eq(List.of("https://ref/1")));
        order.verify(imageClient).generate(eq("海报设计风格，画面无水印，清单"), eq(AspectRatio.PORTRAIT_3_4),
                eq(List.of("https://ref/1", first)));
    }

    @Test
    void testSynthesize_posterFailureAborts() {
        when(imageClient.generate(anyString(), any(), anyList())).thenThrow(new GenerationException("status 500"));

        assertThrows(GenerationException.class,
                () -> service.synthesize(List.of("a", "b"), VisualStyle.POSTER, AspectRatio.SQUARE, List.of()));
    }

    @Test
    void testSynthesize_photoRunsConcurrently() {
        CountDownLatch allStarted = new CountDownLatch(3);
        when(imageClient.generate(anyString(), any(), anyList())).thenAnswer(invocation -> {
            allStarted.countDown();
            // every call must be in flight before any returns
            if (!allStarted.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("calls were not concurrent");
            }
            return new GeneratedImageType(invocation.getArgument(0), "https://img/ok", null);
        });

        List<GeneratedImageType> images = service.synthesize(List.of("一", "二", "三"), VisualStyle.PHOTO,
                AspectRatio.SQUARE, null);

        assertEquals(3, images.size());
        assertTrue(images.get(2).prompt().endsWith("三"));
    }

    @Test
    void testSynthesize_twoJobsDoNotQueueBehindEachOther() throws Exception {
        int jobs = 2;
        ExecutorService pool = Executors.newFixedThreadPool(ExecutorConfig.imagePoolSize(jobs));
        ExecutorService pipeline = Executors.newFixedThreadPool(jobs);
        service.imageExecutor = pool;
        CountDownLatch allStarted = new CountDownLatch(jobs * ScheduledPost.MAX_IMAGES);
        when(imageClient.generate(anyString(), any(), anyList())).thenAnswer(invocation -> {
            allStarted.countDown();
            if (!allStarted.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("image calls queued behind another job");
            }
            return new GeneratedImageType(invocation.getArgument(0), "https://img/ok", null);
        });
        List<String> prompts = List.of("一", "二", "三", "四");

        try {
            Future<List<GeneratedImageType>> first = pipeline.submit(
                    () -> service.synthesize(prompts, VisualStyle.PHOTO, AspectRatio.SQUARE, List.of()));
            Future<List<GeneratedImageType>> second = pipeline.submit(
                    () -> service.synthesize(prompts, VisualStyle.PHOTO, AspectRatio.SQUARE, List.of()));

            assertEquals(4, first.get(10, TimeUnit.SECONDS).size());
            assertEquals(4, second.get(10, TimeUnit.SECONDS).size());
            assertEquals(0, allStarted.getCount());
        } finally {
            pipeline.shutdownNow();
            pool.shutdownNow();
        }
    }

    @Test
    void testSynthesize_photoFailedSlotReported() {
        when(imageClient.generate(anyString(), any(), anyList())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.endsWith("二")) {
                throw new GenerationException("status 500");
            }
            return new GeneratedImageType(prompt, "https://img/ok", null);
        });

        IncompleteAssetSetException e = assertThrows(IncompleteAssetSetException.class,
                () -> service.synthesize(List.of("一", "二", "三"), VisualStyle.PHOTO, AspectRatio.SQUARE, List.of()));
        assertEquals(List.of(2), e.getEmptySlots());
    }

    @Test
    void testSynthesize_emptyResponseCountsAsMissing() {
        when(imageClient.generate(anyString(), any(), anyList()))
                .thenAnswer(invocation -> GeneratedImageType.empty(invocation.getArgument(0)));

        IncompleteAssetSetException e = assertThrows(IncompleteAssetSetException.class,
                () -> service.synthesize(List.of("一"), VisualStyle.POSTER, AspectRatio.SQUARE, List.of()));
        assertEquals(List.of(1), e.getEmptySlots());
    }
}
