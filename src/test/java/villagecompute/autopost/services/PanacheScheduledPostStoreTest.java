package villagecompute.autopost.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import villagecompute.autopost.api.types.GeneratedImageType;
import villagecompute.autopost.api.types.NoteContentType;
import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.data.models.ScheduledPost.PostStatus;
import villagecompute.autopost.data.models.VisualStyle;
import villagecompute.autopost.services.ScheduledPostStore.PostFilter;
import villagecompute.autopost.testing.H2TestProfile;
import villagecompute.autopost.testing.InMemoryScheduledPostStore;

/**
 * Tests for {@link PanacheScheduledPostStore} against a real database.
 *
 * <p>
 * Every test uses its own account id so rows from other tests never match its filters.
 */
@QuarkusTest
@TestProfile(H2TestProfile.class)
class PanacheScheduledPostStoreTest {

    private static final Instant RUN_AT = Instant.parse("2030-01-01T02:00:00Z");

    @Inject
    PanacheScheduledPostStore store;

    @Test
    void testCreate_storesPendingWithTimestamps() {
        String account = newAccount();
        ScheduledPost post = InMemoryScheduledPostStore.pendingPost("秋日穿搭", 3, RUN_AT);
        post.accountId = account;
        post.referenceGroupIds = new ArrayList<>(List.of(7L, 9L));

        long id = store.create(post);

        ScheduledPost stored = store.get(id).orElseThrow();
        assertEquals(PostStatus.PENDING, stored.status);
        assertEquals(RUN_AT, stored.scheduledAt);
        assertEquals(List.of(7L, 9L), stored.referenceGroupIds);
        assertNotNull(stored.createdAt);
        assertEquals(stored.createdAt, stored.updatedAt);
    }

    @Test
    void testTransition_concurrentClaimHasOneWinner() throws Exception {
        long id = createPending(newAccount());
        ExecutorService threads = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> claims = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                claims.add(threads.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    return store.transition(id, PostStatus.PENDING, PostStatus.RUNNING, PostTransition.none());
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> claim : claims) {
                if (claim.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertEquals(PostStatus.RUNNING, store.get(id).orElseThrow().status);
        } finally {
            threads.shutdownNow();
        }
    }

    @Test
    void testTransition_wrongExpectedStatusReturnsFalse() {
        long id = createPending(newAccount());

        assertFalse(store.transition(id, PostStatus.RUNNING, PostStatus.DONE, PostTransition.none()));

        assertEquals(PostStatus.PENDING, store.get(id).orElseThrow().status);
    }

    @Test
    void testTransition_missingRowReturnsFalse() {
        assertFalse(store.transition(Long.MAX_VALUE, PostStatus.PENDING, PostStatus.RUNNING, PostTransition.none()));
    }

    @Test
    void testTransition_illegalTransitionRejected() {
        long id = createPending(newAccount());

        assertThrows(IllegalArgumentException.class,
                () -> store.transition(id, PostStatus.PENDING, PostStatus.DONE, PostTransition.none()));
    }

    @Test
    void testTransition_publishedFieldsStored() {
        long id = createPending(newAccount());
        NoteContentType content = new NoteContentType("标题", "正文", List.of("秋天", "穿搭"), List.of("封面"),
                VisualStyle.PHOTO);
        List<GeneratedImageType> images = List.of(new GeneratedImageType("封面", "https://img/1", null));

        assertTrue(store.transition(id, PostStatus.PENDING, PostStatus.RUNNING, PostTransition.none()));
        assertTrue(store.transition(id, PostStatus.RUNNING, PostStatus.DONE,
                PostTransition.published(content, images, "note-42")));

        ScheduledPost stored = store.get(id).orElseThrow();
        assertEquals(PostStatus.DONE, stored.status);
        assertEquals("标题", stored.resultTitle);
        assertEquals(List.of("秋天", "穿搭"), stored.resultHashtags);
        assertEquals("https://img/1", stored.resultImages.get(0).url());
        assertEquals("note-42", stored.noteId);
    }

    @Test
    void testRequeue_failedPostClearsErrorFields() {
        long id = createPending(newAccount());
        store.transition(id, PostStatus.PENDING, PostStatus.RUNNING, PostTransition.none());
        store.transition(id, PostStatus.RUNNING, PostStatus.FAILED,
                PostTransition.failed("image-generation", "incomplete", "slot 2 empty"));
        Instant retryAt = RUN_AT.plus(1, ChronoUnit.DAYS);

        assertTrue(store.requeue(id, retryAt));

        ScheduledPost stored = store.get(id).orElseThrow();
        assertEquals(PostStatus.PENDING, stored.status);
        assertEquals(retryAt, stored.scheduledAt);
        assertNull(stored.error);
        assertNull(stored.failedStage);
        assertNull(stored.errorKind);
    }

    @Test
    void testRequeue_pendingPostRejected() {
        long id = createPending(newAccount());

        assertFalse(store.requeue(id, RUN_AT));
    }

    @Test
    void testList_filtersByStatusAndAccount() {
        String account = newAccount();
        String other = newAccount();
        long first = createPending(account, RUN_AT.plus(2, ChronoUnit.HOURS));
        long second = createPending(account, RUN_AT);
        long running = createPending(account, RUN_AT.plus(1, ChronoUnit.HOURS));
        store.transition(running, PostStatus.PENDING, PostStatus.RUNNING, PostTransition.none());
        long foreign = createPending(other, RUN_AT);

        List<ScheduledPost> pending = store.list(new PostFilter(PostStatus.PENDING, account, null));
        assertEquals(List.of(second, first), ids(pending));

        List<ScheduledPost> all = store.list(new PostFilter(null, account, null));
        assertEquals(List.of(second, running, first), ids(all));

        List<ScheduledPost> runningOnly = store.list(PostFilter.byStatus(PostStatus.RUNNING));
        assertTrue(ids(runningOnly).contains(running));
        assertFalse(ids(runningOnly).contains(foreign));
        assertTrue(runningOnly.stream().allMatch(post -> post.status == PostStatus.RUNNING));
    }

    @Test
    void testDelete_removesRow() {
        long id = createPending(newAccount());

        assertTrue(store.delete(id));
        assertTrue(store.get(id).isEmpty());
        assertFalse(store.delete(id));
    }

    private long createPending(String account) {
        return createPending(account, RUN_AT);
    }

    private long createPending(String account, Instant scheduledAt) {
        ScheduledPost post = InMemoryScheduledPostStore.pendingPost("咖啡探店", 2, scheduledAt);
        post.accountId = account;
        return store.create(post);
    }

    private static String newAccount() {
        return "acct-" + UUID.randomUUID();
    }

    private static List<Long> ids(List<ScheduledPost> posts) {
        return posts.stream().map(post -> post.id).toList();
    }
}
