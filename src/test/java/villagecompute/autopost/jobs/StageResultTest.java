package villagecompute.autopost.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import villagecompute.autopost.exceptions.GenerationException;

class StageResultTest {

    @Test
    void testThen_chainsValues() {
        StageResult<Integer> result = StageResult.run(PipelineStage.CONTENT_GENERATION, () -> "咖啡")
                .then(PipelineStage.PROMPT_GENERATION, String::length);

        assertTrue(result.isOk());
        assertEquals(2, result.value());
    }

    @Test
    void testThen_firstFailureIsKept() {
        GenerationException boom = new GenerationException("status 500");
        AtomicBoolean laterRan = new AtomicBoolean();

        StageResult<String> result = StageResult.<String>run(PipelineStage.IMAGE_GENERATION, () -> {
            throw boom;
        }).then(PipelineStage.PUBLISH, value -> {
            laterRan.set(true);
            return value;
        });

        assertFalse(result.isOk());
        assertFalse(laterRan.get());
        assertEquals(PipelineStage.IMAGE_GENERATION, result.failedStage());
        assertSame(boom, result.cause());
        assertThrows(IllegalStateException.class, result::value);
    }

    @Test
    void testFlatThen_passesNestedFailure() {
        IllegalStateException cause = new IllegalStateException("disk full");

        StageResult<String> result = StageResult.ok(1)
                .flatThen(v -> StageResult.failed(PipelineStage.ASSET_RETRIEVAL, cause));

        assertEquals(PipelineStage.ASSET_RETRIEVAL, result.failedStage());
        assertEquals("asset-retrieval", result.failedStage().getCode());
    }
}
