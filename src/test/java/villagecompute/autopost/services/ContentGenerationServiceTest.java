/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.autopost.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.model.chat.ChatModel;
import villagecompute.autopost.api.types.NoteContentType;
import villagecompute.autopost.api.types.ReferenceAssetType;
import villagecompute.autopost.data.models.VisualStyle;
import villagecompute.autopost.exceptions.GenerationException;

/**
 * Unit tests for {@link ContentGenerationService}.
 */
class ContentGenerationServiceTest {

    @Mock
    ChatModel chatModel;

    private ContentGenerationService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new ContentGenerationService();
        service.chatModel = chatModel;
        service.objectMapper = new ObjectMapper();
    }

    @Test
    void testGenerate_fencedJson() {
        when(chatModel.chat(anyString())).thenReturn("""
                ```json
                {"title": "周末咖啡探店☕", "body": "藏在巷子里的小店", "hashtags": ["#咖啡", "探店", ""],
                 "image_prompts": ["拿铁拉花特写", "店内角落"], "image_styles": "photo"}
                ```""");

        NoteContentType content = service.generate("咖啡探店", "生活方式", 2, ReferenceAssetType.none());

        assertEquals("周末咖啡探店☕", content.title());
        assertEquals(List.of("咖啡", "探店"), content.hashtags());
        assertEquals(List.of("拿铁拉花特写", "店内角落"), content.imagePrompts());
        assertEquals(VisualStyle.PHOTO, content.visualStyle());
        assertEquals("藏在巷子里的小店\n\n#咖啡 #探店", content.description());
    }

    @Test
    void testParse_styleListAndTitleLimit() {
        NoteContentType content = service.parse("""
                {"title": "一二三四五六七八九十一二三四五六七八九十多余", "body": "正文",
                 "image_styles": ["Poster"]}""");

        assertEquals(ContentGenerationService.TITLE_LIMIT, content.title().length());
        assertEquals(VisualStyle.POSTER, content.visualStyle());
        assertTrue(content.hashtags().isEmpty());
    }

    @Test
    void testParse_missingBodyFails() {
        assertThrows(GenerationException.class, () -> service.parse("{\"title\": \"只有标题\"}"));
    }

    @Test
    void testParse_invalidJsonFails() {
        assertThrows(GenerationException.class, () -> service.parse("抱歉，我无法完成这个请求"));
    }

    @Test
    void testGenerate_modelFailureWrapped() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("connection reset"));

        GenerationException e = assertThrows(GenerationException.class,
                () -> service.generate("咖啡探店", null, 1, null));
        assertTrue(e.getMessage().contains("connection reset"));
    }

    @Test
    void testStripMarkdown() {
        assertEquals("{}", ContentGenerationService.stripMarkdown("```json\n{}\n```"));
        assertEquals("{}", ContentGenerationService.stripMarkdown("```{}```"));
        assertEquals("{}", ContentGenerationService.stripMarkdown("  {}  "));
        assertEquals("", ContentGenerationService.stripMarkdown(null));
    }
}
