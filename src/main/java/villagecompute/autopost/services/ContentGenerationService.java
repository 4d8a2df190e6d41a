/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.autopost.services;

import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.model.chat.ChatModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import villagecompute.autopost.api.types.NoteContentType;
import villagecompute.autopost.api.types.ReferenceAssetType;
import villagecompute.autopost.config.AiConfig;
import villagecompute.autopost.data.models.VisualStyle;
import villagecompute.autopost.exceptions.GenerationException;

/**
 * Writes the note copy (title, body, hashtags) and one draft image prompt per slot, and decides the single visual
 * style shared by every image of the note.
 *
 * <p>
 * The model is asked for a JSON object; markdown fences around it are tolerated. A response without a title or body,
 * or with unreadable JSON, fails the generation stage.
 */
@ApplicationScoped
public class ContentGenerationService {

    private static final Logger LOG = Logger.getLogger(ContentGenerationService.class);

    static final int TITLE_LIMIT = 20;

    private static final String SYSTEM_PROMPT = """
            你是一名小红书图文笔记作者，擅长写真实、有温度、容易引发共鸣的内容。
            根据给定的主题、风格和配图数量，写一篇完整笔记，只输出一个 JSON 对象：
            {
              "title": "标题，可带emoji，不超过20个字",
              "body": "正文，可带emoji，200到400字，分段，语气像真人分享",
              "hashtags": ["话题1", "话题2"],
              "image_prompts": ["第1张图的中文画面描述", "第2张图的中文画面描述"],
              "image_styles": "photo 或 poster"
            }

            规则：
            - image_prompts 的数量必须等于配图数量，每条描述一个具体画面
            - image_styles 只能填一个值，整篇笔记所有配图使用同一种风格：
              真实生活、探店、旅行、穿搭类用 photo；干货、清单、产品介绍、活动类用 poster
            - 话题标签不带 # 号，3到6个，覆盖核心关键词
            - 不要输出 JSON 以外的任何内容
            """;

    @Inject
    @Named(AiConfig.WRITER_MODEL)
    ChatModel chatModel;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Generates copy and draft prompts.
     *
     * @param topic
     *            note subject
     * @param style
     *            tone hint
     * @param imageCount
     *            number of image slots
     * @param references
     *            annotations of the post's reference groups
     * @return generated content with exactly one visual style
     * @throws GenerationException
     *             if the model call fails or the answer is unusable
     */
    public NoteContentType generate(String topic, String style, int imageCount, ReferenceAssetType references) {
        StringBuilder userPrompt = new StringBuilder().append("主题：").append(topic).append('\n').append("风格：")
                .append(style == null || style.isBlank() ? "自然分享" : style).append('\n').append("配图数量：")
                .append(imageCount).append('\n');
        if (references != null && !references.annotations().isEmpty()) {
            userPrompt.append("参考素材说明（请让文案和配图描述贴合这些素材）：\n");
            references.annotations().forEach(a -> userPrompt.append("- ").append(a).append('\n'));
        }

        String response;
        try {
            response = chatModel.chat(SYSTEM_PROMPT + "\n\n" + userPrompt);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Content generation call failed for topic=%s", topic);
            throw new GenerationException("Content model call failed: " + e.getMessage(), e);
        }
        NoteContentType content = parse(response);
        LOG.infof("Generated note '%s' (style=%s, prompts=%d, hashtags=%d)", content.title(), content.visualStyle(),
                content.imagePrompts().size(), content.hashtags().size());
        return content;
    }

    NoteContentType parse(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripMarkdown(response));
        } catch (JsonProcessingException e) {
            throw new GenerationException("Content model returned invalid JSON", e);
        }
        String title = root.path("title").asText("").trim();
        String body = root.path("body").asText("").trim();
        if (title.isEmpty() || body.isEmpty()) {
            throw new GenerationException("Content model returned no title or body");
        }
        if (title.codePointCount(0, title.length()) > TITLE_LIMIT) {
            title = title.substring(0, title.offsetByCodePoints(0, TITLE_LIMIT));
        }

        List<String> hashtags = new ArrayList<>();
        for (JsonNode tag : root.path("hashtags")) {
            String value = tag.asText("").trim();
            if (value.startsWith("#")) {
                value = value.substring(1);
            }
            if (!value.isEmpty()) {
                hashtags.add(value);
            }
        }
        List<String> prompts = new ArrayList<>();
        for (JsonNode prompt : root.path("image_prompts")) {
            String value = prompt.asText("").trim();
            if (!value.isEmpty()) {
                prompts.add(value);
            }
        }

        // single value, or a one-element list
        JsonNode styles = root.path("image_styles");
        String styleValue = styles.isArray() ? styles.path(0).asText("") : styles.asText("");
        return new NoteContentType(title, body, hashtags, prompts, VisualStyle.parse(styleValue));
    }

    static String stripMarkdown(String response) {
        String json = response == null ? "" : response.trim();
        if (json.startsWith("```json")) {
            json = json.substring(7);
        } else if (json.startsWith("```")) {
            json = json.substring(3);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        return json.trim();
    }
}
