package villagecompute.autopost.services;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.langchain4j.model.chat.ChatModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import villagecompute.autopost.api.types.NoteContentType;
import villagecompute.autopost.api.types.ReferenceAssetType;
import villagecompute.autopost.config.AiConfig;
import villagecompute.autopost.services.PromptTemplateLibrary.PromptTemplate;

/**
 * Turns draft prompts into final image prompts by letting the model pick a template from the note's style family and
 * fill in its scene.
 *
 * <p>
 * Never fails a post: any slot the model leaves empty, answers with an unknown template, or loses to a failed call gets
 * a fallback prompt (the draft prompt for that slot, else a generic topic phrase).
 */
@ApplicationScoped
public class PromptResolutionService {

    private static final Logger LOG = Logger.getLogger(PromptResolutionService.class);

    private static final String SYSTEM_PROMPT = """
            你负责为小红书图文笔记编写配图提示词。
            1. 按每张图在笔记中的作用，从下面的模板里各选一个，尽量不要重复
            2. 把模板中的 {scene_detail} 换成和主题紧密相关的具体画面，30到50个汉字，不能出现英文或拼音
            3. final_prompt 是填好后的完整提示词

            可用模板（JSON）：
            %s

            只输出 JSON：
            {"selections": [{"template_key": "模板key", "scene_detail": "画面描述", "final_prompt": "完整提示词"}]}
            """;

    @Inject
    @Named(AiConfig.WRITER_MODEL)
    ChatModel chatModel;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    PromptTemplateLibrary templateLibrary;

    /**
     * Resolves one final prompt per slot.
     *
     * @return exactly {@code imageCount} non-blank prompts
     */
    public List<String> resolve(String topic, String style, NoteContentType content, int imageCount,
            ReferenceAssetType references) {
        List<PromptTemplate> templates = templateLibrary.forStyle(content.visualStyle());
        JsonNode selections;
        try {
            String response = chatModel.chat(String.format(SYSTEM_PROMPT, templatesJson(templates)) + "\n\n"
                    + userPrompt(topic, style, content, imageCount, references));
            selections = objectMapper.readTree(ContentGenerationService.stripMarkdown(response)).path("selections");
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.warnf("Prompt model failed, every slot falls back to draft prompts: %s", e.getMessage());
            selections = objectMapper.createArrayNode();
        }

        List<String> prompts = new ArrayList<>(imageCount);
        for (int slot = 0; slot < imageCount; slot++) {
            String prompt = fromSelection(selections.path(slot), content);
            if (prompt == null) {
                prompt = fallback(topic, content, slot);
                LOG.warnf("Image slot %d has no usable template selection, using fallback prompt", slot + 1);
            }
            prompts.add(prompt);
        }
        LOG.infof("Resolved %d image prompts (style=%s)", prompts.size(), content.visualStyle());
        return prompts;
    }

    private String fromSelection(JsonNode selection, NoteContentType content) {
        if (!selection.isObject()) {
            return null;
        }
        String finalPrompt = selection.path("final_prompt").asText("").trim();
        var template = templateLibrary.find(selection.path("template_key").asText(null), content.visualStyle());
        if (template.isEmpty()) {
            return null;
        }
        if (!finalPrompt.isEmpty() && !finalPrompt.contains(PromptTemplateLibrary.SCENE_PLACEHOLDER)) {
            return finalPrompt;
        }
        String scene = selection.path("scene_detail").asText("").trim();
        return scene.isEmpty() ? null : template.get().fill(scene);
    }

    /**
     * Deterministic fallback for one slot.
     */
    static String fallback(String topic, NoteContentType content, int slot) {
        List<String> drafts = content.imagePrompts();
        if (drafts != null && slot < drafts.size() && !drafts.get(slot).isBlank()) {
            return drafts.get(slot);
        }
        return topic + "相关场景，真实生活质感";
    }

    private String templatesJson(List<PromptTemplate> templates) {
        ObjectNode root = objectMapper.createObjectNode();
        for (PromptTemplate template : templates) {
            ObjectNode node = root.putObject(template.key());
            node.put("name", template.name());
            node.put("description", template.description());
            node.put("template", template.template());
        }
        return root.toPrettyString();
    }

    private String userPrompt(String topic, String style, NoteContentType content, int imageCount,
            ReferenceAssetType references) {
        String body = content.body();
        StringBuilder sb = new StringBuilder().append("笔记主题：").append(topic).append('\n').append("内容风格：")
                .append(style).append('\n').append("笔记标题：").append(content.title()).append('\n')
                .append("正文摘要：").append(body.length() > 100 ? body.substring(0, 100) + "..." : body).append('\n')
                .append("话题：").append(content.hashtags().stream().limit(5).collect(Collectors.joining("，")))
                .append('\n').append("配图数量：").append(imageCount).append('\n').append("统一视觉风格：")
                .append(content.visualStyle().getCode()).append('\n');
        if (references != null && !references.annotations().isEmpty()) {
            sb.append("参考素材（把它们的视觉特征融入提示词）：\n");
            references.annotations().forEach(a -> sb.append("- ").append(a).append('\n'));
        }
        return sb.toString();
    }
}
