package villagecompute.autopost.services;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.autopost.data.models.VisualStyle;

/**
 * Image prompt skeletons grouped by visual style. Each skeleton has a {@code {scene_detail}} slot the prompt model
 * fills with a topic-specific scene.
 */
@ApplicationScoped
public class PromptTemplateLibrary {

    public static final String SCENE_PLACEHOLDER = "{scene_detail}";

    /**
     * One prompt skeleton.
     *
     * @param key
     *            stable identifier the model answers with
     * @param style
     *            style family the template belongs to
     * @param name
     *            short display name
     * @param description
     *            when to pick this template
     * @param template
     *            skeleton containing {@link #SCENE_PLACEHOLDER}
     */
    public record PromptTemplate(String key, VisualStyle style, String name, String description, String template) {

        public String fill(String sceneDetail) {
            return template.replace(SCENE_PLACEHOLDER, sceneDetail);
        }
    }

    private static final String PHOTO_TAIL = "手持拍摄轻微晃动，画面略有倾斜，带少量噪点，不加滤镜不做后期，";

    private final Map<String, PromptTemplate> templates = new LinkedHashMap<>();

    public PromptTemplateLibrary() {
        register(new PromptTemplate("photo_lifestyle", VisualStyle.PHOTO, "生活日常", "日常记录、桌面小物、咖啡与书、居家角落，突出随手拍的真实感",
                "手机随手抓拍的真实生活照片，{scene_detail}，室内或桌面场景，物品随意摆放，主体略偏离中心，侧面窗光造成局部过曝，"
                        + PHOTO_TAIL + "画面中不出现文字"));
        register(new PromptTemplate("photo_food", VisualStyle.PHOTO, "美食探店", "探店打卡、菜品特写、咖啡甜品、街头小吃，突出食物质感和店内氛围",
                "手机随手抓拍的探店照片，{scene_detail}，餐桌或吧台场景，餐具自然摆放，背景是虚化的店内环境，暖色室内灯光，" + PHOTO_TAIL
                        + "食物色泽真实，画面中不出现文字"));
        register(new PromptTemplate("photo_outdoor", VisualStyle.PHOTO, "户外街拍", "旅行打卡、街头巷尾、户外活动、城市漫步，突出户外光线",
                "手机随手抓拍的户外照片，{scene_detail}，自然光线，背景是街道或自然风景，主体略偏离中心，阳光下局部高光溢出，带轻微运动模糊，"
                        + PHOTO_TAIL + "画面中不出现文字"));
        register(new PromptTemplate("photo_study", VisualStyle.PHOTO, "学习备考", "学习打卡、备考记录、书桌笔记、教材资料，突出学习氛围",
                "手机随手抓拍的书桌照片，{scene_detail}，笔记本、教材和文具随意散落，台灯或窗边自然光，" + PHOTO_TAIL
                        + "真实的备考氛围，画面中不出现文字"));
        register(new PromptTemplate("poster_product", VisualStyle.POSTER, "产品种草", "好物推荐、美妆护肤、数码配件、产品分享",
                "海报设计风格，{scene_detail}，产品主体居中突出，画面无水印，可以带中文标题"));
        register(new PromptTemplate("poster_knowledge", VisualStyle.POSTER, "知识干货", "知识分享、技能教程、干货清单、信息图",
                "海报设计风格，{scene_detail}，信息图式排版，层次清晰，画面无水印，可以带中文标题"));
        register(new PromptTemplate("poster_motivation", VisualStyle.POSTER, "励志激励", "正能量语录、目标打卡、成长记录",
                "海报设计风格，{scene_detail}，视觉冲击力强，画面无水印，可以带中文标题"));
        register(new PromptTemplate("poster_event", VisualStyle.POSTER, "活动推广", "节日活动、品牌推广、限时优惠、打卡挑战",
                "海报设计风格，{scene_detail}，节日氛围浓厚，画面无水印，可以带中文标题"));
    }

    private void register(PromptTemplate template) {
        templates.put(template.key(), template);
    }

    public List<PromptTemplate> forStyle(VisualStyle style) {
        return templates.values().stream().filter(t -> t.style() == style).toList();
    }

    /**
     * Looks up a template, but only within the given style family.
     */
    public Optional<PromptTemplate> find(String key, VisualStyle style) {
        PromptTemplate template = key == null ? null : templates.get(key);
        return template != null && template.style() == style ? Optional.of(template) : Optional.empty();
    }
}
