/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.autopost.integration.xhs;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.autopost.api.types.AccountProfileType;
import villagecompute.autopost.api.types.PlatformNoteType;
import villagecompute.autopost.api.types.TopicType;
import villagecompute.autopost.exceptions.PlatformRejectedException;
import villagecompute.autopost.exceptions.VerificationChallengeException;
import villagecompute.autopost.integration.signing.RequestSigner;
import villagecompute.autopost.integration.signing.SigningRequest;

/**
 * HTTP client for the Xiaohongshu web API.
 *
 * <p>
 * Every request is signed by the configured {@link RequestSigner} and carries the header profile of a desktop Chrome
 * session, since the platform fingerprints unusual clients. The JDK client cannot imitate Chrome's TLS handshake, so
 * only the header fingerprint is reproduced.
 *
 * <h2>Response handling</h2>
 * <ul>
 * <li>HTTP 461/471: {@link VerificationChallengeException} with the {@code Verifytype}/{@code Verifyuuid} headers.
 * Never retried.</li>
 * <li>{@code success: true} or {@code code: 0}: the {@code data} member is returned.</li>
 * <li>Any other envelope: {@link PlatformRejectedException} with the platform's code and message.</li>
 * </ul>
 *
 * <h2>Hosts</h2>
 * <ul>
 * <li>API: https://edith.xiaohongshu.com</li>
 * <li>Creator (upload permits): https://creator.xiaohongshu.com</li>
 * <li>Object upload: https://ros-upload.xiaohongshu.com</li>
 * </ul>
 */
@ApplicationScoped
public class XhsPlatformClient {

    private static final Logger LOG = Logger.getLogger(XhsPlatformClient.class);

    static final String SELF_INFO_PATH = "/api/sns/web/v1/user/selfinfo";
    static final String USER_POSTED_PATH = "/api/sns/web/v1/user_posted";
    static final String TOPIC_SEARCH_PATH = "/web_api/sns/v1/search/topic";
    static final String UPLOAD_PERMIT_PATH = "/api/media/v1/upload/web/permit";
    static final String CREATE_NOTE_PATH = "/web_api/sns/v2/note";

    private static final int NOTES_PAGE_SIZE = 30;
    private static final int MAX_PAGES = 200;
    private static final String WEB_ORIGIN = "https://www.xiaohongshu.com";
    private static final String CREATOR_REFERER = "https://creator.xiaohongshu.com/";
    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";

    private final RequestSigner signer;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final String creatorBase;
    private final String uploadBase;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final SecureRandom random = new SecureRandom();

    int maxPages = MAX_PAGES;

    @Inject
    public XhsPlatformClient(RequestSigner signer, ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "xhs.api-base",
                    defaultValue = "https://edith.xiaohongshu.com") String apiBase,
            @ConfigProperty(
                    name = "xhs.creator-base",
                    defaultValue = "https://creator.xiaohongshu.com") String creatorBase,
            @ConfigProperty(
                    name = "xhs.upload-base",
                    defaultValue = "https://ros-upload.xiaohongshu.com") String uploadBase,
            @ConfigProperty(
                    name = "xhs.timeout",
                    defaultValue = "30s") Duration timeout) {
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
        this.creatorBase = creatorBase;
        this.uploadBase = uploadBase;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(Duration.ofSeconds(10)).build();
    }

    /**
     * Fetches the identity of the session owning {@code cookie}.
     */
    public AccountProfileType getSelfInfo(String cookie) {
        JsonNode data = get(cookie, apiBase, SELF_INFO_PATH, Map.of());
        JsonNode basic = data.has("basic_info") ? data.path("basic_info") : data;
        String userId = firstNonBlank(data.path("user_id").asText(""), basic.path("user_id").asText(""));
        return new AccountProfileType(userId, basic.path("nickname").asText(""), basic.path("red_id").asText(""));
    }

    /**
     * Lists every note posted by {@code userId}, following the cursor until the platform reports no more pages. Listing
     * stops with a warning after {@value #MAX_PAGES} pages.
     */
    public List<PlatformNoteType> getUserNotes(String cookie, String userId) {
        List<PlatformNoteType> notes = new ArrayList<>();
        String cursor = "";
        boolean more = true;
        int page = 0;
        while (more && page < maxPages) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("num", String.valueOf(NOTES_PAGE_SIZE));
            params.put("cursor", cursor);
            params.put("user_id", userId);
            params.put("image_formats", "jpg,webp,avif");
            JsonNode data = get(cookie, apiBase, USER_POSTED_PATH, params);
            page++;

            JsonNode pageNotes = data.path("notes");
            for (JsonNode note : pageNotes) {
                notes.add(new PlatformNoteType(note.path("note_id").asText(), note.path("display_title").asText(""),
                        note.path("type").asText(""), note.path("interact_info").path("liked_count").asText(""),
                        note.path("cover").path("url_default").asText(null)));
            }
            cursor = data.path("cursor").asText("");
            more = data.path("has_more").asBoolean(false) && !pageNotes.isEmpty() && !cursor.isEmpty();
        }
        if (more) {
            LOG.warnf("Stopped listing notes for user %s after %d pages (%d notes); the platform reports more",
                    userId, maxPages, notes.size());
        }
        LOG.infof("Fetched %d notes for user %s", notes.size(), userId);
        return notes;
    }

    /**
     * Looks up the best-matching platform topic for a hashtag.
     *
     * @return the first suggestion, or empty if the platform has none
     */
    public Optional<TopicType> searchTopic(String cookie, String keyword) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("keyword", keyword);
        ObjectNode suggest = body.putObject("suggest_topic_request");
        suggest.put("title", "");
        suggest.put("desc", "");
        ObjectNode page = body.putObject("page");
        page.put("page_size", 20);
        page.put("page", 1);

        JsonNode data = post(cookie, apiBase, TOPIC_SEARCH_PATH, body, Map.of());
        JsonNode first = data.path("topic_info_dtos").path(0);
        if (first.isMissingNode() || first.path("id").asText("").isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TopicType(first.path("id").asText(), first.path("name").asText(keyword),
                first.path("link").asText("")));
    }

    /**
     * Uploads one image file and returns its platform file id.
     */
    public String uploadImage(String cookie, Path file) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("biz_name", "spectrum");
        params.put("scene", "image");
        params.put("file_count", "1");
        params.put("version", "1");
        params.put("source", "web");
        JsonNode permit = get(cookie, creatorBase, UPLOAD_PERMIT_PATH, params).path("uploadTempPermits").path(0);
        String fileId = permit.path("fileIds").path(0).asText("");
        String token = permit.path("token").asText("");
        if (fileId.isEmpty()) {
            throw new PlatformRejectedException("Upload permit contained no file id");
        }

        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(uploadBase + "/" + fileId))
                    .timeout(timeout).header("X-Cos-Security-Token", token).header("User-Agent", USER_AGENT)
                    .PUT(HttpRequest.BodyPublishers.ofFile(file)).build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 300) {
                throw new PlatformRejectedException(response.statusCode(),
                        "Image upload returned status " + response.statusCode());
            }
            LOG.debugf("Uploaded %s as %s", file.getFileName(), fileId);
            return fileId;
        } catch (FileNotFoundException e) {
            throw new UncheckedIOException("Image file missing: " + file, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Image upload failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during image upload", e);
        }
    }

    /**
     * Creates a public image note from already-uploaded files.
     *
     * @return platform note id
     */
    public String createImageNote(String cookie, String title, String description, List<String> fileIds,
            List<TopicType> topics) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode common = body.putObject("common");
        common.put("type", "normal");
        common.put("title", title);
        common.put("note_id", "");
        common.put("desc", description);
        common.put("source", "{\"type\":\"web\",\"ids\":\"\",\"extraInfo\":\"{\\\"subType\\\":\\\"official\\\"}\"}");
        common.put("business_binds", "{\"version\":1,\"noteId\":0,\"noteOrderBind\":{},"
                + "\"notePostTiming\":{\"postTime\":null},\"noteCollectionBind\":{\"id\":\"\"}}");
        common.putArray("ats");
        ArrayNode hashTags = common.putArray("hash_tag");
        for (TopicType topic : topics) {
            ObjectNode tag = hashTags.addObject();
            tag.put("id", topic.id());
            tag.put("name", topic.name());
            tag.put("link", topic.link());
            tag.put("type", "topic");
        }
        common.putObject("post_loc");
        ObjectNode privacy = common.putObject("privacy_info");
        privacy.put("op_type", 1);
        privacy.put("type", 0);

        ArrayNode images = body.putObject("image_info").putArray("images");
        for (String fileId : fileIds) {
            ObjectNode image = images.addObject();
            image.put("file_id", fileId);
            image.putObject("metadata").put("source", -1);
            ObjectNode stickers = image.putObject("stickers");
            stickers.put("version", 2);
            stickers.putArray("floating");
            image.put("extra_info_json", "{\"mimeType\":\"image/jpeg\"}");
        }
        body.putNull("video_info");

        JsonNode data = post(cookie, apiBase, CREATE_NOTE_PATH, body, Map.of("Referer", CREATOR_REFERER));
        String noteId = firstNonBlank(data.path("id").asText(""), data.path("note_id").asText(""));
        if (noteId.isEmpty()) {
            throw new PlatformRejectedException("Note creation returned no note id");
        }
        LOG.infof("Created note %s (%d images, %d topics)", noteId, fileIds.size(), topics.size());
        return noteId;
    }

    /**
     * Uploads the images in order and creates the note.
     *
     * @return platform note id
     */
    public String publishImageNote(String cookie, String title, String description, List<Path> images,
            List<TopicType> topics) {
        List<String> fileIds = new ArrayList<>(images.size());
        for (Path image : images) {
            fileIds.add(uploadImage(cookie, image));
        }
        return createImageNote(cookie, title, description, fileIds, topics);
    }

    JsonNode get(String cookie, String base, String path, Map<String, String> params) {
        String uri = path + queryString(params);
        HttpRequest.Builder builder = requestBuilder(cookie, base + uri, uri, null).GET();
        return execute(builder.build(), uri);
    }

    JsonNode post(String cookie, String base, String path, JsonNode body, Map<String, String> extraHeaders) {
        HttpRequest.Builder builder = requestBuilder(cookie, base + path, path, body)
                .header("Content-Type", "application/json;charset=UTF-8")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        extraHeaders.forEach(builder::setHeader);
        return execute(builder.build(), path);
    }

    private HttpRequest.Builder requestBuilder(String cookie, String url, String signedUri, JsonNode body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout);
        browserHeaders(cookie).forEach(builder::header);
        signer.sign(new SigningRequest(signedUri, body, cookie)).toHeaderMap().forEach(builder::header);
        builder.header("x-xray-traceid", randomHex(16));
        return builder;
    }

    private Map<String, String> browserHeaders(String cookie) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Cookie", cookie);
        headers.put("Accept", "application/json, text/plain, */*");
        headers.put("Accept-Language", "zh-CN,zh;q=0.9");
        headers.put("Cache-Control", "no-cache");
        headers.put("Pragma", "no-cache");
        headers.put("Priority", "u=1, i");
        headers.put("Origin", WEB_ORIGIN);
        headers.put("Referer", WEB_ORIGIN + "/");
        headers.put("Sec-Ch-Ua", "\"Not:A-Brand\";v=\"99\", \"Google Chrome\";v=\"131\", \"Chromium\";v=\"131\"");
        headers.put("Sec-Ch-Ua-Mobile", "?0");
        headers.put("Sec-Ch-Ua-Platform", "\"macOS\"");
        headers.put("Sec-Fetch-Dest", "empty");
        headers.put("Sec-Fetch-Mode", "cors");
        headers.put("Sec-Fetch-Site", "same-site");
        headers.put("User-Agent", USER_AGENT);
        return headers;
    }

    private JsonNode execute(HttpRequest request, String uri) {
        try {
            long startTime = System.currentTimeMillis();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            LOG.debugf("%s %s -> %d (%dms)", request.method(), uri, response.statusCode(),
                    System.currentTimeMillis() - startTime);
            return interpret(response.statusCode(), response.headers().firstValue("Verifytype").orElse("?"),
                    response.headers().firstValue("Verifyuuid").orElse("?"), response.body());
        } catch (IOException e) {
            throw new UncheckedIOException("Request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during request to " + uri, e);
        }
    }

    /**
     * Applies the response contract to one raw response.
     */
    JsonNode interpret(int status, String verifyType, String verifyUuid, String body) {
        if (status == 461 || status == 471) {
            LOG.warnf("Verification challenge: status=%d, type=%s, id=%s", status, verifyType, verifyUuid);
            throw new VerificationChallengeException(status, verifyType, verifyUuid);
        }

        JsonNode envelope;
        try {
            envelope = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            envelope = null;
        }
        if (envelope == null || !envelope.isObject()) {
            if (status >= 400) {
                throw new PlatformRejectedException(status, "HTTP " + status + ": " + abbreviate(body));
            }
            return objectMapper.createObjectNode();
        }

        if (envelope.path("success").asBoolean(false)
                || (envelope.has("code") && envelope.path("code").isNumber() && envelope.path("code").asInt() == 0)) {
            JsonNode data = envelope.path("data");
            return data.isMissingNode() || data.isNull() ? objectMapper.createObjectNode() : data;
        }

        Integer code = envelope.has("code") ? envelope.path("code").asInt() : null;
        String message = firstNonBlank(envelope.path("msg").asText(""), envelope.path("message").asText(""));
        throw new PlatformRejectedException(code,
                message.isEmpty() ? "Platform rejected request: " + abbreviate(body) : message);
    }

    private static String queryString(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((k, v) -> joiner.add(k + "=" + URLEncoder.encode(v == null ? "" : v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    private String randomHex(int length) {
        byte[] bytes = new byte[length / 2];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : (b == null ? "" : b);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
