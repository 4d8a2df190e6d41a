package villagecompute.autopost.services;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.integration.notify.WxPusherClient;

/**
 * Tells the operator how a post ended. Best effort: nothing thrown here reaches the pipeline.
 */
@ApplicationScoped
public class NotificationService {

    private static final Logger LOG = Logger.getLogger(NotificationService.class);

    static final int ERROR_LIMIT = 200;

    @Inject
    WxPusherClient wxPusherClient;

    public void notifyPublished(ScheduledPost post, String title, String noteId) {
        String content = "✅ " + title + "\n\n主题：" + post.topic + "\n账号：" + post.accountId + "\n笔记ID：" + noteId;
        send("✅ " + title, content, post.id);
    }

    public void notifyFailed(ScheduledPost post, String stage, String error) {
        String content = "❌ " + post.topic + "\n\n任务：#" + post.id + "\n账号：" + post.accountId + "\n失败阶段："
                + (stage == null ? "-" : stage) + "\n错误信息：" + truncate(error);
        send("❌ " + post.topic, content, post.id);
    }

    private void send(String summary, String content, Long postId) {
        try {
            if (wxPusherClient.send(summary, content)) {
                LOG.debugf("Notification sent for post %d", postId);
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "Notification for post %d failed", postId);
        }
    }

    static String truncate(String error) {
        if (error == null) {
            return "";
        }
        return error.length() > ERROR_LIMIT ? error.substring(0, ERROR_LIMIT) + "..." : error;
    }
}
