package villagecompute.autopost.services;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.autopost.api.types.NoteContentType;
import villagecompute.autopost.api.types.TopicType;
import villagecompute.autopost.exceptions.VerificationChallengeException;
import villagecompute.autopost.integration.xhs.XhsPlatformClient;

/**
 * Publishes a finished note: resolves the account cookie, attaches platform topics, uploads the images and creates
 * the note.
 *
 * <p>
 * Topics are looked up one hashtag at a time. A failed lookup drops that topic and publishing continues; a
 * verification challenge is the exception, since the session is blocked for the upload that follows anyway.
 */
@ApplicationScoped
public class NotePublishService {

    private static final Logger LOG = Logger.getLogger(NotePublishService.class);

    @Inject
    AccountService accountService;

    @Inject
    XhsPlatformClient platformClient;

    /**
     * @return platform note id
     */
    public String publish(String accountId, NoteContentType content, List<Path> images) {
        String cookie = accountService.cookieFor(accountId);
        List<TopicType> topics = resolveTopics(cookie, content.hashtags());
        LOG.infof("Publishing '%s' for account %s (%d images, %d/%d topics)", content.title(), accountId,
                images.size(), topics.size(), content.hashtags().size());
        return platformClient.publishImageNote(cookie, content.title(), content.description(), images, topics);
    }

    List<TopicType> resolveTopics(String cookie, List<String> hashtags) {
        List<TopicType> topics = new ArrayList<>();
        for (String tag : hashtags) {
            try {
                Optional<TopicType> topic = platformClient.searchTopic(cookie, tag);
                topic.ifPresent(topics::add);
            } catch (VerificationChallengeException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warnf("Topic lookup for '%s' failed, publishing without it: %s", tag, e.getMessage());
            }
        }
        return topics;
    }
}
