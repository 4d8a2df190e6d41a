package villagecompute.autopost.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.integration.notify.WxPusherClient;

class NotificationServiceTest {

    @Mock
    WxPusherClient wxPusherClient;

    private NotificationService service;
    private ScheduledPost post;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new NotificationService();
        service.wxPusherClient = wxPusherClient;
        post = new ScheduledPost();
        post.id = 42L;
        post.topic = "咖啡探店";
        post.accountId = "acct-1";
    }

    @Test
    void testNotifyFailed_errorTruncated() {
        ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
        when(wxPusherClient.send(anyString(), anyString())).thenReturn(true);

        service.notifyFailed(post, "publish", "x".repeat(300));

        verify(wxPusherClient).send(eq("❌ 咖啡探店"), content.capture());
        assertTrue(content.getValue().contains("失败阶段：publish"));
        assertTrue(content.getValue().endsWith("x".repeat(NotificationService.ERROR_LIMIT) + "..."));
    }

    @Test
    void testNotifyPublished_clientFailureSwallowed() {
        when(wxPusherClient.send(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> service.notifyPublished(post, "周末咖啡探店", "note-123"));
    }

    @Test
    void testTruncate() {
        assertEquals("", NotificationService.truncate(null));
        assertEquals("short", NotificationService.truncate("short"));
    }
}
