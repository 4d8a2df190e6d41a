package villagecompute.autopost.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import villagecompute.autopost.integration.signing.BrowserRequestSigner;
import villagecompute.autopost.integration.signing.CommonSignatureEncoder;
import villagecompute.autopost.integration.signing.GraalScriptEvaluator;
import villagecompute.autopost.integration.signing.JvppeteerSigningPage;
import villagecompute.autopost.integration.signing.RequestSigner;
import villagecompute.autopost.integration.signing.RetryingRequestSigner;
import villagecompute.autopost.integration.signing.ScriptRequestSigner;

/**
 * Builds the process-wide {@link RequestSigner}.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code signing.strategy} - {@code script} (default) or {@code browser}</li>
 * <li>{@code signing.script.path} - signing script exporting {@code sign(uri, data, cookie)}</li>
 * <li>{@code signing.script.mns-path} - optional script exporting {@code window.getMnsToken}</li>
 * <li>{@code signing.browser.home-url} - page loaded by the browser strategy</li>
 * <li>{@code signing.retry.attempts} / {@code signing.retry.backoff} - per-budget attempts and pause</li>
 * </ul>
 */
@ApplicationScoped
public class SigningConfig {

    private static final Logger LOG = Logger.getLogger(SigningConfig.class);

    static final String MNS_FUNCTION = "window.getMnsToken";

    @ConfigProperty(
            name = "signing.strategy",
            defaultValue = "script")
    String strategy;

    @ConfigProperty(
            name = "signing.script.path",
            defaultValue = "signing/xhs_xs.js")
    String scriptPath;

    @ConfigProperty(
            name = "signing.script.mns-path")
    Optional<String> mnsScriptPath;

    @ConfigProperty(
            name = "signing.browser.home-url",
            defaultValue = "https://www.xiaohongshu.com")
    String homeUrl;

    @ConfigProperty(
            name = "signing.browser.launch-timeout-ms",
            defaultValue = "30000")
    int launchTimeoutMillis;

    @ConfigProperty(
            name = "signing.common.client-version",
            defaultValue = "3.7.8-2")
    String clientVersion;

    @ConfigProperty(
            name = "signing.common.web-build",
            defaultValue = "4.27.2")
    String webBuild;

    @ConfigProperty(
            name = "signing.retry.attempts",
            defaultValue = "3")
    int attempts;

    @ConfigProperty(
            name = "signing.retry.backoff",
            defaultValue = "500ms")
    Duration backoff;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    MeterRegistry meterRegistry;

    @Produces
    @ApplicationScoped
    RequestSigner requestSigner() {
        RequestSigner strategySigner = switch (strategy) {
            case "script" -> scriptSigner();
            case "browser" -> new BrowserRequestSigner(new JvppeteerSigningPage(homeUrl, launchTimeoutMillis),
                    new CommonSignatureEncoder(objectMapper, clientVersion, webBuild), objectMapper);
            default -> throw new IllegalStateException(
                    "Unknown signing.strategy '" + strategy + "', expected script or browser");
        };
        LOG.infof("Request signing strategy: %s (attempts=%d, backoff=%s)", strategy, attempts, backoff);
        return new RetryingRequestSigner(strategySigner, attempts, backoff, meterRegistry);
    }

    void closeSigner(@Disposes RequestSigner signer) {
        signer.close();
    }

    private RequestSigner scriptSigner() {
        List<Path> scripts = new ArrayList<>();
        scripts.add(Path.of(scriptPath));
        mnsScriptPath.map(Path::of).ifPresent(scripts::add);
        return new ScriptRequestSigner(new GraalScriptEvaluator(scripts), objectMapper,
                mnsScriptPath.isPresent() ? MNS_FUNCTION : null);
    }
}
