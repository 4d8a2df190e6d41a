package villagecompute.autopost.integration.signing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import com.ruiyun.jvppeteer.api.core.Browser;
import com.ruiyun.jvppeteer.api.core.Page;
import com.ruiyun.jvppeteer.cdp.core.Puppeteer;
import com.ruiyun.jvppeteer.cdp.entities.CookieParam;
import com.ruiyun.jvppeteer.cdp.entities.LaunchOptions;

import villagecompute.autopost.exceptions.SigningException;

/**
 * Headless Chromium page driven through jvppeteer.
 *
 * <p>
 * One browser and one page for the whole process. Launch flags match the screenshot capture setup used for
 * containerized hosts.
 */
public class JvppeteerSigningPage implements SigningPage {

    private static final Logger LOG = Logger.getLogger(JvppeteerSigningPage.class);

    private static final String COOKIE_DOMAIN = ".xiaohongshu.com";

    private final String homeUrl;
    private final int launchTimeoutMillis;

    private Browser browser;
    private Page page;
    private String cookie;

    public JvppeteerSigningPage(String homeUrl, int launchTimeoutMillis) {
        this.homeUrl = homeUrl;
        this.launchTimeoutMillis = launchTimeoutMillis;
    }

    @Override
    public void open(String sessionCookie) {
        this.cookie = sessionCookie;
        try {
            if (browser == null) {
                LOG.info("Launching headless browser for request signing");
                LaunchOptions launchOptions = LaunchOptions.builder().headless(true).timeout(launchTimeoutMillis)
                        .args(List.of("--no-sandbox", "--disable-setuid-sandbox", "--disable-dev-shm-usage",
                                "--disable-gpu", "--no-first-run", "--no-default-browser-check",
                                "--disable-blink-features=AutomationControlled"))
                        .build();
                browser = Puppeteer.launch(launchOptions);
            }
            if (page != null) {
                page.close();
            }
            page = browser.newPage();
            page.setCookie(toCookieParams(sessionCookie));
            page.goTo(homeUrl);
            LOG.infof("Signing page loaded (%s)", homeUrl);
        } catch (Exception e) {
            throw new SigningException("Failed to open signing page: " + e.getMessage(), e);
        }
    }

    @Override
    public String evaluate(String expression) {
        if (page == null) {
            throw new SigningException("Signing page is not open");
        }
        try {
            Object result = page.evaluate(expression);
            return result == null ? "null" : result.toString();
        } catch (Exception e) {
            throw new SigningException("Page evaluation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void reload() {
        if (page != null) {
            try {
                page.reload();
                LOG.info("Signing page reloaded");
                return;
            } catch (Exception e) {
                LOG.warnf(e, "Page reload failed, relaunching browser");
            }
        }
        closeBrowser();
        open(cookie == null ? "" : cookie);
    }

    @Override
    public void close() {
        closeBrowser();
    }

    private void closeBrowser() {
        if (browser != null) {
            try {
                browser.close();
            } catch (Exception e) {
                LOG.errorf(e, "Failed to close signing browser");
            }
        }
        browser = null;
        page = null;
    }

    private CookieParam[] toCookieParams(String sessionCookie) {
        List<CookieParam> params = new ArrayList<>();
        for (Map.Entry<String, String> entry : CookieParser.parse(sessionCookie).entrySet()) {
            CookieParam param = new CookieParam();
            param.setName(entry.getKey());
            param.setValue(entry.getValue());
            param.setDomain(COOKIE_DOMAIN);
            param.setPath("/");
            params.add(param);
        }
        return params.toArray(new CookieParam[0]);
    }
}
