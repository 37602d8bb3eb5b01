package com.narrativelens.backend.scraping.fetch;

import com.narrativelens.backend.config.ScrapingConfig;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Renders the page in a headless browser so script-built article bodies are visible to the
 * extractor. Each fetch gets its own driver since WebDriver instances are not thread-safe.
 * <p>
 * WebDriver does not expose the response status, so a HEAD request runs first and error
 * statuses fail the attempt before a browser is started.
 */
@Component
@ConditionalOnProperty(prefix = "scraping", name = "fetcher", havingValue = "browser")
@RequiredArgsConstructor
@Slf4j
public class SeleniumPageFetcher extends AbstractPageFetcher {

    private static final int READY_WAIT_SECONDS = 15;

    private final ObjectProvider<WebDriver> webDriverProvider;
    private final ScrapingConfig scrapingConfig;

    @Override
    protected FetchedPage fetchOnce(String url) throws PageFetchException {
        checkStatus(url);

        WebDriver driver;
        try {
            driver = webDriverProvider.getObject();
        } catch (Exception e) {
            throw new PageFetchException("Could not start browser: " + e.getMessage(), e,
                    FetchFailureCategory.RENDER_ERROR);
        }

        try {
            driver.get(url);
            new WebDriverWait(driver, Duration.ofSeconds(READY_WAIT_SECONDS)).until(d ->
                    "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
            return new FetchedPage(driver.getCurrentUrl(), driver.getPageSource());

        } catch (TimeoutException e) {
            throw new PageFetchException("Timeout rendering " + url, e, FetchFailureCategory.TIMEOUT);
        } catch (WebDriverException e) {
            throw new PageFetchException("Browser error rendering " + url + ": " + e.getMessage(), e,
                    FetchFailureCategory.RENDER_ERROR);
        } finally {
            try {
                driver.quit();
            } catch (WebDriverException e) {
                log.warn("Failed to close browser after {}: {}", url, e.getMessage());
            }
        }
    }

    private void checkStatus(String url) throws PageFetchException {
        int status;
        try {
            status = headStatus(url);
        } catch (SocketTimeoutException e) {
            throw new PageFetchException("Timeout checking " + url, e, FetchFailureCategory.TIMEOUT);
        } catch (IOException e) {
            throw new PageFetchException("I/O error checking " + url + ": " + e.getMessage(), e,
                    FetchFailureCategory.CONNECTION_ERROR);
        } catch (IllegalArgumentException e) {
            throw new PageFetchException("Invalid URL format: " + url, e, FetchFailureCategory.INVALID_URL);
        }

        // Servers that refuse HEAD get the benefit of the doubt
        if (status >= 400 && status != 405 && status != 501) {
            throw new PageFetchException("HTTP " + status + " for " + url, FetchFailureCategory.fromStatusCode(status));
        }
    }

    /**
     * Status code of a HEAD request with the configured headers, redirects followed
     */
    protected int headStatus(String url) throws IOException {
        return Jsoup.connect(url)
                .method(Connection.Method.HEAD)
                .userAgent(scrapingConfig.getDefaultHeaders().get("User-Agent"))
                .headers(scrapingConfig.getDefaultHeaders())
                .timeout(scrapingConfig.getDefaultTimeout() * 1000)
                .followRedirects(true)
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .execute()
                .statusCode();
    }
}
