package com.narrativelens.backend.scraping.fetch;

import com.narrativelens.backend.config.ScrapingConfig;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Plain HTTP GET with browser-like headers. Default fetcher.
 */
@Component
@ConditionalOnProperty(prefix = "scraping", name = "fetcher", havingValue = "http", matchIfMissing = true)
@RequiredArgsConstructor
public class JsoupPageFetcher extends AbstractPageFetcher {

    private final ScrapingConfig scrapingConfig;

    @Override
    protected FetchedPage fetchOnce(String url) throws PageFetchException {
        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(scrapingConfig.getDefaultHeaders().get("User-Agent"))
                    .headers(scrapingConfig.getDefaultHeaders())
                    .timeout(scrapingConfig.getDefaultTimeout() * 1000)
                    .followRedirects(true)
                    .execute();
            return new FetchedPage(response.url().toString(), response.body());

        } catch (HttpStatusException e) {
            throw new PageFetchException("HTTP " + e.getStatusCode() + " for " + url, e,
                    FetchFailureCategory.fromStatusCode(e.getStatusCode()));
        } catch (UnsupportedMimeTypeException e) {
            throw new PageFetchException("Unsupported content type " + e.getMimeType(), e,
                    FetchFailureCategory.CLIENT_ERROR);
        } catch (SocketTimeoutException e) {
            throw new PageFetchException("Timeout fetching " + url, e, FetchFailureCategory.TIMEOUT);
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new PageFetchException("Invalid URL format: " + url, e, FetchFailureCategory.INVALID_URL);
        } catch (IOException e) {
            throw new PageFetchException("I/O error reading " + url + ": " + e.getMessage(), e,
                    FetchFailureCategory.CONNECTION_ERROR);
        }
    }
}
