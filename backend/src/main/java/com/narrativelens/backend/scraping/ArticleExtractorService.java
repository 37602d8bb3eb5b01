package com.narrativelens.backend.scraping;

import com.narrativelens.backend.config.ScrapingConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

/**
 * Pulls a lead snippet and a representative image out of fetched article HTML using an ordered
 * chain of selector heuristics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleExtractorService {

    private static final String[] OPEN_GRAPH_IMAGE = {"meta[property=og:image]", "meta[name=og:image]"};
    private static final String[] TWITTER_IMAGE = {"meta[name=twitter:image]", "meta[property=twitter:image]",
            "meta[name=twitter:image:src]"};

    private final ScrapingConfig scrapingConfig;
    private final ImageValidator imageValidator;

    public Document parse(String html, String baseUrl) {
        return Jsoup.parse(html != null ? html : "", baseUrl != null ? baseUrl : "");
    }

    public String extractSnippet(String html, int maxLength) {
        return extractSnippet(parse(html, null), maxLength);
    }

    /**
     * First non-blank paragraph inside a known article body container, else the first non-blank
     * paragraph anywhere. Returns null when the page has no paragraph text at all.
     */
    public String extractSnippet(Document doc, int maxLength) {
        for (Element container : findArticleContainers(doc)) {
            String text = firstParagraphText(container.select("p"));
            if (text != null) {
                return truncate(text, maxLength);
            }
        }

        String text = firstParagraphText(doc.select("p"));
        if (text != null) {
            return truncate(text, maxLength);
        }

        log.debug("No snippet paragraph found in {}", doc.location());
        return null;
    }

    public String extractImage(String html, String baseUrl) {
        return extractImage(parse(html, baseUrl));
    }

    /**
     * Candidates in priority order: og:image, twitter:image, images inside the article body, any
     * image on the page. The first candidate that passes the {@link ImageValidator} wins.
     */
    public String extractImage(Document doc) {
        for (String candidate : imageCandidates(doc)) {
            if (imageValidator.isValidImage(candidate)) {
                return candidate;
            }
            log.debug("Rejected image candidate {}", candidate);
        }
        return null;
    }

    public String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (maxLength <= 0 || trimmed.length() <= maxLength) {
            return trimmed;
        }
        return trimmed.substring(0, maxLength) + scrapingConfig.getTruncationMarker();
    }

    private List<String> imageCandidates(Document doc) {
        List<String> candidates = new ArrayList<>();
        addMetaContent(doc, OPEN_GRAPH_IMAGE, candidates);
        addMetaContent(doc, TWITTER_IMAGE, candidates);
        for (Element container : findArticleContainers(doc)) {
            addImageSources(container.select("img"), candidates);
        }
        addImageSources(doc.select("img"), candidates);
        return candidates;
    }

    private void addMetaContent(Document doc, String[] selectors, List<String> candidates) {
        for (String selector : selectors) {
            Element meta = doc.selectFirst(selector);
            if (meta != null) {
                addCandidate(resolve(meta, "content"), candidates);
            }
        }
    }

    private void addImageSources(Elements images, List<String> candidates) {
        for (Element img : images) {
            String src = resolve(img, "src");
            if (src == null) {
                src = resolve(img, "data-src");
            }
            addCandidate(src, candidates);
        }
    }

    private void addCandidate(String candidate, List<String> candidates) {
        if (candidate != null && !candidates.contains(candidate)) {
            candidates.add(candidate);
        }
    }

    // Absolute form of a URL attribute; protocol-relative values are upgraded to https
    private String resolve(Element element, String attribute) {
        if (!element.hasAttr(attribute)) {
            return null;
        }
        String raw = element.attr(attribute).trim();
        if (raw.isEmpty() || raw.startsWith("data:")) {
            return null;
        }
        String absolute = element.absUrl(attribute);
        if (!absolute.isEmpty()) {
            return absolute;
        }
        return raw.startsWith("//") ? "https:" + raw : raw;
    }

    private List<Element> findArticleContainers(Document doc) {
        List<Element> containers = new ArrayList<>();
        for (String selector : scrapingConfig.getArticleBodySelectors()) {
            try {
                for (Element element : doc.select(selector)) {
                    if (!containers.contains(element)) {
                        containers.add(element);
                    }
                }
            } catch (Exception e) {
                log.debug("Error with container selector '{}': {}", selector, e.getMessage());
            }
        }
        return containers;
    }

    private String firstParagraphText(Elements paragraphs) {
        for (Element paragraph : paragraphs) {
            String text = paragraph.text();
            if (text != null && !text.trim().isEmpty()) {
                return text.trim();
            }
        }
        return null;
    }
}
