package com.narrativelens.backend.scraping.fetch;

import lombok.Value;

/**
 * Raw HTML as loaded, with the URL it was finally served from after redirects.
 */
@Value
public class FetchedPage {
    String finalUrl;
    String html;
}
