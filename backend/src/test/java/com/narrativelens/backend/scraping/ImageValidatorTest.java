package com.narrativelens.backend.scraping;

import static org.assertj.core.api.Assertions.assertThat;

import com.narrativelens.backend.config.ScrapingConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImageValidatorTest {

    private ImageValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ImageValidator(new ScrapingConfig());
    }

    @Test
    void shouldRejectLogoImage() {
        assertThat(validator.isValidImage("https://cdn.site.com/logo-small.png")).isFalse();
    }

    @Test
    void shouldAcceptContentPhoto() {
        assertThat(validator.isValidImage("https://cdn.site.com/photo123.jpg")).isTrue();
    }

    @Test
    void shouldRejectNullAndEmpty() {
        assertThat(validator.isValidImage(null)).isFalse();
        assertThat(validator.isValidImage("")).isFalse();
        assertThat(validator.isValidImage("   ")).isFalse();
    }

    @Test
    void shouldMatchPatternsCaseInsensitively() {
        assertThat(validator.isValidImage("https://cdn.site.com/Site_LOGO.PNG")).isFalse();
        assertThat(validator.isValidImage("https://cdn.site.com/FavIcon.ico")).isFalse();
    }

    @Test
    void shouldRejectAdsAndTrackingPixels() {
        assertThat(validator.isValidImage("https://ad.doubleclick.net/img/123.jpg")).isFalse();
        assertThat(validator.isValidImage("https://news.example.com/t/pixel.png")).isFalse();
        assertThat(validator.isValidImage("https://news.example.com/spacer.gif")).isFalse();
        assertThat(validator.isValidImage("https://news.example.com/sponsor/partner.jpg")).isFalse();
        assertThat(validator.isValidImage("https://news.example.com/top-banner.jpg")).isFalse();
    }

    @Test
    void shouldAcceptUploadsPathWithoutAdMarker() {
        assertThat(validator.isValidImage("https://news.example.com/wp-content/uploads/2025/08/summit.jpg")).isTrue();
    }

    @Test
    void shouldRejectRelativeAndInlineImages() {
        assertThat(validator.isValidImage("/images/photo.jpg")).isFalse();
        assertThat(validator.isValidImage("data:image/png;base64,iVBORw0KGgo=")).isFalse();
        assertThat(validator.isValidImage("//cdn.site.com/photo.jpg")).isTrue();
    }

    @Test
    void shouldAllowBrandingImagesAsFallbackButNotAds() {
        assertThat(validator.isUsableFallback("https://logos.example.org/bbc.com")).isTrue();
        assertThat(validator.isUsableFallback("https://www.google.com/s2/favicons?domain=bbc.com&sz=128")).isTrue();
        assertThat(validator.isUsableFallback("https://logos.example.org/ad.example.com")).isFalse();
        assertThat(validator.isUsableFallback(null)).isFalse();
    }
}
