package com.narrativelens.backend.config;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

/**
 * Browser used by the rendering fetcher. Only wired when {@code scraping.fetcher=browser}.
 */
@Configuration
@ConditionalOnProperty(prefix = "scraping", name = "fetcher", havingValue = "browser")
@Slf4j
public class WebDriverConfig {

    @Value("${scraper.webdriver.type:chrome}")
    private String webDriverType;

    @Value("${scraper.webdriver.headless:true}")
    private boolean headless;

    @Value("${scraper.webdriver.timeout:30}")
    private int timeoutSeconds;

    @Value("${scraper.webdriver.window.width:1920}")
    private int windowWidth;

    @Value("${scraper.webdriver.window.height:1080}")
    private int windowHeight;

    @Bean
    @Scope("prototype")
    public WebDriver webDriver(ScrapingConfig scrapingConfig) {
        String userAgent = scrapingConfig.getDefaultHeaders().get("User-Agent");
        log.debug("Creating WebDriver instance: type={}, headless={}", webDriverType, headless);

        WebDriver driver = switch (webDriverType.toLowerCase()) {
            case "firefox" -> createFirefoxDriver(userAgent);
            default -> createChromeDriver(userAgent);
        };

        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(timeoutSeconds));
        driver.manage().window().setSize(new org.openqa.selenium.Dimension(windowWidth, windowHeight));
        return driver;
    }

    private WebDriver createChromeDriver(String userAgent) {
        ChromeOptions options = new ChromeOptions();

        if (headless) {
            options.addArguments("--headless=new");
        }

        // Security and performance options
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--disable-extensions");
        options.addArguments("--user-agent=" + userAgent);

        return new ChromeDriver(options);
    }

    private WebDriver createFirefoxDriver(String userAgent) {
        FirefoxOptions options = new FirefoxOptions();

        if (headless) {
            options.addArguments("--headless");
        }

        // Rendering is the point of this fetcher, so scripts stay on; images are not needed
        options.addPreference("permissions.default.image", 2);
        options.addPreference("general.useragent.override", userAgent);

        return new FirefoxDriver(options);
    }
}
