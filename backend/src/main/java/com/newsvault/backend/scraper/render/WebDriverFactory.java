package com.newsvault.backend.scraper.render;

import com.newsvault.backend.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates headless browser instances for the render pool.
 */
@Component
@Slf4j
public class WebDriverFactory {

    @Value("${scraper.webdriver.type:chrome}")
    private String webDriverType;

    @Value("${scraper.webdriver.headless:true}")
    private boolean headless;

    @Value("${scraper.webdriver.window.width:1920}")
    private int windowWidth;

    @Value("${scraper.webdriver.window.height:1080}")
    private int windowHeight;

    @Value("${scraping.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/140.0.0.0 Safari/537.36}")
    private String userAgent;

    private final PipelineProperties properties;

    public WebDriverFactory(PipelineProperties properties) {
        this.properties = properties;
    }

    public WebDriver create() {
        log.info("Creating WebDriver instance: type={}, headless={}", webDriverType, headless);

        WebDriver driver = switch (webDriverType.toLowerCase()) {
            case "firefox" -> createFirefoxDriver();
            default -> createChromeDriver();
        };

        // A page load beyond the render timeout fails the rendered strategy only
        driver.manage().timeouts().pageLoadTimeout(properties.getRenderTimeout());
        driver.manage().timeouts().scriptTimeout(properties.getRenderTimeout());
        driver.manage().window().setSize(new Dimension(windowWidth, windowHeight));
        return driver;
    }

    private WebDriver createChromeDriver() {
        ChromeOptions options = new ChromeOptions();

        if (headless) {
            options.addArguments("--headless=new");
        }

        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--disable-extensions");
        options.addArguments("--blink-settings=imagesEnabled=false");
        options.addArguments("--user-agent=" + userAgent);

        // Memory optimization
        options.addArguments("--memory-pressure-off");
        options.addArguments("--js-flags=--max-old-space-size=512");

        return new ChromeDriver(options);
    }

    private WebDriver createFirefoxDriver() {
        FirefoxOptions options = new FirefoxOptions();

        if (headless) {
            options.addArguments("--headless");
        }

        options.addPreference("permissions.default.image", 2); // Block images
        options.addPreference("general.useragent.override", userAgent);

        return new FirefoxDriver(options);
    }
}
