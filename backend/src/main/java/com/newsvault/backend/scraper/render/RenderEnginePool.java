package com.newsvault.backend.scraper.render;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.health.DependencyHealthRegistry;
import jakarta.annotation.PreDestroy;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.stereotype.Component;

/**
 * Bounded pool of headless browsers shared by every source.
 * <p>
 * At most {@code pipeline.max-concurrent-renders} pages render at once. A browser is
 * checked out for one page and always returned, or discarded if the render failed.
 */
@Component
@Slf4j
public class RenderEnginePool {

    private final WebDriverFactory webDriverFactory;
    private final PipelineProperties properties;
    private final DependencyHealthRegistry healthRegistry;
    private final Semaphore permits;
    private final Deque<WebDriver> idleDrivers = new ConcurrentLinkedDeque<>();

    public RenderEnginePool(WebDriverFactory webDriverFactory, PipelineProperties properties,
                            DependencyHealthRegistry healthRegistry) {
        this.webDriverFactory = webDriverFactory;
        this.properties = properties;
        this.healthRegistry = healthRegistry;
        this.permits = new Semaphore(Math.max(1, properties.getMaxConcurrentRenders()), true);
        log.info("📊 Initialized render pool with {} concurrent renders", Math.max(1, properties.getMaxConcurrentRenders()));
    }

    /**
     * Renders {@code url} and returns the resulting page source.
     *
     * @throws RenderException on timeout, browser failure or interruption
     */
    public String renderHtml(String url) {
        acquirePermit(url);
        WebDriver driver = null;
        boolean healthy = false;
        try {
            driver = checkout();
            log.debug("🌐 Rendering {}", url);
            driver.get(url);

            WebDriverWait wait = new WebDriverWait(driver, properties.getRenderTimeout());
            wait.until(ExpectedConditions.presenceOfElementLocated(By.tagName("body")));

            String html = driver.getPageSource();
            healthy = true;
            return html;
        } catch (TimeoutException e) {
            throw new RenderException("Render of " + url + " exceeded " + properties.getRenderTimeout().toSeconds() + "s", true, e);
        } catch (RenderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RenderException("Render of " + url + " failed: " + e.getMessage(), false, e);
        } finally {
            release(driver, healthy);
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    private void acquirePermit(String url) {
        try {
            // Waiting for a free browser counts against the same timeout as the render itself
            long waitMillis = properties.getRenderTimeout().toMillis() * 2;
            if (!permits.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
                throw new RenderException("No render engine available for " + url, true, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while waiting for render engine", false, e);
        }
    }

    private WebDriver checkout() {
        WebDriver driver = idleDrivers.pollFirst();
        if (driver != null) {
            return driver;
        }
        try {
            driver = webDriverFactory.create();
            healthRegistry.markHealthy(DependencyHealthRegistry.RENDER);
            return driver;
        } catch (RuntimeException e) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.RENDER, e.getMessage());
            throw new RenderException("Failed to start browser: " + e.getMessage(), false, e);
        }
    }

    private void release(WebDriver driver, boolean healthy) {
        if (driver == null) return;
        if (healthy) {
            idleDrivers.offerFirst(driver);
        } else {
            quietlyQuit(driver);
        }
    }

    private void quietlyQuit(WebDriver driver) {
        try {
            driver.quit();
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to quit browser: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("🔄 Shutting down {} idle render engines...", idleDrivers.size());
        WebDriver driver;
        while ((driver = idleDrivers.pollFirst()) != null) {
            quietlyQuit(driver);
        }
    }
}
