package com.example.tubefetch.player;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * An embed page loaded in a WebDriver session. Player state is read by polling the page's
 * {@code movie_player} object, since WebDriver has no push channel for player events.
 */
public class SeleniumEmbeddedPlayer implements EmbeddedPlayer {

    private static final Logger log = LoggerFactory.getLogger(SeleniumEmbeddedPlayer.class);

    private static final String STATE_SCRIPT =
            "var p = document.getElementById('movie_player');"
                    + "if (document.querySelector('.ytp-error')) { return 'error'; }"
                    + "return p && p.getPlayerState ? p.getPlayerState() : null;";
    private static final String LEVELS_SCRIPT =
            "var p = document.getElementById('movie_player');"
                    + "return p && p.getAvailableQualityLevels ? p.getAvailableQualityLevels() : [];";
    private static final String STOP_SCRIPT =
            "var p = document.getElementById('movie_player');"
                    + "if (p && p.stopVideo) { p.stopVideo(); }";

    private final WebDriver driver;
    private final String embedUrl;
    private final TaskScheduler scheduler;
    private final Duration pollInterval;

    private ScheduledFuture<?> poller;
    private Listener listener;
    private PlayerState lastState;
    private boolean destroyed;

    public SeleniumEmbeddedPlayer(WebDriver driver, String embedUrl, TaskScheduler scheduler, Duration pollInterval) {
        this.driver = driver;
        this.embedUrl = embedUrl;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
    }

    @Override
    public synchronized void start(Listener listener) {
        this.listener = listener;
        log.debug("Loading embed page {}", embedUrl);
        driver.get(embedUrl);
        poller = scheduler.scheduleWithFixedDelay(this::poll, pollInterval);
    }

    @Override
    public synchronized List<String> availableQualityLevels() {
        if (destroyed) {
            return List.of();
        }
        Object value = ((JavascriptExecutor) driver).executeScript(LEVELS_SCRIPT);
        List<String> levels = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object level : list) {
                if (level != null) {
                    levels.add(level.toString());
                }
            }
        }
        return levels;
    }

    @Override
    public synchronized void stop() {
        cancelPolling();
        if (destroyed) {
            return;
        }
        try {
            ((JavascriptExecutor) driver).executeScript(STOP_SCRIPT);
        } catch (WebDriverException e) {
            log.debug("Could not stop playback: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void destroy() {
        cancelPolling();
        if (destroyed) {
            return;
        }
        destroyed = true;
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("WebDriver session did not quit cleanly: {}", e.getMessage());
        }
    }

    private synchronized void poll() {
        if (destroyed || listener == null) {
            return;
        }
        Object value;
        try {
            value = ((JavascriptExecutor) driver).executeScript(STATE_SCRIPT);
        } catch (WebDriverException e) {
            log.debug("Player state poll failed: {}", e.getMessage());
            return;
        }
        if ("error".equals(value)) {
            cancelPolling();
            listener.onError(ERROR_OVERLAY);
            return;
        }
        if (value instanceof Number code) {
            PlayerState state = PlayerState.fromCode(code.intValue());
            if (state != lastState) {
                lastState = state;
                listener.onStateChange(state);
            }
        }
    }

    private void cancelPolling() {
        if (poller != null) {
            poller.cancel(false);
            poller = null;
        }
    }
}
