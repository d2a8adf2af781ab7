package com.example.tubefetch.player;

import com.example.tubefetch.domain.VideoIdentifier;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;

/**
 * Creates players backed by a fresh headless Chrome session per probe.
 */
public class HeadlessBrowserPlayerFactory implements EmbeddedPlayerFactory {

    private static final Logger log = LoggerFactory.getLogger(HeadlessBrowserPlayerFactory.class);

    static final String EMBED_BASE_URL = "https://www.youtube-nocookie.com/embed/";

    private final String chromeBinary;
    private final TaskScheduler scheduler;
    private final Duration pollInterval;

    public HeadlessBrowserPlayerFactory(String chromeBinary, TaskScheduler scheduler, Duration pollInterval) {
        this.chromeBinary = chromeBinary;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
    }

    @Override
    public EmbeddedPlayer create(VideoIdentifier videoId, PlayerOptions options) {
        ChromeDriver driver = new ChromeDriver(chromeOptions(options));
        log.debug("[PlayerProbe:{}] Started headless browser session", videoId);
        return new SeleniumEmbeddedPlayer(driver, embedUrl(videoId, options), scheduler, pollInterval);
    }

    static String embedUrl(VideoIdentifier videoId, PlayerOptions options) {
        return EMBED_BASE_URL + videoId.value() + "?" + options.toEmbedQuery();
    }

    ChromeOptions chromeOptions(PlayerOptions options) {
        ChromeOptions chrome = new ChromeOptions();
        chrome.addArguments(
                "--headless=new",
                "--no-sandbox",
                "--disable-dev-shm-usage",
                "--disable-gpu",
                "--disable-extensions",
                "--disable-notifications",
                "--autoplay-policy=no-user-gesture-required");
        if (options.muted()) {
            chrome.addArguments("--mute-audio");
        }
        if (!options.visible()) {
            chrome.addArguments("--window-size=1,1");
        }
        if (chromeBinary != null && !chromeBinary.isBlank()) {
            chrome.setBinary(chromeBinary);
        }
        return chrome;
    }
}
