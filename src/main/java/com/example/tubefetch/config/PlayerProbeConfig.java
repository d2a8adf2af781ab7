package com.example.tubefetch.config;

import com.example.tubefetch.player.EmbeddedPlayerFactory;
import com.example.tubefetch.player.HeadlessBrowserPlayerFactory;
import com.example.tubefetch.service.PlayerProbe;
import com.example.tubefetch.service.impl.PlayerInstrumentationProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;

/**
 * Server-side player probe. Off by default: it needs a Chrome installation on the host.
 */
@Configuration
@ConditionalOnProperty(name = "player-probe.enabled", havingValue = "true")
public class PlayerProbeConfig {

    private static final Logger log = LoggerFactory.getLogger(PlayerProbeConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public EmbeddedPlayerFactory embeddedPlayerFactory(
            TaskScheduler taskScheduler,
            @Value("${player-probe.chrome-binary:}") String chromeBinary,
            @Value("${player-probe.poll-interval-ms:200}") long pollIntervalMs) {
        log.info("Player probe enabled with headless Chrome{}",
                chromeBinary.isBlank() ? "" : " at " + chromeBinary);
        return new HeadlessBrowserPlayerFactory(chromeBinary, taskScheduler, Duration.ofMillis(pollIntervalMs));
    }

    @Bean
    public PlayerProbe playerProbe(
            EmbeddedPlayerFactory embeddedPlayerFactory,
            TaskScheduler taskScheduler,
            @Value("${player-probe.settle-delay-ms:750}") long settleDelayMs) {
        return new PlayerInstrumentationProbe(embeddedPlayerFactory, taskScheduler, Duration.ofMillis(settleDelayMs));
    }
}
