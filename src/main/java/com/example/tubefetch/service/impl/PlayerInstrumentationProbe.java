package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.player.EmbeddedPlayer;
import com.example.tubefetch.player.EmbeddedPlayerFactory;
import com.example.tubefetch.player.PlayerOptions;
import com.example.tubefetch.player.PlayerState;
import com.example.tubefetch.service.PlayerProbe;
import com.example.tubefetch.service.PlayerProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts muted playback in an embedded player and reports the highest quality tier it offers once
 * playback has settled.
 * <p>
 * Only one session runs at a time. A new probe disposes the previous session first, and that
 * session's caller receives {@link EmbeddedPlayer#ERROR_SUPERSEDED}. Every session ends exactly once,
 * through a result, a player error or the hard timeout, and the player is stopped and destroyed at
 * that point.
 */
public class PlayerInstrumentationProbe implements PlayerProbe {

    private static final Logger log = LoggerFactory.getLogger(PlayerInstrumentationProbe.class);

    private static final String AUTO_LEVEL = "auto";
    private static final Duration WAIT_MARGIN = Duration.ofSeconds(5);

    private final EmbeddedPlayerFactory playerFactory;
    private final TaskScheduler scheduler;
    private final Duration settleDelay;

    private final Object sessionLock = new Object();
    private ProbeSession current;

    public PlayerInstrumentationProbe(EmbeddedPlayerFactory playerFactory, TaskScheduler scheduler, Duration settleDelay) {
        this.playerFactory = playerFactory;
        this.scheduler = scheduler;
        this.settleDelay = settleDelay;
    }

    @Override
    public PlayerProbeResult probe(VideoIdentifier videoId, Duration timeout) {
        ProbeSession session = new ProbeSession(videoId);
        ProbeSession previous;
        synchronized (sessionLock) {
            previous = current;
            current = session;
        }
        if (previous != null) {
            previous.finish(PlayerProbeResult.playerError(EmbeddedPlayer.ERROR_SUPERSEDED), "superseded by a newer probe");
        }

        try {
            session.start(timeout);
            return session.result.get(timeout.plus(settleDelay).plus(WAIT_MARGIN).toMillis(), TimeUnit.MILLISECONDS);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.finish(PlayerProbeResult.timeout(), "caller interrupted");
            return PlayerProbeResult.timeout();

        } catch (TimeoutException e) {
            session.finish(PlayerProbeResult.timeout(), "no outcome delivered");
            return session.result.getNow(PlayerProbeResult.timeout());

        } catch (ExecutionException e) {
            log.warn("[PlayerProbe:{}] Probe failed unexpectedly", videoId, e.getCause());
            return PlayerProbeResult.playerError(EmbeddedPlayer.ERROR_START_FAILED);

        } finally {
            synchronized (sessionLock) {
                if (current == session) {
                    current = null;
                }
            }
        }
    }

    boolean hasActiveSession() {
        synchronized (sessionLock) {
            return current != null;
        }
    }

    private final class ProbeSession implements EmbeddedPlayer.Listener {

        private final VideoIdentifier videoId;
        private final CompletableFuture<PlayerProbeResult> result = new CompletableFuture<>();
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private final AtomicBoolean settling = new AtomicBoolean(false);
        private final AtomicReference<EmbeddedPlayer> player = new AtomicReference<>();

        private volatile ScheduledFuture<?> timeoutTask;
        private volatile ScheduledFuture<?> settleTask;

        private ProbeSession(VideoIdentifier videoId) {
            this.videoId = videoId;
        }

        void start(Duration timeout) {
            timeoutTask = scheduler.schedule(
                    () -> finish(PlayerProbeResult.timeout(), "timed out after " + timeout.toMillis() + " ms"),
                    Instant.now().plus(timeout));

            EmbeddedPlayer created;
            try {
                created = playerFactory.create(videoId, PlayerOptions.silentProbe());
            } catch (RuntimeException e) {
                log.warn("[PlayerProbe:{}] Player could not be created: {}", videoId, e.getMessage());
                finish(PlayerProbeResult.playerError(EmbeddedPlayer.ERROR_START_FAILED), "player creation failed");
                return;
            }
            player.set(created);
            if (finished.get()) {
                // Superseded or timed out while the player was being created
                releasePlayer();
                return;
            }
            try {
                created.start(this);
                log.debug("[PlayerProbe:{}] Playback requested", videoId);
            } catch (RuntimeException e) {
                log.warn("[PlayerProbe:{}] Player could not start: {}", videoId, e.getMessage());
                finish(PlayerProbeResult.playerError(EmbeddedPlayer.ERROR_START_FAILED), "player start failed");
            }
        }

        @Override
        public void onStateChange(PlayerState state) {
            log.trace("[PlayerProbe:{}] State {}", videoId, state);
            if (state != PlayerState.PLAYING || finished.get() || !settling.compareAndSet(false, true)) {
                return;
            }
            settleTask = scheduler.schedule(this::readLevels, Instant.now().plus(settleDelay));
        }

        @Override
        public void onError(int errorCode) {
            finish(PlayerProbeResult.playerError(errorCode), "player error " + errorCode);
        }

        private void readLevels() {
            EmbeddedPlayer active = player.get();
            if (active == null || finished.get()) {
                return;
            }
            List<String> levels;
            try {
                levels = active.availableQualityLevels().stream()
                        .filter(level -> !AUTO_LEVEL.equalsIgnoreCase(level))
                        .toList();
            } catch (RuntimeException e) {
                log.warn("[PlayerProbe:{}] Could not read quality levels: {}", videoId, e.getMessage());
                finish(PlayerProbeResult.noLevels(), "quality levels unreadable");
                return;
            }
            if (levels.isEmpty()) {
                finish(PlayerProbeResult.noLevels(), "no quality levels reported");
            } else {
                finish(PlayerProbeResult.level(levels.get(0)), "highest level " + levels.get(0));
            }
        }

        void finish(PlayerProbeResult outcome, String reason) {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            cancel(timeoutTask);
            cancel(settleTask);
            releasePlayer();
            log.info("[PlayerProbe:{}] Finished with {} ({})", videoId, outcome.outcome(), reason);
            result.complete(outcome);
        }

        private void releasePlayer() {
            EmbeddedPlayer active = player.getAndSet(null);
            if (active == null) {
                return;
            }
            try {
                active.stop();
            } catch (RuntimeException e) {
                log.debug("[PlayerProbe:{}] Stop failed: {}", videoId, e.getMessage());
            }
            try {
                active.destroy();
            } catch (RuntimeException e) {
                log.warn("[PlayerProbe:{}] Destroy failed: {}", videoId, e.getMessage());
            }
        }

        private void cancel(ScheduledFuture<?> task) {
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
