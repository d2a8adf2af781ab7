package com.example.tubefetch.service.impl;

import com.example.tubefetch.domain.ExtractedVideo;
import com.example.tubefetch.domain.FormatDescriptor;
import com.example.tubefetch.domain.InfoSource;
import com.example.tubefetch.domain.PrimaryMetadata;
import com.example.tubefetch.domain.QualityResolution;
import com.example.tubefetch.domain.ResolvedMetadata;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.domain.VideoIdentifiers;
import com.example.tubefetch.domain.VideoMetadata;
import com.example.tubefetch.exceptions.ExtractionException;
import com.example.tubefetch.exceptions.InvalidVideoUrlException;
import com.example.tubefetch.exceptions.MetadataTimeoutException;
import com.example.tubefetch.exceptions.UpstreamUnavailableException;
import com.example.tubefetch.service.ExtractionEngine;
import com.example.tubefetch.service.MetadataService;
import com.example.tubefetch.service.PlayerProbe;
import com.example.tubefetch.service.PrimaryMetadataSource;
import com.example.tubefetch.service.QualityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the metadata API, the extraction engine and (when available) the player probe concurrently
 * and merges their answers under one overall deadline.
 */
@Service
public class MetadataServiceImpl implements MetadataService {

    private static final Logger log = LoggerFactory.getLogger(MetadataServiceImpl.class);

    static final String NO_FORMATS_MESSAGE = "No downloadable formats were reported";

    private final PrimaryMetadataSource primarySource;
    private final ExtractionEngine extractionEngine;
    private final ObjectProvider<PlayerProbe> playerProbeProvider;
    private final QualityResolver qualityResolver;
    private final AsyncTaskExecutor asyncTaskExecutor;
    private final long metadataTimeoutMs;
    private final long probeTimeoutMs;

    public MetadataServiceImpl(
            PrimaryMetadataSource primarySource,
            ExtractionEngine extractionEngine,
            ObjectProvider<PlayerProbe> playerProbeProvider,
            QualityResolver qualityResolver,
            @Qualifier("asyncTaskExecutor") AsyncTaskExecutor asyncTaskExecutor,
            @Value("${metadata.timeout-ms:30000}") long metadataTimeoutMs,
            @Value("${player-probe.timeout-ms:15000}") long probeTimeoutMs
    ) {
        this.primarySource = primarySource;
        this.extractionEngine = extractionEngine;
        this.playerProbeProvider = playerProbeProvider;
        this.qualityResolver = qualityResolver;
        this.asyncTaskExecutor = asyncTaskExecutor;
        this.metadataTimeoutMs = metadataTimeoutMs;
        this.probeTimeoutMs = probeTimeoutMs;
    }

    @Override
    public ResolvedMetadata fetch(String url, String clientPlayerLevel) {
        VideoIdentifier videoId = VideoIdentifiers.extract(url).orElseThrow(InvalidVideoUrlException::new);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(metadataTimeoutMs);
        log.info("[Metadata:{}] Lookup started", videoId);

        CompletableFuture<Optional<PrimaryMetadata>> primaryFuture =
                CompletableFuture.supplyAsync(() -> fetchPrimary(videoId), asyncTaskExecutor);
        CompletableFuture<ExtractedVideo> engineFuture =
                CompletableFuture.supplyAsync(() -> extractionEngine.extract(videoId), asyncTaskExecutor);
        CompletableFuture<Optional<String>> levelFuture = playerLevel(videoId, clientPlayerLevel);

        ExtractedVideo extracted = null;
        String engineError = null;
        try {
            extracted = engineFuture.get(remainingMillis(deadline), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            engineFuture.cancel(true);
            primaryFuture.cancel(true);
            levelFuture.cancel(true);
            log.warn("[Metadata:{}] Lookup exceeded {} ms", videoId, metadataTimeoutMs);
            throw new MetadataTimeoutException("Metadata lookup for " + videoId + " timed out");
        } catch (ExecutionException e) {
            engineError = engineErrorMessage(e.getCause());
            log.warn("[Metadata:{}] Extraction engine failed: {}", videoId, engineError);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataTimeoutException("Metadata lookup for " + videoId + " was interrupted");
        }

        Optional<PrimaryMetadata> primary = await(primaryFuture, deadline, videoId, "Metadata API")
                .flatMap(value -> value);
        Optional<String> playerLevel = await(levelFuture, deadline, videoId, "Player probe")
                .flatMap(value -> value);

        VideoMetadata metadata = merge(videoId, primary.orElse(null), extracted, engineError);
        QualityResolution quality = qualityResolver.resolve(playerLevel.orElse(null), metadata.formats());
        log.info("[Metadata:{}] Resolved from {} with quality '{}' ({}), {} formats",
                videoId, metadata.infoSource(), quality.bestQuality().label(),
                quality.bestQuality().source(), metadata.formats().size());
        return new ResolvedMetadata(metadata, quality);
    }

    VideoMetadata merge(VideoIdentifier videoId, PrimaryMetadata primary, ExtractedVideo extracted, String engineError) {
        if (extracted == null) {
            if (primary == null) {
                throw new ExtractionException(engineError != null ? engineError : ErrorSummaries.NO_ENGINE_OUTPUT);
            }
            return new VideoMetadata(videoId,
                    primary.title(), primary.uploader(), primary.channelLogoUrl(), primary.thumbnailUrl(),
                    primary.viewCount(), primary.likeCount(), primary.subscriberCount(), primary.durationSeconds(),
                    List.of(), InfoSource.PRIMARY_API, true, engineError);
        }

        List<FormatDescriptor> formats = extracted.formats();
        boolean noFormats = formats == null || formats.isEmpty();
        InfoSource source = noFormats
                ? InfoSource.EXTRACTION_ENGINE_DEGRADED
                : primary != null ? InfoSource.PRIMARY_API : InfoSource.EXTRACTION_ENGINE;

        return new VideoMetadata(videoId,
                firstNonNull(primary != null ? primary.title() : null, extracted.title()),
                firstNonNull(primary != null ? primary.uploader() : null, extracted.uploader()),
                primary != null ? primary.channelLogoUrl() : null,
                firstNonNull(primary != null ? primary.thumbnailUrl() : null, extracted.thumbnailUrl()),
                firstNonNull(primary != null ? primary.viewCount() : null, extracted.viewCount()),
                firstNonNull(primary != null ? primary.likeCount() : null, extracted.likeCount()),
                firstNonNull(primary != null ? primary.subscriberCount() : null, extracted.subscriberCount()),
                firstNonNull(primary != null ? primary.durationSeconds() : null, extracted.durationSeconds()),
                formats,
                source,
                noFormats,
                noFormats ? NO_FORMATS_MESSAGE : null);
    }

    private Optional<PrimaryMetadata> fetchPrimary(VideoIdentifier videoId) {
        try {
            return primarySource.fetch(videoId);
        } catch (UpstreamUnavailableException e) {
            log.warn("[Metadata:{}] Metadata API unavailable, using the extraction engine only: {}",
                    videoId, e.getMessage());
            return Optional.empty();
        }
    }

    private CompletableFuture<Optional<String>> playerLevel(VideoIdentifier videoId, String clientPlayerLevel) {
        if (clientPlayerLevel != null && !clientPlayerLevel.isBlank()) {
            log.debug("[Metadata:{}] Using client-reported player level '{}'", videoId, clientPlayerLevel);
            return CompletableFuture.completedFuture(Optional.of(clientPlayerLevel.trim()));
        }
        PlayerProbe probe = playerProbeProvider.getIfAvailable();
        if (probe == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        Duration timeout = Duration.ofMillis(probeTimeoutMs);
        return CompletableFuture.supplyAsync(() -> probe.probe(videoId, timeout).levelIfPresent(), asyncTaskExecutor);
    }

    private <T> Optional<T> await(CompletableFuture<T> future, long deadline, VideoIdentifier videoId, String what) {
        try {
            return Optional.ofNullable(future.get(remainingMillis(deadline), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Metadata:{}] {} did not answer in time, ignoring it", videoId, what);
        } catch (ExecutionException e) {
            log.warn("[Metadata:{}] {} failed, ignoring it", videoId, what, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Metadata:{}] Interrupted while waiting for {}", videoId, what);
        }
        return Optional.empty();
    }

    private static String engineErrorMessage(Throwable cause) {
        if (cause instanceof ExtractionException && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return ErrorSummaries.summarize(cause);
    }

    private static long remainingMillis(long deadline) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
