package com.example.tubefetch.service;

import com.example.tubefetch.domain.PrimaryMetadata;
import com.example.tubefetch.domain.VideoIdentifier;
import com.example.tubefetch.exceptions.UpstreamUnavailableException;

import java.util.Optional;

/**
 * Optional structured metadata API consulted before the extraction engine.
 */
public interface PrimaryMetadataSource {

    /**
     * @return empty when the source is not configured or does not know the video.
     * @throws UpstreamUnavailableException when the source is down, unauthorized or over quota.
     */
    Optional<PrimaryMetadata> fetch(VideoIdentifier videoId) throws UpstreamUnavailableException;
}
