package com.example.tubefetch.service;

import com.example.tubefetch.domain.VideoIdentifier;

import java.time.Duration;

/**
 * Plays a video muted in an embedded player and reads back the quality tiers the player offers.
 * Never fails: every problem is reported as a {@link PlayerProbeResult} outcome.
 */
public interface PlayerProbe {

    PlayerProbeResult probe(VideoIdentifier videoId, Duration timeout);
}
