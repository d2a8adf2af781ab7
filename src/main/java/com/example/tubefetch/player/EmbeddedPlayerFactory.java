package com.example.tubefetch.player;

import com.example.tubefetch.domain.VideoIdentifier;

@FunctionalInterface
public interface EmbeddedPlayerFactory {

    EmbeddedPlayer create(VideoIdentifier videoId, PlayerOptions options);
}
