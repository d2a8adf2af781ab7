package com.example.tubefetch.service;

import com.example.tubefetch.domain.ResolvedMetadata;
import com.example.tubefetch.exceptions.ExtractionException;
import com.example.tubefetch.exceptions.InvalidVideoUrlException;
import com.example.tubefetch.exceptions.MetadataTimeoutException;

public interface MetadataService {

    /**
     * Looks up a video and resolves its quality label and selectable formats.
     *
     * @param url               the URL as submitted by the user
     * @param clientPlayerLevel quality tier reported by the caller's own embedded player, may be null
     * @throws InvalidVideoUrlException if the URL has no recognisable video id
     * @throws ExtractionException      if neither the metadata API nor the engine produced a result
     * @throws MetadataTimeoutException if the lookup exceeded its overall time budget
     */
    ResolvedMetadata fetch(String url, String clientPlayerLevel);
}
