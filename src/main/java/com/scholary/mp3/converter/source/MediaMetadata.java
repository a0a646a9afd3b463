package com.scholary.mp3.converter.source;

/**
 * Metadata discovered for a media URL.
 *
 * @param title raw title as published, not yet safe for file names
 * @param durationSeconds media length if the source reports it, otherwise null
 */
public record MediaMetadata(String title, Double durationSeconds) {}
