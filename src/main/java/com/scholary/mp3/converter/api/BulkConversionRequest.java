package com.scholary.mp3.converter.api;

import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request to convert several video URLs at once.
 *
 * <p>Batch size limits and URL checks are enforced by the submission service so that a bad batch
 * is rejected as a whole.
 */
public record BulkConversionRequest(@NotNull List<String> urls) {}
