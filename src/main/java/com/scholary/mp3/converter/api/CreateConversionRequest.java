package com.scholary.mp3.converter.api;

import jakarta.validation.constraints.NotBlank;

/** Request to convert a single video URL. */
public record CreateConversionRequest(@NotBlank String url) {}
