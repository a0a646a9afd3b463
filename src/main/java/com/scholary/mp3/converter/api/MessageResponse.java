package com.scholary.mp3.converter.api;

/** Plain message body used for confirmations and errors. */
public record MessageResponse(String message) {}
