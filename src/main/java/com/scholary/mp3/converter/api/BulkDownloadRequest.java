package com.scholary.mp3.converter.api;

import java.util.List;

/** Request to download several completed conversions as one ZIP archive. */
public record BulkDownloadRequest(List<Long> ids) {}
