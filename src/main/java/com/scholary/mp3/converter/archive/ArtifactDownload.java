package com.scholary.mp3.converter.archive;

import java.io.InputStream;

/**
 * An open artifact ready to be sent to a client. The receiver must close {@code content}.
 *
 * @param fileName suggested download name
 * @param size length in bytes as recorded on the job
 * @param content artifact bytes
 */
public record ArtifactDownload(String fileName, Long size, InputStream content) {}
