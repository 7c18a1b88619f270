package org.learningjava.hpes.application.port;

import org.learningjava.hpes.domain.model.TextLayer;

/** Reads the text layer of a binary container (DOCX, PDF). */
public interface TextLayerExtractorPort {

    String format();

    /**
     * @param mimeType may be null
     */
    boolean supports(String fileName, String mimeType, byte[] content);

    /**
     * @throws org.learningjava.hpes.domain.model.InputDecodeException when the container cannot be opened
     */
    TextLayer extract(byte[] content);
}
