package org.learningjava.hpes.domain.model;

/**
 * Text recovered from a container document.
 *
 * @param skippedObjects embedded pictures, OLE objects, attachments and images left out
 */
public record TextLayer(String format, String text, int skippedObjects) {
}
