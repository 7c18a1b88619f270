package org.learningjava.hpes.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Input of a single extraction run.
 *
 * @param fileName         file name or repository-relative path, also used as source file id
 * @param declaredLanguage caller-declared language id or alias; may be null
 * @param mimeType         optional MIME hint for container sniffing; may be null
 */
public record ExtractionRequest(byte[] content, String fileName, String declaredLanguage, String mimeType) {

    public ExtractionRequest {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(fileName, "fileName");
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ExtractionRequest other
                && Arrays.equals(content, other.content)
                && fileName.equals(other.fileName)
                && Objects.equals(declaredLanguage, other.declaredLanguage)
                && Objects.equals(mimeType, other.mimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(content), fileName, declaredLanguage, mimeType);
    }

    @Override
    public String toString() {
        return "ExtractionRequest[fileName=" + fileName + ", bytes=" + content.length
                + ", declaredLanguage=" + declaredLanguage + ", mimeType=" + mimeType + "]";
    }

    public static ExtractionRequest of(String fileName, byte[] content) {
        return new ExtractionRequest(content, fileName, null, null);
    }

    public static ExtractionRequest of(String fileName, String text) {
        return of(fileName, text.getBytes(StandardCharsets.UTF_8));
    }
}
