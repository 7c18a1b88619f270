package org.learningjava.hpes.domain.model.batch;

import java.util.Arrays;
import java.util.Objects;

/** Raw bytes of one repository file, keyed by its repository-relative path. */
public record SourceFile(String path, byte[] content) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SourceFile other
                && path.equals(other.path)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SourceFile[path=" + path + ", bytes=" + content.length + "]";
    }
}
