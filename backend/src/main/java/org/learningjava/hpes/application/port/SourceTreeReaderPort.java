package org.learningjava.hpes.application.port;

import org.learningjava.hpes.domain.model.batch.SourceFile;

import java.nio.file.Path;
import java.util.List;

public interface SourceTreeReaderPort {

    /** Regular files under {@code root} as (relative path, bytes), sorted by path. */
    List<SourceFile> read(Path root);
}
