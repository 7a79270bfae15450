package org.dbsync.migration.output;

import org.dbsync.migration.GenerationResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface OutputHandler {
    /**
     * @return the files written, in the order they were written
     */
    List<Path> handle(GenerationResult result, ScriptInfo info, Path outputDir) throws IOException;
}
