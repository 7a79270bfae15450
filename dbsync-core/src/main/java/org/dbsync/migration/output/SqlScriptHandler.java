package org.dbsync.migration.output;

import lombok.extern.slf4j.Slf4j;
import org.dbsync.migration.GenerationResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@code <base>_structure.sql} with the generated statements and, when
 * there is any guidance, {@code <base>_data.sql} with it as SQL comments.
 */
@Slf4j
public class SqlScriptHandler implements OutputHandler {
    public static final String STRUCTURE_SUFFIX = "_structure.sql";
    public static final String DATA_SUFFIX = "_data.sql";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public List<Path> handle(GenerationResult result, ScriptInfo info, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();

        Path structure = outputDir.resolve(info.getBaseName() + STRUCTURE_SUFFIX);
        Files.writeString(structure, structureScript(result, info), StandardCharsets.UTF_8);
        written.add(structure);
        log.debug("Wrote {} statements to {}", result.getStatements().size(), structure);

        if (!result.getGuidance().isEmpty()) {
            Path data = outputDir.resolve(info.getBaseName() + DATA_SUFFIX);
            Files.writeString(data, dataScript(result, info), StandardCharsets.UTF_8);
            written.add(data);
        }
        return written;
    }

    String structureScript(GenerationResult result, ScriptInfo info) {
        StringBuilder sb = new StringBuilder(header("Structure Synchronization Script", info));
        for (String statement : result.getStatements()) {
            sb.append(statement).append("\n\n");
        }
        return sb.toString().stripTrailing() + "\n";
    }

    String dataScript(GenerationResult result, ScriptInfo info) {
        StringBuilder sb = new StringBuilder(header("Data Synchronization Guidance", info));
        if (info.getTargetDatabase() != null) {
            sb.append("USE `").append(info.getTargetDatabase().replace("`", "``")).append("`;\n\n");
        }
        for (String line : result.getGuidance()) {
            for (String part : line.split("\\R")) {
                sb.append("-- ").append(part).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString().stripTrailing() + "\n";
    }

    private String header(String title, ScriptInfo info) {
        return String.format("""
            -- %s
            -- Generated on: %s
            -- Source: %s -> Target: %s

            """,
            title,
            info.getGeneratedAt().format(TIMESTAMP),
            info.getSourceDatabase(),
            info.getTargetDatabase()
        );
    }
}
