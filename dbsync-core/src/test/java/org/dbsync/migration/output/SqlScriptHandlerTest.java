package org.dbsync.migration.output;

import org.dbsync.migration.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqlScriptHandlerTest {

    @TempDir
    Path tempDir;

    private final SqlScriptHandler handler = new SqlScriptHandler();

    private final ScriptInfo info = ScriptInfo.builder()
            .sourceDatabase("shop")
            .targetDatabase("shop_copy")
            .baseName("nightly")
            .generatedAt(LocalDateTime.of(2024, 3, 1, 12, 30, 5))
            .build();

    @Test
    @DisplayName("Writes the structure script with a header and one statement per block")
    void structureScript() throws IOException {
        GenerationResult result = GenerationResult.builder()
                .statement("SET FOREIGN_KEY_CHECKS = 0;")
                .statement("CREATE TABLE `t` (\n  `id` int NOT NULL\n);")
                .statement("SET FOREIGN_KEY_CHECKS = 1;")
                .changeCount(1)
                .build();

        List<Path> written = handler.handle(result, info, tempDir.resolve("out"));

        assertThat(written).containsExactly(tempDir.resolve("out").resolve("nightly_structure.sql"));
        assertThat(Files.readString(written.get(0))).isEqualTo("""
                -- Structure Synchronization Script
                -- Generated on: 2024-03-01 12:30:05
                -- Source: shop -> Target: shop_copy

                SET FOREIGN_KEY_CHECKS = 0;

                CREATE TABLE `t` (
                  `id` int NOT NULL
                );

                SET FOREIGN_KEY_CHECKS = 1;
                """);
    }

    @Test
    @DisplayName("Guidance goes to the data script as SQL comments")
    void dataScript() throws IOException {
        GenerationResult result = GenerationResult.builder()
                .statement("SET FOREIGN_KEY_CHECKS = 0;")
                .statement("SET FOREIGN_KEY_CHECKS = 1;")
                .guidanceLine("Table `events` has 2,000,000 rows (threshold 50,000): export externally.")
                .build();

        List<Path> written = handler.handle(result, info, tempDir);

        assertThat(written).extracting(p -> p.getFileName().toString())
                .containsExactly("nightly_structure.sql", "nightly_data.sql");
        String data = Files.readString(tempDir.resolve("nightly_data.sql"));
        assertThat(data)
                .startsWith("-- Data Synchronization Guidance\n")
                .contains("USE `shop_copy`;\n")
                .contains("-- Table `events` has 2,000,000 rows (threshold 50,000): export externally.\n");
    }

    @Test
    @DisplayName("No data script is written without guidance")
    void noGuidanceNoDataScript() throws IOException {
        GenerationResult result = GenerationResult.builder().statement("SET FOREIGN_KEY_CHECKS = 1;").build();

        handler.handle(result, info, tempDir);

        assertThat(tempDir.resolve("nightly" + SqlScriptHandler.DATA_SUFFIX)).doesNotExist();
    }
}
