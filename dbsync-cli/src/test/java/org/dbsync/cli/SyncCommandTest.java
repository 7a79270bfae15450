package org.dbsync.cli;

import org.dbsync.cli.service.ComparisonService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyncCommandTest {

    @TempDir
    Path tempDir;

    private Path source;
    private Path target;
    private Path outputDir;
    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws URISyntaxException {
        source = Path.of(getClass().getResource("/snapshots/source.json").toURI());
        target = Path.of(getClass().getResource("/snapshots/target.json").toURI());
        outputDir = tempDir.resolve("out");
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalErr = System.err;
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setErr(originalErr);
    }

    private int run(String input, String... extraArgs) {
        SyncCommand command = new SyncCommand(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(outContent, true, StandardCharsets.UTF_8),
                new ComparisonService());
        List<String> args = new ArrayList<>(List.of(
                "--config-dir", tempDir.toString(),
                "--source-snapshot", source.toString(),
                "--out", outputDir.toString()));
        args.addAll(List.of(extraArgs));
        return new CommandLine(command).execute(args.toArray(String[]::new));
    }

    private String out() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Decisions drive the generated structure and data scripts")
    void generatesScripts() throws IOException {
        int exitCode = run("1\n2\ns\n", "--target-snapshot", target.toString());

        assertThat(exitCode).isZero();
        assertThat(out())
                .contains("DATABASE DIFFERENCES ANALYSIS")
                .contains("[1/3] customers (new table)")
                .contains("customers: Structure only")
                .contains("orders: Structure + data")
                .contains("users: Skipped")
                .contains("Reported but never auto-applied (2)")
                .contains("users.legacy_flag (column only exists on target)")
                .contains("audit_log (table only exists on target)");

        String structure = Files.readString(outputDir.resolve("sync_database_structure.sql"));
        assertThat(structure)
                .contains("-- Source: shop -> Target: shop_copy")
                .contains("USE `shop_copy`;")
                .doesNotContain("DROP")
                .endsWith("SET FOREIGN_KEY_CHECKS = 1;\n");
        assertThat(structure.indexOf("CREATE TABLE `customers`"))
                .isPositive()
                .isLessThan(structure.indexOf("CREATE TABLE `orders`"));

        String data = Files.readString(outputDir.resolve("sync_database_data.sql"));
        assertThat(data).contains("-- Table `orders` has 2,000,000 rows (threshold 50,000)");
    }

    @Test
    @DisplayName("Threshold and base name options override the defaults")
    void thresholdAndName() throws IOException {
        int exitCode = run("s\n2\ns\n", "--target-snapshot", target.toString(),
                "--threshold", "5000000", "--name", "nightly");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("nightly_data.sql")))
                .contains("Table `orders` has 2,000,000 rows: small enough for direct row-level synchronization.");
    }

    @Test
    @DisplayName("Quitting writes nothing")
    void quit() {
        int exitCode = run("1\nq\n", "--target-snapshot", target.toString());

        assertThat(exitCode).isZero();
        assertThat(out()).contains("Operation cancelled by user.");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    @DisplayName("End of input is treated as quit")
    void endOfInput() {
        int exitCode = run("", "--target-snapshot", target.toString());

        assertThat(exitCode).isZero();
        assertThat(out()).contains("Operation cancelled by user.");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    @DisplayName("Invalid choices are rejected and asked again")
    void invalidChoice() {
        int exitCode = run("7\nd\ns\ns\ns\n", "--target-snapshot", target.toString(), "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(out())
                .contains("Invalid choice '7'. Expected 1, 2, s, d or q.")
                .contains("TABLE DETAILS: customers")
                .contains("Dry run: no files written.");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    @DisplayName("Identical snapshots need no decisions")
    void alreadySynchronized() {
        int exitCode = run("", "--target-snapshot", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out()).contains("Databases are already synchronized!");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    @DisplayName("A side with neither snapshot nor connection fails with exit code 1")
    void missingTarget() {
        int exitCode = run("");

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("No target connection configured");
    }

    @Test
    @DisplayName("An unreadable snapshot fails with exit code 1")
    void missingSnapshotFile() {
        int exitCode = run("", "--target-snapshot", tempDir.resolve("nope.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Synchronization failed").contains("Snapshot file not found");
    }
}
