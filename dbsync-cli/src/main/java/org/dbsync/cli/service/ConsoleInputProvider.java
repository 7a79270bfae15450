package org.dbsync.cli.service;

import org.dbsync.migration.TableSummary;
import org.dbsync.migration.selection.InputProvider;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;

/**
 * Prompts on the console and reads one line per choice. End of input reads
 * as "q" so a closed stdin never records decisions the operator did not make.
 */
public class ConsoleInputProvider implements InputProvider {
    static final String QUIT_TOKEN = "q";

    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleInputProvider(BufferedReader in, PrintWriter out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public String nextToken(TableSummary summary) {
        out.printf("%nWhat to do with table '%s'?%n", summary.getTableName());
        out.print("   Choose (1 = structure only, 2 = structure + data, s = skip, d = details, q = quit) [s]: ");
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                out.println();
                out.flush();
                return QUIT_TOKEN;
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read choice", e);
        }
    }
}
