package com.herzen.gradepipe.parser;

import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class DelimitedTableWriter {

    public void write(Path file, List<String> header, List<List<String>> rows, char delimiter) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                if (header != null) {
                    w.write(joinRow(header, delimiter));
                    w.write("\n");
                }
                for (List<String> row : rows) {
                    w.write(joinRow(row, delimiter));
                    w.write("\n");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write table " + file, e);
        }
    }

    public void writeLines(Path file, List<String> lines) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (String line : lines) {
                    w.write(line);
                    w.write("\n");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    private String joinRow(List<String> row, char delimiter) {
        return row.stream().map(cell -> escape(cell, delimiter)).collect(Collectors.joining(String.valueOf(delimiter)));
    }

    private String escape(String cell, char delimiter) {
        if (cell == null) return "";
        if (cell.indexOf(delimiter) >= 0 || cell.indexOf('"') >= 0) {
            return "\"" + cell.replace("\"", "\"\"") + "\"";
        }
        return cell;
    }
}
