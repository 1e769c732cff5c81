package com.herzen.gradepipe.parser;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static com.herzen.gradepipe.parser.ParserDtos.Table;

@Component
public class DelimitedTableParser {

    public Table read(Path file, char delimiter) {
        return read(file, delimiter, true);
    }

    public Table read(Path file, char delimiter, boolean hasHeader) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString(), delimiter, hasHeader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read table " + file, e);
        }
    }

    public Table parse(String content, String source, char delimiter, boolean hasHeader) {
        List<String> lines = Arrays.stream(content.split("\\R", -1)).toList();
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNo = i + 1;
            if (line.isBlank()) continue;

            List<String> cells = splitLine(line, delimiter, source, lineNo);
            if (header == null) {
                if (hasHeader) {
                    header = cells.stream().map(String::trim).toList();
                    continue;
                }
                header = IntStream.range(0, cells.size()).mapToObj(Integer::toString).toList();
            }
            if (cells.size() != header.size()) {
                throw new TableFormatException(source, lineNo,
                        "expected " + header.size() + " cells but found " + cells.size());
            }
            rows.add(cells);
        }
        return new Table(source, header == null ? List.of() : header, rows);
    }

    private List<String> splitLine(String line, char delimiter, String source, int lineNo) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(c);
                }
            } else if (c == '"' && cell.length() == 0) {
                quoted = true;
            } else if (c == delimiter) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        if (quoted) {
            throw new TableFormatException(source, lineNo, "unterminated quoted cell");
        }
        cells.add(cell.toString());
        return cells;
    }
}
