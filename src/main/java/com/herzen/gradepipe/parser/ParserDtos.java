package com.herzen.gradepipe.parser;

import java.util.List;

public class ParserDtos {
    public record Table(String source, List<String> header, List<List<String>> rows) {
        public Table {
            header = List.copyOf(header);
            rows = rows.stream().map(List::copyOf).toList();
        }

        public int columnIndex(String column) {
            int idx = header.indexOf(column);
            if (idx < 0) {
                throw new TableFormatException(source, 1, "missing required column '" + column + "'");
            }
            return idx;
        }

        public int size() {
            return rows.size();
        }
    }
}
