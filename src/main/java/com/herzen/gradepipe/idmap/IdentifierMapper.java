package com.herzen.gradepipe.idmap;

import com.herzen.gradepipe.idmap.IdMapModels.IdMap;
import com.herzen.gradepipe.idmap.IdMapModels.IdMapKind;
import com.herzen.gradepipe.idmap.IdMapModels.NaturalKey;
import com.herzen.gradepipe.parser.DelimitedTableParser;
import com.herzen.gradepipe.parser.DelimitedTableWriter;
import com.herzen.gradepipe.parser.ParserDtos.Table;
import com.herzen.gradepipe.parser.TableFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;

@Component
public class IdentifierMapper {
    private static final Logger log = LoggerFactory.getLogger(IdentifierMapper.class);
    private static final String INDEX_COLUMN = "index";

    private final DelimitedTableParser parser;
    private final DelimitedTableWriter writer;

    public IdentifierMapper(DelimitedTableParser parser, DelimitedTableWriter writer) {
        this.parser = parser;
        this.writer = writer;
    }

    public Map<IdMapKind, IdMap> buildAll(Table enrollments) {
        Map<IdMapKind, IdMap> maps = new EnumMap<>(IdMapKind.class);
        for (IdMapKind kind : IdMapKind.values()) {
            maps.put(kind, build(enrollments, kind));
        }
        return maps;
    }

    public IdMap build(Table table, IdMapKind kind) {
        IdMap map = build(table, kind.keyColumns());
        log.info("Built {} id map: {} distinct keys over {} rows", kind, map.size(), table.size());
        return map;
    }

    public IdMap build(Table table, List<String> keyColumns) {
        int[] idx = keyColumns.stream().mapToInt(table::columnIndex).toArray();
        List<NaturalKey> keys = new ArrayList<>(table.size());
        for (List<String> row : table.rows()) {
            keys.add(keyOf(row, idx));
        }
        return new IdMap(keyColumns, keys);
    }

    public static NaturalKey keyOf(List<String> row, int[] columnIndexes) {
        String[] values = new String[columnIndexes.length];
        for (int i = 0; i < columnIndexes.length; i++) {
            values[i] = row.get(columnIndexes[i]);
        }
        return NaturalKey.of(values);
    }

    public void write(IdMap map, Path file) {
        List<String> header = new ArrayList<>();
        header.add(INDEX_COLUMN);
        header.addAll(map.keyColumns());

        List<List<String>> rows = new ArrayList<>(map.size());
        List<NaturalKey> keys = map.keys();
        for (int i = 0; i < keys.size(); i++) {
            List<String> row = new ArrayList<>();
            row.add(Integer.toString(i));
            row.addAll(keys.get(i).values());
            rows.add(row);
        }
        writer.write(file, header, rows, ',');
    }

    public IdMap read(Path file, IdMapKind kind) {
        Table table = parser.read(file, ',');
        int indexCol = table.columnIndex(INDEX_COLUMN);
        int[] keyIdx = kind.keyColumns().stream().mapToInt(table::columnIndex).toArray();

        List<NaturalKey> keys = new ArrayList<>(table.size());
        for (int i = 0; i < table.rows().size(); i++) {
            List<String> row = table.rows().get(i);
            if (!Integer.toString(i).equals(row.get(indexCol).trim())) {
                throw new TableFormatException(table.source(), i + 2, "id map index is not contiguous at row " + i);
            }
            keys.add(keyOf(row, keyIdx));
        }
        return new IdMap(kind.keyColumns(), keys);
    }
}
