package com.herzen.gradepipe.idmap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class IdMapModels {

    public record NaturalKey(List<String> values) {
        public NaturalKey {
            values = List.copyOf(values);
        }

        public static NaturalKey of(String... values) {
            return new NaturalKey(List.of(values));
        }
    }

    public enum IdMapKind {
        STUDENT("sid", "student-id-map.csv", List.of("id")),
        COURSE("cid", "course-id-map.csv", List.of("DISC", "CNUM", "HRS")),
        INSTRUCTOR("iid", "instructor-id-map.csv", List.of("INSTR_LNAME", "INSTR_FNAME")),
        TERM("termnum", "ordinal-term-map.csv", List.of("TERMBNR"));

        private final String idColumn;
        private final String fileName;
        private final List<String> keyColumns;

        IdMapKind(String idColumn, String fileName, List<String> keyColumns) {
            this.idColumn = idColumn;
            this.fileName = fileName;
            this.keyColumns = keyColumns;
        }

        public String idColumn() {
            return idColumn;
        }

        public String fileName() {
            return fileName;
        }

        public List<String> keyColumns() {
            return keyColumns;
        }
    }

    public static final class IdMap {
        private final List<String> keyColumns;
        private final Map<NaturalKey, Integer> indexByKey;

        IdMap(List<String> keyColumns, List<NaturalKey> orderedKeys) {
            this.keyColumns = List.copyOf(keyColumns);
            Map<NaturalKey, Integer> index = new LinkedHashMap<>();
            for (NaturalKey key : orderedKeys) {
                if (key.values().size() != keyColumns.size()) {
                    throw new IllegalArgumentException("Key " + key.values() + " does not match columns " + keyColumns);
                }
                index.putIfAbsent(key, index.size());
            }
            this.indexByKey = Collections.unmodifiableMap(index);
        }

        public List<String> keyColumns() {
            return keyColumns;
        }

        public Integer indexOf(NaturalKey key) {
            return indexByKey.get(key);
        }

        public List<NaturalKey> keys() {
            return List.copyOf(indexByKey.keySet());
        }

        public int size() {
            return indexByKey.size();
        }
    }
}
