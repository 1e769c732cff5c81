package com.herzen.gradepipe.preprocess;

import com.herzen.gradepipe.config.PipelineProperties;
import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;
import com.herzen.gradepipe.idmap.IdMapModels.IdMap;
import com.herzen.gradepipe.idmap.IdMapModels.IdMapKind;
import com.herzen.gradepipe.idmap.IdMapModels.NaturalKey;
import com.herzen.gradepipe.idmap.IdentifierMapper;
import com.herzen.gradepipe.parser.DelimitedTableParser;
import com.herzen.gradepipe.parser.DelimitedTableWriter;
import com.herzen.gradepipe.parser.ParserDtos.Table;
import com.herzen.gradepipe.parser.TableFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.*;

@Service
public class RecordPreprocessor {
    private static final Logger log = LoggerFactory.getLogger(RecordPreprocessor.class);

    static final String GRADE = "GRADE";
    static final String GRDPTS = "grdpts";
    static final String COHORT = "cohort";
    static final List<String> FIXED_COLUMNS = List.of(IdMapKind.STUDENT.idColumn(), IdMapKind.COURSE.idColumn(),
            IdMapKind.INSTRUCTOR.idColumn(), IdMapKind.TERM.idColumn(), COHORT, GRADE, GRDPTS);

    private final DelimitedTableParser parser;
    private final DelimitedTableWriter writer;
    private final Set<String> droppedColumns;

    public RecordPreprocessor(DelimitedTableParser parser, DelimitedTableWriter writer, PipelineProperties properties) {
        this.parser = parser;
        this.writer = writer;
        this.droppedColumns = Set.copyOf(properties.preprocess().droppedColumns());
    }

    public List<PreprocessedRecord> preprocess(Table courses, Table admissions, Map<IdMapKind, IdMap> idMaps) {
        Map<IdMapKind, int[]> keyIndexes = new EnumMap<>(IdMapKind.class);
        for (IdMapKind kind : IdMapKind.values()) {
            if (!idMaps.containsKey(kind)) throw new IllegalArgumentException("Missing id map " + kind);
            keyIndexes.put(kind, kind.keyColumns().stream().mapToInt(courses::columnIndex).toArray());
        }
        int gradeIdx = courses.columnIndex(GRADE);
        int pointsIdx = courses.columnIndex(GRDPTS);
        int studentIdx = keyIndexes.get(IdMapKind.STUDENT)[0];

        Map<String, Integer> cohorts = cohortsByStudent(admissions, idMaps.get(IdMapKind.TERM));

        Set<String> consumed = new HashSet<>(droppedColumns);
        consumed.add(GRADE);
        consumed.add(GRDPTS);
        for (IdMapKind kind : IdMapKind.values()) consumed.addAll(kind.keyColumns());
        List<String> kept = courses.header().stream().filter(c -> !consumed.contains(c) && !FIXED_COLUMNS.contains(c)).toList();
        int[] keptIdx = kept.stream().mapToInt(courses::columnIndex).toArray();

        List<PreprocessedRecord> records = new ArrayList<>(courses.size());
        int joinMisses = 0;
        int ungraded = 0;
        for (List<String> row : courses.rows()) {
            Integer[] ids = new Integer[IdMapKind.values().length];
            for (IdMapKind kind : IdMapKind.values()) {
                NaturalKey key = IdentifierMapper.keyOf(row, keyIndexes.get(kind));
                ids[kind.ordinal()] = idMaps.get(kind).indexOf(key);
                if (ids[kind.ordinal()] == null) joinMisses++;
            }

            String grade = row.get(gradeIdx).trim();
            Double points = parsePoints(row.get(pointsIdx));
            if (points == null) points = GradePoints.resolve(grade);
            if (points == null) ungraded++;

            Map<String, String> attributes = new LinkedHashMap<>();
            for (int i = 0; i < kept.size(); i++) {
                attributes.put(kept.get(i), row.get(keptIdx[i]));
            }

            records.add(new PreprocessedRecord(
                    ids[IdMapKind.STUDENT.ordinal()],
                    ids[IdMapKind.COURSE.ordinal()],
                    ids[IdMapKind.INSTRUCTOR.ordinal()],
                    ids[IdMapKind.TERM.ordinal()],
                    cohorts.get(row.get(studentIdx)),
                    grade,
                    points,
                    attributes));
        }

        if (joinMisses > 0) log.warn("{} id lookups missed their id map; affected records keep a missing id", joinMisses);
        log.info("Preprocessed {} enrollment records ({} without quality points), kept columns {}", records.size(), ungraded, kept);
        return records;
    }

    Map<String, Integer> cohortsByStudent(Table admissions, IdMap termMap) {
        if (admissions.header().size() < 2) {
            throw new TableFormatException(admissions.source(), 1, "admissions table needs student id and admission term columns");
        }
        Map<String, Integer> cohorts = new HashMap<>();
        for (List<String> row : admissions.rows()) {
            if (cohorts.containsKey(row.get(0))) continue;
            cohorts.put(row.get(0), termMap.indexOf(NaturalKey.of(row.get(1))));
        }
        return cohorts;
    }

    private Double parsePoints(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public void write(List<PreprocessedRecord> records, Path file) {
        List<String> attributeColumns = records.isEmpty() ? List.of() : List.copyOf(records.get(0).attributes().keySet());
        List<String> header = new ArrayList<>(FIXED_COLUMNS);
        header.addAll(attributeColumns);

        List<List<String>> rows = new ArrayList<>(records.size());
        for (PreprocessedRecord r : records) {
            List<String> row = new ArrayList<>(header.size());
            row.add(cell(r.sid()));
            row.add(cell(r.cid()));
            row.add(cell(r.iid()));
            row.add(cell(r.termnum()));
            row.add(cell(r.cohort()));
            row.add(r.grade() == null ? "" : r.grade());
            row.add(cell(r.grdpts()));
            attributeColumns.forEach(c -> row.add(r.attributes().getOrDefault(c, "")));
            rows.add(row);
        }
        writer.write(file, header, rows, ',');
    }

    public List<PreprocessedRecord> read(Path file) {
        Table table = parser.read(file, ',');
        int[] fixed = FIXED_COLUMNS.stream().mapToInt(table::columnIndex).toArray();
        List<String> attributeColumns = table.header().stream().filter(c -> !FIXED_COLUMNS.contains(c)).toList();
        int[] attrIdx = attributeColumns.stream().mapToInt(table::columnIndex).toArray();

        List<PreprocessedRecord> records = new ArrayList<>(table.size());
        for (int i = 0; i < table.rows().size(); i++) {
            List<String> row = table.rows().get(i);
            int lineNo = i + 2;
            Map<String, String> attributes = new LinkedHashMap<>();
            for (int a = 0; a < attributeColumns.size(); a++) {
                attributes.put(attributeColumns.get(a), row.get(attrIdx[a]));
            }
            records.add(new PreprocessedRecord(
                    intCell(table, row.get(fixed[0]), lineNo),
                    intCell(table, row.get(fixed[1]), lineNo),
                    intCell(table, row.get(fixed[2]), lineNo),
                    intCell(table, row.get(fixed[3]), lineNo),
                    intCell(table, row.get(fixed[4]), lineNo),
                    row.get(fixed[5]),
                    parsePoints(row.get(fixed[6])),
                    attributes));
        }
        return records;
    }

    private static String cell(Object value) {
        return value == null ? "" : value.toString();
    }

    private static Integer intCell(Table table, String raw, int lineNo) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new TableFormatException(table.source(), lineNo, "not an integer id: " + raw);
        }
    }
}
