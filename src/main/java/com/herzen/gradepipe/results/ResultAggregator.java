package com.herzen.gradepipe.results;

import com.herzen.gradepipe.parser.DelimitedTableParser;
import com.herzen.gradepipe.parser.DelimitedTableWriter;
import com.herzen.gradepipe.parser.ParserDtos.Table;
import com.herzen.gradepipe.parser.TableFormatException;
import com.herzen.gradepipe.results.ResultModels.MethodResult;
import com.herzen.gradepipe.solver.SolverModels.DimensionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;

@Component
public class ResultAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);
    private static final Comparator<MethodResult> BY_TEST_ERROR = Comparator.comparingDouble(MethodResult::testError);

    private final DelimitedTableParser parser;
    private final DelimitedTableWriter writer;

    public ResultAggregator(DelimitedTableParser parser, DelimitedTableWriter writer) {
        this.parser = parser;
        this.writer = writer;
    }

    public List<MethodResult> aggregate(Map<String, List<DimensionResult>> resultsByMethod, int topN) {
        if (topN < 1) throw new IllegalArgumentException("topN must be >= 1");
        List<MethodResult> merged = new ArrayList<>();
        resultsByMethod.forEach((method, rows) -> {
            List<MethodResult> tagged = new ArrayList<>(rows.stream()
                    .map(r -> new MethodResult(method, r.dim(), r.trainError(), r.testError()))
                    .toList());
            tagged.sort(BY_TEST_ERROR);
            merged.addAll(tagged.subList(0, Math.min(topN, tagged.size())));
            if (tagged.size() < topN) log.debug("{} has only {} results, fewer than top {}", method, tagged.size(), topN);
        });
        merged.sort(BY_TEST_ERROR);
        return List.copyOf(merged);
    }

    public List<DimensionResult> readMethodResults(Path file) {
        Table table = parser.read(file, '\t', false);
        List<DimensionResult> rows = new ArrayList<>(table.size());
        for (int i = 0; i < table.rows().size(); i++) {
            List<String> row = table.rows().get(i);
            if (row.size() != 3) throw new TableFormatException(table.source(), i + 1, "expected dim, train, test");
            rows.add(new DimensionResult(
                    parseInt(table, row.get(0), i + 1),
                    parseDouble(table, row.get(1), i + 1),
                    parseDouble(table, row.get(2), i + 1)));
        }
        return rows;
    }

    public void writeMethodResults(Path file, List<DimensionResult> results) {
        writer.write(file, null, results.stream()
                .map(r -> List.of(Integer.toString(r.dim()), Double.toString(r.trainError()), Double.toString(r.testError())))
                .toList(), '\t');
    }

    public void writeLeaderboard(Path file, List<MethodResult> ranked) {
        writer.write(file, ResultModels.LEADERBOARD_HEADER, ranked.stream()
                .map(r -> List.of(r.method(), Integer.toString(r.dim()), Double.toString(r.trainError()), Double.toString(r.testError())))
                .toList(), '\t');
    }

    public List<MethodResult> readLeaderboard(Path file) {
        Table table = parser.read(file, '\t');
        int method = table.columnIndex("method");
        int dim = table.columnIndex("dim");
        int train = table.columnIndex("train");
        int test = table.columnIndex("test");
        List<MethodResult> rows = new ArrayList<>(table.size());
        for (int i = 0; i < table.rows().size(); i++) {
            List<String> row = table.rows().get(i);
            rows.add(new MethodResult(row.get(method),
                    parseInt(table, row.get(dim), i + 2),
                    parseDouble(table, row.get(train), i + 2),
                    parseDouble(table, row.get(test), i + 2)));
        }
        return rows;
    }

    private static int parseInt(Table table, String raw, int line) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new TableFormatException(table.source(), line, "dimension is not an integer: " + raw);
        }
    }

    private static double parseDouble(Table table, String raw, int line) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new TableFormatException(table.source(), line, "error value is not a number: " + raw);
        }
    }
}
