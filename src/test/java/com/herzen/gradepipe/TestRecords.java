package com.herzen.gradepipe;

import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;

import java.util.Map;

final class TestRecords {
    private TestRecords() {
    }

    static PreprocessedRecord rec(int sid, int cid, int term, Integer cohort, String grade, Double points) {
        return new PreprocessedRecord(sid, cid, 0, term, cohort, grade, points, Map.of());
    }

    static PreprocessedRecord rec(int sid, int cid, int term, Integer cohort, double points) {
        return rec(sid, cid, term, cohort, "B", points);
    }
}
