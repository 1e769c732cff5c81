package com.herzen.gradepipe.split;

import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;
import com.herzen.gradepipe.domain.DomainModels.Split;
import com.herzen.gradepipe.preprocess.GradePoints;
import com.herzen.gradepipe.split.SplitModels.BackfillKey;
import com.herzen.gradepipe.split.SplitModels.SplitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class TrainTestSplitter {
    private static final Logger log = LoggerFactory.getLogger(TrainTestSplitter.class);

    private static final Comparator<PreprocessedRecord> TERM_THEN_STUDENT =
            Comparator.comparing(PreprocessedRecord::termnum).thenComparing(PreprocessedRecord::sid);

    private final ColdStartBackfill backfill;

    public TrainTestSplitter(ColdStartBackfill backfill) {
        this.backfill = backfill;
    }

    public Split split(List<PreprocessedRecord> records, SplitConfig config) {
        List<PreprocessedRecord> data = prepare(records);

        Set<PreprocessedRecord> train = new LinkedHashSet<>();
        Set<PreprocessedRecord> test = new LinkedHashSet<>();
        for (CohortFilter filter : config.filters()) {
            List<PreprocessedRecord> filterTrain = filter.train(data);
            train.addAll(filterTrain);
            test.addAll(filter.test(data));
            log.debug("Filter {} selects {} of {} records for train", filter, filterTrain.size(), data.size());
        }
        // with several filters a record may be train for one and test for another; train wins
        test.removeAll(train);

        test.removeIf(r -> isNonGrade(r.grade()));
        if (config.discardNongrade()) {
            train.removeIf(r -> isNonGrade(r.grade()));
        }

        Split split = new Split(new ArrayList<>(train), new ArrayList<>(test));
        split = backfill.apply(split, BackfillKey.STUDENT, config.backfillColdStudents());
        split = backfill.apply(split, BackfillKey.COURSE, config.backfillColdCourses());

        log.info("Split {} records into {} train / {} test using {}", data.size(), split.train().size(), split.test().size(), config.filters());
        return split;
    }

    /**
     * Keeps one record per (student, course): the one from the latest term, and among records of the
     * same term the one that comes last in input order. Then drops records without quality points or
     * with a missing id, and sorts by (term, student); the sort is stable.
     */
    public List<PreprocessedRecord> prepare(List<PreprocessedRecord> records) {
        List<PreprocessedRecord> keyed = records.stream()
                .filter(r -> r.sid() != null && r.cid() != null && r.termnum() != null)
                .toList();
        if (keyed.size() < records.size()) {
            log.warn("Dropping {} records with a missing student, course or term id", records.size() - keyed.size());
        }

        Map<List<Integer>, Integer> latest = new HashMap<>();
        for (int i = 0; i < keyed.size(); i++) {
            PreprocessedRecord r = keyed.get(i);
            List<Integer> pair = List.of(r.sid(), r.cid());
            Integer previous = latest.get(pair);
            if (previous == null || keyed.get(previous).termnum() <= r.termnum()) {
                latest.put(pair, i);
            }
        }

        List<PreprocessedRecord> kept = new ArrayList<>(latest.size());
        int ungraded = 0;
        for (int i = 0; i < keyed.size(); i++) {
            PreprocessedRecord r = keyed.get(i);
            if (latest.get(List.of(r.sid(), r.cid())) != i) continue;
            if (!r.hasGradePoints()) {
                ungraded++;
                continue;
            }
            kept.add(r);
        }
        if (ungraded > 0) log.warn("Dropping {} most-recent records without quality points", ungraded);

        kept.sort(TERM_THEN_STUDENT);
        return kept;
    }

    static boolean isNonGrade(String grade) {
        return grade != null && GradePoints.NON_GRADES.contains(grade.trim());
    }
}
