package com.herzen.gradepipe.split;

import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;

import java.util.List;
import java.util.function.Function;

public class SplitModels {

    public record SplitConfig(List<CohortFilter> filters,
                              boolean discardNongrade,
                              int backfillColdStudents,
                              int backfillColdCourses) {
        public SplitConfig {
            if (filters == null || filters.isEmpty()) throw new IllegalArgumentException("At least one cohort filter is required");
            if (backfillColdStudents < 0) throw new IllegalArgumentException("backfillColdStudents must be >= 0");
            if (backfillColdCourses < 0) throw new IllegalArgumentException("backfillColdCourses must be >= 0");
            filters = List.copyOf(filters);
        }

        public static SplitConfig of(String filterSpecs, int termMax, boolean discardNongrade,
                                     int backfillColdStudents, int backfillColdCourses) {
            return new SplitConfig(CohortFilter.parseAll(filterSpecs, termMax), discardNongrade,
                    backfillColdStudents, backfillColdCourses);
        }
    }

    public enum BackfillKey {
        STUDENT(PreprocessedRecord::sid),
        COURSE(PreprocessedRecord::cid);

        private final Function<PreprocessedRecord, Integer> extractor;

        BackfillKey(Function<PreprocessedRecord, Integer> extractor) {
            this.extractor = extractor;
        }

        public Integer of(PreprocessedRecord record) {
            return extractor.apply(record);
        }
    }
}
