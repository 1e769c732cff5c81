package com.herzen.gradepipe.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DomainModels {

    public record PreprocessedRecord(Integer sid,
                                     Integer cid,
                                     Integer iid,
                                     Integer termnum,
                                     Integer cohort,
                                     String grade,
                                     Double grdpts,
                                     Map<String, String> attributes) {
        public PreprocessedRecord {
            attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public boolean hasGradePoints() {
            return grdpts != null;
        }
    }

    public record Split(List<PreprocessedRecord> train, List<PreprocessedRecord> test) {
        public Split {
            train = List.copyOf(train);
            test = List.copyOf(test);
        }

        public int size() {
            return train.size() + test.size();
        }
    }
}
