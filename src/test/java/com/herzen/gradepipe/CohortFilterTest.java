package com.herzen.gradepipe;

import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;
import com.herzen.gradepipe.split.CohortFilter;
import com.herzen.gradepipe.split.FilterSpecException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.herzen.gradepipe.TestRecords.rec;
import static org.junit.jupiter.api.Assertions.*;

class CohortFilterTest {
    private static final int TERM_MAX = 14;

    @Test
    void cohortOnlyFormCoversEveryTerm() {
        CohortFilter filter = CohortFilter.parse("0-4", TERM_MAX);
        assertEquals(new CohortFilter(0, 4, 0, 14), filter);
        assertEquals("0_4T0_14", filter.toString());
    }

    @Test
    void explicitTermRangeAndOpenEndedSingleValues() {
        assertEquals("2_5T3_7", CohortFilter.parse("2-5:3-7", TERM_MAX).toString());
        assertEquals("3_14T6_14", CohortFilter.parse("3:6", TERM_MAX).toString());
        assertEquals("1_2T4_14", CohortFilter.parse("1-2:4", TERM_MAX).toString());
        assertEquals("1_14T0_0", CohortFilter.parse(" 1:0-0 ", TERM_MAX).toString());
    }

    @Test
    void parsesWhitespaceSeparatedList() {
        List<CohortFilter> filters = CohortFilter.parseAll("0-4  5-7:0-3", TERM_MAX);
        assertEquals(List.of(new CohortFilter(0, 4, 0, 14), new CohortFilter(5, 7, 0, 3)), filters);
    }

    @Test
    void malformedSpecsFailFast() {
        for (String spec : List.of("", "4", "0-4-5", "a-b", "0-4:1:2", "0-4:x", "0-4:1-2-3", "0-")) {
            FilterSpecException e = assertThrows(FilterSpecException.class, () -> CohortFilter.parse(spec, TERM_MAX), spec);
            assertTrue(e.getMessage().contains(spec.trim()), e.getMessage());
        }
        assertThrows(FilterSpecException.class, () -> CohortFilter.parseAll("  ", TERM_MAX));
    }

    @Test
    void trainAndTestPartitionTheData() {
        List<PreprocessedRecord> data = new ArrayList<>();
        for (int cohort = 0; cohort < 4; cohort++) {
            for (int term = cohort; term < 6; term++) {
                data.add(rec(cohort * 10 + term, term, term, cohort, 3.0));
            }
        }
        data.add(rec(99, 1, 2, null, 2.0));

        CohortFilter filter = CohortFilter.parse("1-2:2-4", TERM_MAX);
        List<PreprocessedRecord> train = filter.train(data);
        List<PreprocessedRecord> test = filter.test(data);

        Set<PreprocessedRecord> union = new HashSet<>(train);
        union.addAll(test);
        assertEquals(new HashSet<>(data), union);
        assertEquals(data.size(), train.size() + test.size());
        assertTrue(train.stream().noneMatch(test::contains));
        assertTrue(train.stream().allMatch(r -> r.cohort() >= 1 && r.cohort() <= 2 && r.termnum() >= 2 && r.termnum() <= 4));
        assertTrue(test.stream().anyMatch(r -> r.cohort() == null), "records without cohort are test records");
    }
}
