package com.herzen.gradepipe.split;

import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class CohortFilter {
    private final int cohortStart;
    private final int cohortEnd;
    private final int termStart;
    private final int termEnd;

    public CohortFilter(int cohortStart, int cohortEnd, int termStart, int termEnd) {
        this.cohortStart = cohortStart;
        this.cohortEnd = cohortEnd;
        this.termStart = termStart;
        this.termEnd = termEnd;
    }

    public static CohortFilter parse(String spec, int termMax) {
        if (spec == null || spec.isBlank()) throw new FilterSpecException(String.valueOf(spec), "empty specification");
        String trimmed = spec.trim();
        String[] parts = trimmed.split(":", -1);
        if (parts.length > 2) throw new FilterSpecException(trimmed, "expected at most one ':'");

        if (parts.length == 1) {
            String[] bounds = parts[0].split("-", -1);
            if (bounds.length != 2) throw new FilterSpecException(trimmed, "cohort-only form must be A-B");
            return new CohortFilter(bound(trimmed, bounds[0]), bound(trimmed, bounds[1]), 0, termMax);
        }
        int[] cohort = range(trimmed, parts[0], termMax);
        int[] term = range(trimmed, parts[1], termMax);
        return new CohortFilter(cohort[0], cohort[1], term[0], term[1]);
    }

    public static List<CohortFilter> parseAll(String specs, int termMax) {
        if (specs == null || specs.isBlank()) throw new FilterSpecException(String.valueOf(specs), "no filters given");
        return Arrays.stream(specs.trim().split("\\s+")).map(s -> parse(s, termMax)).toList();
    }

    private static int[] range(String spec, String part, int termMax) {
        String[] bounds = part.split("-", -1);
        if (bounds.length == 1) return new int[]{bound(spec, bounds[0]), termMax};
        if (bounds.length == 2) return new int[]{bound(spec, bounds[0]), bound(spec, bounds[1])};
        throw new FilterSpecException(spec, "range '" + part + "' has more than one '-'");
    }

    private static int bound(String spec, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new FilterSpecException(spec, "'" + raw + "' is not an integer bound");
        }
    }

    public boolean matches(PreprocessedRecord record) {
        Integer cohort = record.cohort();
        Integer term = record.termnum();
        return cohort != null && term != null
                && cohort >= cohortStart && cohort <= cohortEnd
                && term >= termStart && term <= termEnd;
    }

    public List<PreprocessedRecord> train(List<PreprocessedRecord> data) {
        return data.stream().filter(this::matches).toList();
    }

    public List<PreprocessedRecord> test(List<PreprocessedRecord> data) {
        return data.stream().filter(r -> !matches(r)).toList();
    }

    public int cohortStart() {
        return cohortStart;
    }

    public int cohortEnd() {
        return cohortEnd;
    }

    public int termStart() {
        return termStart;
    }

    public int termEnd() {
        return termEnd;
    }

    @Override
    public String toString() {
        return cohortStart + "_" + cohortEnd + "T" + termStart + "_" + termEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CohortFilter that)) return false;
        return cohortStart == that.cohortStart && cohortEnd == that.cohortEnd
                && termStart == that.termStart && termEnd == that.termEnd;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cohortStart, cohortEnd, termStart, termEnd);
    }
}
