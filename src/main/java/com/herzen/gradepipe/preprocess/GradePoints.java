package com.herzen.gradepipe.preprocess;

import java.util.Map;
import java.util.Set;

public final class GradePoints {
    private static final Map<String, Double> POINTS = Map.ofEntries(
            Map.entry("A+", 4.0),
            Map.entry("A", 4.0),
            Map.entry("A-", 3.67),
            Map.entry("B+", 3.33),
            Map.entry("B", 3.00),
            Map.entry("B-", 2.67),
            Map.entry("C+", 2.33),
            Map.entry("C", 2.00),
            Map.entry("C-", 1.67),
            Map.entry("D", 1.00),
            Map.entry("F", 0.00),
            Map.entry("IN", 0.00),  // incomplete
            Map.entry("S", 3.00),   // satisfactory, C and up
            Map.entry("NC", 1.00),  // no credit
            Map.entry("W", 1.00)    // withdrawal
    );

    public static final Set<String> UNGRADED = Set.of("NR", "AU", "REG", "IX", "IP");

    public static final Set<String> NON_GRADES = Set.of("W", "S", "NC");

    private GradePoints() {
    }

    public static Double resolve(String grade) {
        if (grade == null) return null;
        return POINTS.get(grade.trim());
    }
}
