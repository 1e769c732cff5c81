package com.herzen.gradepipe.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.List;

@ConfigurationProperties(prefix = "gradepipe")
public record PipelineProperties(String dataDir,
                                 String outcomesDir,
                                 Inputs inputs,
                                 Preprocess preprocess,
                                 Split split,
                                 Solver solver,
                                 Results results) {

    public PipelineProperties {
        if (dataDir == null || dataDir.isBlank()) throw new IllegalArgumentException("gradepipe.data-dir is required");
        if (outcomesDir == null || outcomesDir.isBlank()) throw new IllegalArgumentException("gradepipe.outcomes-dir is required");
        if (inputs == null || preprocess == null || split == null || solver == null || results == null) {
            throw new IllegalArgumentException("gradepipe.{inputs,preprocess,split,solver,results} must all be configured");
        }
    }

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public Path outcomesPath() {
        return Path.of(outcomesDir);
    }

    public record Inputs(String coursesFile, String admissionsFile) {}

    public record Preprocess(List<String> droppedColumns) {
        public Preprocess {
            droppedColumns = droppedColumns == null ? List.of() : List.copyOf(droppedColumns);
        }
    }

    public record Split(String filters,
                        int termMax,
                        boolean discardNongrade,
                        int backfillColdStudents,
                        int backfillColdCourses,
                        String prefix) {}

    public record Solver(String executable, int iterations, double initStdev, int dimStart, int dimEnd) {}

    public record Results(int topN, int precision, int margin, String prefix, List<String> runAllSplits) {
        public Results {
            runAllSplits = runAllSplits == null ? List.of() : List.copyOf(runAllSplits);
        }
    }
}
