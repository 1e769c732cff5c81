package com.herzen.gradepipe.pipeline;

import com.herzen.gradepipe.idmap.IdMapModels.IdMapKind;
import com.herzen.gradepipe.results.ResultModels.MethodResult;
import com.herzen.gradepipe.solver.SolverModels.DimensionResult;
import com.herzen.gradepipe.solver.SolverModels.ModelVariant;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class PipelineModels {
    public record Workspace(Path dataDir, Path outcomesDir) {}

    public record PreparedData(Map<IdMapKind, Path> idMapFiles, Path preprocessedFile, int records, boolean reused) {}

    public record SplitArtifacts(Path train, Path test, int trainRows, int testRows, boolean reused) {}

    public record VariantRun(ModelVariant variant, Path resultFile, List<DimensionResult> results, boolean reused) {}

    public record Comparison(String splitKey,
                             int topN,
                             Path leaderboardFile,
                             Path tableFile,
                             List<MethodResult> ranked,
                             String table) {}
}
