package com.herzen.gradepipe.pipeline;

import com.herzen.gradepipe.config.PipelineProperties;
import com.herzen.gradepipe.encoding.EncodingModels.OutputFormat;
import com.herzen.gradepipe.encoding.EncodingModels.TimeMode;
import com.herzen.gradepipe.solver.SolverModels.ModelVariant;
import com.herzen.gradepipe.solver.SolverModels.SolverSettings;
import com.herzen.gradepipe.split.CohortFilter;
import com.herzen.gradepipe.split.SplitModels.SplitConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class ArtifactNaming {
    public static final String PREPROCESSED_FILE = "preprocessed-course-data.csv";

    private final String splitPrefix;
    private final String comparePrefix;

    public ArtifactNaming(PipelineProperties properties) {
        this.splitPrefix = properties.split().prefix();
        this.comparePrefix = properties.results().prefix();
    }

    public Path splitFile(Path dataDir, SplitConfig config, OutputFormat format, TimeMode time, String side) {
        String suffix = format == OutputFormat.FEATURES ? time.suffix() : "";
        return dataDir.resolve(baseName(splitPrefix, config, suffix) + "." + side + "." + format.extension());
    }

    public Path methodResultFile(Path outcomesDir, SplitConfig config, ModelVariant variant, SolverSettings settings) {
        List<String> parts = new ArrayList<>();
        if (variant.timeMode() != TimeMode.NONE) parts.add(variant.timeMode().suffix());
        parts.add(settingsPart(settings));
        if (variant.usesBias()) parts.add("b");
        return outcomesDir.resolve(baseName(splitPrefix, config, String.join("-", parts)) + "." + variant.methodName() + ".tsv");
    }

    public Path leaderboardFile(Path outcomesDir, SplitConfig config, SolverSettings settings, int topN) {
        return outcomesDir.resolve(splitKey(config, settings) + ".top" + topN + ".tsv");
    }

    public Path tableFile(Path leaderboardFile) {
        String name = leaderboardFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return leaderboardFile.resolveSibling((dot < 0 ? name : name.substring(0, dot)) + ".md");
    }

    public String splitKey(SplitConfig config, SolverSettings settings) {
        return baseName(comparePrefix, config, settingsPart(settings));
    }

    static String baseName(String prefix, SplitConfig config, String suffix) {
        List<String> parts = new ArrayList<>();
        if (prefix != null && !prefix.isBlank()) parts.add(prefix);
        parts.add(config.filters().stream().map(CohortFilter::toString).collect(Collectors.joining("-")));
        if (!config.discardNongrade()) parts.add("ng");
        if (config.backfillColdStudents() > 0) parts.add("scs" + config.backfillColdStudents());
        if (config.backfillColdCourses() > 0) parts.add("ccs" + config.backfillColdCourses());
        if (suffix != null && !suffix.isBlank()) parts.add(suffix);
        return String.join("-", parts);
    }

    static String settingsPart(SolverSettings settings) {
        return "i" + settings.iterations() + "-s" + Double.toString(settings.initStdev()).replace(".", "")
                + "-d" + settings.dimStart() + "_" + settings.dimEnd();
    }
}
