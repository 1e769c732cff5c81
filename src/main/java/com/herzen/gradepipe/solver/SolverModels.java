package com.herzen.gradepipe.solver;

import com.herzen.gradepipe.encoding.EncodingModels.TimeMode;

import java.nio.file.Path;
import java.util.Arrays;

public class SolverModels {

    public enum ModelVariant {
        SVD("SVD", false, TimeMode.NONE),
        BIASED_SVD("BiasedSVD", true, TimeMode.NONE),
        TIME_SVD("TimeSVD", false, TimeMode.CATEGORICAL),
        BIASED_TIME_SVD("BiasedTimeSVD", true, TimeMode.CATEGORICAL),
        BPTF("BPTF", false, TimeMode.BINARY),
        BIASED_BPTF("BiasedBPTF", true, TimeMode.BINARY);

        private final String methodName;
        private final boolean usesBias;
        private final TimeMode timeMode;

        ModelVariant(String methodName, boolean usesBias, TimeMode timeMode) {
            this.methodName = methodName;
            this.usesBias = usesBias;
            this.timeMode = timeMode;
        }

        public String methodName() {
            return methodName;
        }

        public boolean usesBias() {
            return usesBias;
        }

        public TimeMode timeMode() {
            return timeMode;
        }

        public static ModelVariant fromName(String name) {
            return Arrays.stream(values())
                    .filter(v -> v.methodName.equalsIgnoreCase(name) || v.name().equalsIgnoreCase(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown model variant: " + name));
        }
    }

    public record SolverSettings(int iterations, double initStdev, int dimStart, int dimEnd) {
        public SolverSettings {
            if (iterations <= 0) throw new IllegalArgumentException("iterations must be > 0");
            if (!(initStdev > 0)) throw new IllegalArgumentException("initStdev must be > 0");
            if (dimStart < 1 || dimEnd < dimStart) {
                throw new IllegalArgumentException("dimension range must satisfy 1 <= dimStart <= dimEnd, got " + dimStart + ".." + dimEnd);
            }
        }
    }

    public record SolverRequest(Path train, Path test, SolverSettings settings, boolean useBias) {}

    public record DimensionResult(int dim, double trainError, double testError) {}
}
