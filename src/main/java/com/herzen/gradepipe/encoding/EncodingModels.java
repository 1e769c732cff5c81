package com.herzen.gradepipe.encoding;

import java.util.Arrays;
import java.util.List;

public class EncodingModels {

    public enum OutputFormat {
        TRIPLES("tsv"),
        FEATURES("libfm");

        private final String extension;

        OutputFormat(String extension) {
            this.extension = extension;
        }

        public String extension() {
            return extension;
        }

        public static OutputFormat fromName(String name) {
            if (name == null || name.isBlank()) return TRIPLES;
            return Arrays.stream(values())
                    .filter(f -> f.name().equalsIgnoreCase(name.trim()) || f.extension.equalsIgnoreCase(name.trim()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown output format: " + name));
        }
    }

    public enum TimeMode {
        NONE(""),
        CATEGORICAL("cat"),
        BINARY("bin");

        private final String code;

        TimeMode(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        public String suffix() {
            return this == NONE ? "" : "time-" + code;
        }

        public static TimeMode fromCode(String code) {
            if (code == null || code.isBlank()) return NONE;
            return Arrays.stream(values())
                    .filter(m -> m.code.equalsIgnoreCase(code.trim()) || m.name().equalsIgnoreCase(code.trim()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown time mode: " + code));
        }
    }

    /**
     * Index layout shared by the train and test files of one split: rows (students) occupy
     * {@code 0..columnOffset-1}, columns (courses) {@code columnOffset..timeIndex-1}, time starts at {@code timeIndex}.
     */
    public record FeatureSpace(int columnOffset, int timeIndex) {}

    public record EncodedSplit(List<String> train, List<String> test, FeatureSpace space) {}
}
