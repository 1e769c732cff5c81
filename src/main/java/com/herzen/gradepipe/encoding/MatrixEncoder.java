package com.herzen.gradepipe.encoding;

import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;
import com.herzen.gradepipe.domain.DomainModels.Split;
import com.herzen.gradepipe.encoding.EncodingModels.EncodedSplit;
import com.herzen.gradepipe.encoding.EncodingModels.FeatureSpace;
import com.herzen.gradepipe.encoding.EncodingModels.TimeMode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

@Component
public class MatrixEncoder {

    public List<String> triples(List<PreprocessedRecord> records) {
        return records.stream()
                .map(r -> r.sid() + "\t" + r.cid() + "\t" + r.grdpts())
                .toList();
    }

    public FeatureSpace featureSpace(Split split) {
        int maxRow = union(split).mapToInt(PreprocessedRecord::sid).max().orElse(-1);
        int columnOffset = maxRow + 1;
        int maxColumn = union(split).mapToInt(r -> r.cid() + columnOffset).max().orElse(columnOffset - 1);
        return new FeatureSpace(columnOffset, maxColumn + 1);
    }

    public EncodedSplit features(Split split, TimeMode mode) {
        FeatureSpace space = featureSpace(split);
        return new EncodedSplit(features(split.train(), space, mode), features(split.test(), space, mode), space);
    }

    public List<String> features(List<PreprocessedRecord> records, FeatureSpace space, TimeMode mode) {
        return records.stream().map(r -> featureLine(r, space, mode)).toList();
    }

    private String featureLine(PreprocessedRecord r, FeatureSpace space, TimeMode mode) {
        int column = r.cid() + space.columnOffset();
        return switch (mode) {
            case NONE -> String.format(Locale.US, "%f %d:1 %d:1", r.grdpts(), r.sid(), column);
            case CATEGORICAL -> String.format(Locale.US, "%f %d:1 %d:1 %d:%d",
                    r.grdpts(), r.sid(), column, space.timeIndex(), r.termnum());
            case BINARY -> String.format(Locale.US, "%f %d:1 %d:1 %d:1",
                    r.grdpts(), r.sid(), column, space.timeIndex() + r.termnum());
        };
    }

    private static Stream<PreprocessedRecord> union(Split split) {
        return Stream.concat(split.train().stream(), split.test().stream());
    }
}
