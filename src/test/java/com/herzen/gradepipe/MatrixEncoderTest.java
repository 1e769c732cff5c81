package com.herzen.gradepipe;

import com.herzen.gradepipe.domain.DomainModels.Split;
import com.herzen.gradepipe.encoding.EncodingModels.EncodedSplit;
import com.herzen.gradepipe.encoding.EncodingModels.FeatureSpace;
import com.herzen.gradepipe.encoding.EncodingModels.TimeMode;
import com.herzen.gradepipe.encoding.MatrixEncoder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static com.herzen.gradepipe.TestRecords.rec;
import static org.junit.jupiter.api.Assertions.*;

class MatrixEncoderTest {
    private final MatrixEncoder encoder = new MatrixEncoder();

    // the largest student id only occurs on the train side, the largest course id only on the test side
    private final Split split = new Split(
            List.of(rec(0, 0, 0, 0, 4.0), rec(2, 1, 1, 0, 3.0)),
            List.of(rec(1, 2, 3, 0, 2.67)));

    @Test
    void writesTabSeparatedTriples() {
        assertEquals(List.of("0\t0\t4.0", "2\t1\t3.0"), encoder.triples(split.train()));
        assertEquals(List.of("1\t2\t2.67"), encoder.triples(split.test()));
    }

    @Test
    void offsetsComputedOverBothSides() {
        FeatureSpace space = encoder.featureSpace(split);
        assertEquals(3, space.columnOffset());
        assertEquals(6, space.timeIndex());
    }

    @Test
    void encodesWithoutTime() {
        EncodedSplit encoded = encoder.features(split, TimeMode.NONE);
        assertEquals(List.of("4.000000 0:1 3:1", "3.000000 2:1 4:1"), encoded.train());
        assertEquals(List.of("2.670000 1:1 5:1"), encoded.test());
    }

    @Test
    void categoricalTimeIsOneValuedFeatureAfterColumns() {
        EncodedSplit encoded = encoder.features(split, TimeMode.CATEGORICAL);
        assertEquals("3.000000 2:1 4:1 6:1", encoded.train().get(1));
        assertEquals(List.of("2.670000 1:1 5:1 6:3"), encoded.test());
    }

    @Test
    void binaryTimeIsOneHotBlockAfterColumns() {
        EncodedSplit encoded = encoder.features(split, TimeMode.BINARY);
        assertEquals("4.000000 0:1 3:1 6:1", encoded.train().get(0));
        assertEquals(List.of("2.670000 1:1 5:1 9:1"), encoded.test());
    }

    @Test
    void rowColumnAndTimeBlocksAreDisjoint() {
        List<Integer> rows = new ArrayList<>();
        List<Integer> cols = new ArrayList<>();
        List<Integer> times = new ArrayList<>();
        EncodedSplit encoded = encoder.features(split, TimeMode.BINARY);
        Stream.concat(encoded.train().stream(), encoded.test().stream()).forEach(line -> {
            String[] parts = line.split(" ");
            rows.add(index(parts[1]));
            cols.add(index(parts[2]));
            times.add(index(parts[3]));
        });

        int maxRow = rows.stream().max(Integer::compare).orElseThrow();
        int minCol = cols.stream().min(Integer::compare).orElseThrow();
        int maxCol = cols.stream().max(Integer::compare).orElseThrow();
        int minTime = times.stream().min(Integer::compare).orElseThrow();
        assertTrue(maxRow < minCol);
        assertTrue(minCol <= maxCol);
        assertTrue(maxCol < minTime);
    }

    @Test
    void emptySplitEncodesNothing() {
        EncodedSplit encoded = encoder.features(new Split(List.of(), List.of()), TimeMode.CATEGORICAL);
        assertTrue(encoded.train().isEmpty());
        assertEquals(0, encoded.space().columnOffset());
    }

    @Test
    void parsesTimeModeCodes() {
        assertEquals(TimeMode.NONE, TimeMode.fromCode(""));
        assertEquals(TimeMode.CATEGORICAL, TimeMode.fromCode("cat"));
        assertEquals(TimeMode.BINARY, TimeMode.fromCode("BIN"));
        assertEquals("time-bin", TimeMode.BINARY.suffix());
        assertThrows(IllegalArgumentException.class, () -> TimeMode.fromCode("hourly"));
    }

    private static int index(String feature) {
        return Integer.parseInt(feature.substring(0, feature.indexOf(':')));
    }
}
