package com.herzen.gradepipe.split;

import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;
import com.herzen.gradepipe.domain.DomainModels.Split;
import com.herzen.gradepipe.split.SplitModels.BackfillKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class ColdStartBackfill {
    private static final Logger log = LoggerFactory.getLogger(ColdStartBackfill.class);

    public Split apply(Split split, BackfillKey key, int firstn) {
        if (firstn < 0) throw new IllegalArgumentException("firstn must be >= 0");
        if (firstn == 0) return split;

        Set<Integer> trainKeys = split.train().stream().map(key::of).collect(Collectors.toSet());

        Map<Integer, Integer> movedPerKey = new HashMap<>();
        List<PreprocessedRecord> train = new ArrayList<>(split.train());
        List<PreprocessedRecord> warm = new ArrayList<>();
        List<PreprocessedRecord> coldRemainder = new ArrayList<>();

        for (PreprocessedRecord record : split.test()) {
            Integer value = key.of(record);
            if (trainKeys.contains(value)) {
                warm.add(record);
                continue;
            }
            int moved = movedPerKey.getOrDefault(value, 0);
            if (moved < firstn) {
                train.add(record);
                movedPerKey.put(value, moved + 1);
            } else {
                coldRemainder.add(record);
            }
        }

        List<PreprocessedRecord> test = new ArrayList<>(warm.size() + coldRemainder.size());
        test.addAll(warm);
        test.addAll(coldRemainder);
        log.debug("Backfill by {}: {} cold-start entities, {} records moved to train", key, movedPerKey.size(),
                train.size() - split.train().size());
        return new Split(train, test);
    }
}
