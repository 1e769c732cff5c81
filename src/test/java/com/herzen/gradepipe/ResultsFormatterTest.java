package com.herzen.gradepipe;

import com.herzen.gradepipe.results.ResultModels.MethodResult;
import com.herzen.gradepipe.results.ResultsFormatter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultsFormatterTest {
    private final ResultsFormatter formatter = new ResultsFormatter();

    @Test
    void alignsColumnsWithMarginAndUnderlinesHeader() {
        String table = formatter.format(List.of(new MethodResult("SVD", 5, 0.1, 0.2)), 2, 1);

        assertEquals("""
                method  dim train test
                ------  --- ----- ----
                SVD       5  0.10 0.20""", table);
    }

    @Test
    void widthsFollowLongestCell() {
        String table = formatter.format(List.of(
                new MethodResult("BiasedTimeSVD", 12, 0.123456789, 0.9),
                new MethodResult("SVD", 5, 0.5, 1.25)), 5, 4);

        List<String> lines = table.lines().toList();
        assertEquals(4, lines.size());
        assertEquals("-------------", lines.get(1).substring(0, 13));
        assertTrue(lines.get(2).startsWith("BiasedTimeSVD    "));
        assertTrue(lines.get(2).endsWith("    0.12346    0.90000"));
        assertTrue(lines.get(3).startsWith("SVD              "));
        assertEquals(lines.get(0).length(), lines.get(3).length());
    }

    @Test
    void emptyLeaderboardStillHasHeader() {
        assertEquals("method        dim    train    test\n------        ---    -----    ----", formatter.format(List.of(), 5, 4));
    }
}
