package com.herzen.gradepipe.results;

import java.util.List;

public class ResultModels {
    public static final List<String> LEADERBOARD_HEADER = List.of("method", "dim", "train", "test");

    public record MethodResult(String method, int dim, double trainError, double testError) {}
}
