package com.herzen.gradepipe.repository;

import com.herzen.gradepipe.results.ResultModels.MethodResult;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public class LeaderboardJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public LeaderboardJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void replace(String splitKey, int topN, List<MethodResult> ranked) {
        jdbcTemplate.update("DELETE FROM leaderboard_entry WHERE split_key=? AND top_n=?", splitKey, topN);
        String now = Instant.now().toString();
        for (int i = 0; i < ranked.size(); i++) {
            MethodResult r = ranked.get(i);
            jdbcTemplate.update(
                    "INSERT INTO leaderboard_entry(split_key, top_n, rank_no, method, dim, train_error, test_error, created_at) VALUES (?,?,?,?,?,?,?,?)",
                    splitKey, topN, i + 1, r.method(), r.dim(), r.trainError(), r.testError(), now);
        }
    }

    public List<MethodResult> load(String splitKey, int topN) {
        return jdbcTemplate.query(
                "SELECT method, dim, train_error, test_error FROM leaderboard_entry WHERE split_key=? AND top_n=? ORDER BY rank_no",
                (rs, n) -> new MethodResult(rs.getString(1), rs.getInt(2), rs.getDouble(3), rs.getDouble(4)),
                splitKey, topN);
    }
}
