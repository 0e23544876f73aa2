package io.taskrelay.cooldown;

import io.taskrelay.storage.Database;

/**
 * Persisted per (worker, prompt) suppression windows. While an entry is live the
 * same corrective action must not be sent again.
 */
public final class CooldownManager {
    private final Database database;

    public CooldownManager(Database database) {
        this.database = database;
    }

    public boolean inCooldown(String worker, String promptKey, long nowMs) {
        return database.queryOne("check cooldown",
                "SELECT 1 AS hit FROM cooldowns WHERE worker_name=? AND prompt_key=? AND expires_at_ms>?",
                ps -> {
                    ps.setString(1, worker);
                    ps.setString(2, promptKey);
                    ps.setLong(3, nowMs);
                },
                rs -> rs.getInt("hit")).isPresent();
    }

    public void setCooldown(String worker, String promptKey, long durationMs, long nowMs) {
        if (durationMs <= 0) {
            throw new IllegalArgumentException("cooldown duration must be positive");
        }
        database.update("set cooldown",
                "INSERT INTO cooldowns(worker_name,prompt_key,expires_at_ms,created_at_ms) VALUES(?,?,?,?) "
                        + "ON CONFLICT(worker_name,prompt_key) DO UPDATE SET expires_at_ms=excluded.expires_at_ms, "
                        + "created_at_ms=excluded.created_at_ms",
                ps -> {
                    ps.setString(1, worker);
                    ps.setString(2, promptKey);
                    ps.setLong(3, nowMs + durationMs);
                    ps.setLong(4, nowMs);
                });
    }

    public int purgeExpired(long nowMs) {
        return database.update("purge cooldowns",
                "DELETE FROM cooldowns WHERE expires_at_ms<=?",
                ps -> ps.setLong(1, nowMs));
    }

    public int countActive(long nowMs) {
        return database.queryOne("count cooldowns",
                "SELECT COUNT(*) AS c FROM cooldowns WHERE expires_at_ms>?",
                ps -> ps.setLong(1, nowMs),
                rs -> rs.getInt("c")).orElse(0);
    }
}
