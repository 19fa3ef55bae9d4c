package com.aiinpocket.choretrust.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * 分散式鎖服務。
 * 使用 PostgreSQL Advisory Lock，讓多個實例同時觸發同一個排程時只有一個真正執行。
 *
 * <p>Advisory lock 綁定在 session 上，因此取得、執行、釋放都在同一條連線中完成。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributedLockService {

    private final JdbcTemplate jdbcTemplate;

    /**
     * 在鎖保護下執行任務。取不到鎖（其他實例正在處理）就直接跳過。
     *
     * @param lockId   鎖的唯一識別碼
     * @param taskName 任務名稱（用於日誌）
     * @param task     要執行的任務
     * @return true 如果任務被執行
     */
    public boolean executeWithLock(long lockId, String taskName, Runnable task) {
        Boolean executed = jdbcTemplate.execute((ConnectionCallback<Boolean>) con -> {
            if (!tryLock(con, lockId)) {
                log.debug("[分散式鎖] {} 已被其他實例處理，跳過 (lockId={})", taskName, lockId);
                return false;
            }
            try {
                task.run();
                return true;
            } finally {
                unlock(con, lockId);
            }
        });
        return Boolean.TRUE.equals(executed);
    }

    private boolean tryLock(Connection con, long lockId) throws SQLException {
        try (PreparedStatement ps = con.prepareStatement("SELECT pg_try_advisory_lock(?)")) {
            ps.setLong(1, lockId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private void unlock(Connection con, long lockId) throws SQLException {
        try (PreparedStatement ps = con.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            ps.setLong(1, lockId);
            ps.executeQuery().close();
        }
    }
}
