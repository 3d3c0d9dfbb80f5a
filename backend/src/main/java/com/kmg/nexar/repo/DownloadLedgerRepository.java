package com.kmg.nexar.repo;

import com.kmg.nexar.model.DownloadJob;
import com.kmg.nexar.model.DownloadPriority;
import com.kmg.nexar.model.DownloadStatus;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every download job. A state transition counts as committed only once the
 * matching write here has returned.
 */
@Repository
public class DownloadLedgerRepository {
    private final JdbcTemplate jdbcTemplate;

    public DownloadLedgerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<DownloadJob> JOB_MAPPER = new RowMapper<>() {
        @Override
        public DownloadJob mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new DownloadJob(
                    rs.getString("id"),
                    rs.getString("source_ref"),
                    rs.getString("title"),
                    DownloadPriority.valueOf(rs.getString("priority")),
                    DownloadStatus.valueOf(rs.getString("status")),
                    rs.getLong("total_bytes"),
                    rs.getLong("downloaded_bytes"),
                    rs.getString("prefix_sha256"),
                    rs.getInt("attempt"),
                    rs.getLong("queue_seq"),
                    rs.getString("file_path"),
                    SqlTime.parse(rs.getString("created_at")),
                    SqlTime.parse(rs.getString("updated_at")),
                    rs.getString("last_error")
            );
        }
    };

    public void initializeSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS downloads (
              id TEXT PRIMARY KEY,
              source_ref TEXT NOT NULL,
              title TEXT,
              priority TEXT NOT NULL,
              status TEXT NOT NULL,
              total_bytes INTEGER NOT NULL DEFAULT -1,
              downloaded_bytes INTEGER NOT NULL DEFAULT 0,
              prefix_sha256 TEXT,
              attempt INTEGER NOT NULL DEFAULT 0,
              queue_seq INTEGER NOT NULL,
              file_path TEXT,
              created_at TEXT NOT NULL,
              updated_at TEXT NOT NULL,
              last_error TEXT
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_downloads_status ON downloads(status)");
    }

    public void insert(DownloadJob job) {
        jdbcTemplate.update(
                """
                INSERT INTO downloads(id, source_ref, title, priority, status, total_bytes, downloaded_bytes,
                                      prefix_sha256, attempt, queue_seq, file_path, created_at, updated_at, last_error)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                job.id(),
                job.sourceRef(),
                job.title(),
                job.priority().name(),
                job.status().name(),
                job.totalBytes(),
                job.downloadedBytes(),
                job.prefixSha256(),
                job.attempt(),
                job.queueSeq(),
                job.filePath(),
                SqlTime.toText(job.createdAt()),
                SqlTime.toText(job.updatedAt()),
                job.lastError()
        );
    }

    /**
     * Overwrites the mutable columns of an existing record.
     *
     * @throws IllegalStateException if no record exists for the job id
     */
    public void save(DownloadJob job) {
        int updated = jdbcTemplate.update(
                """
                UPDATE downloads
                   SET status = ?,
                       total_bytes = ?,
                       downloaded_bytes = ?,
                       prefix_sha256 = ?,
                       attempt = ?,
                       file_path = ?,
                       updated_at = ?,
                       last_error = ?
                 WHERE id = ?
                """,
                job.status().name(),
                job.totalBytes(),
                job.downloadedBytes(),
                job.prefixSha256(),
                job.attempt(),
                job.filePath(),
                SqlTime.toText(job.updatedAt()),
                job.lastError(),
                job.id()
        );
        if (updated == 0) {
            throw new IllegalStateException("Ledger record missing for download " + job.id());
        }
    }

    public Optional<DownloadJob> findById(String id) {
        List<DownloadJob> rows = jdbcTemplate.query("SELECT * FROM downloads WHERE id = ?", JOB_MAPPER, id);
        return rows.stream().findFirst();
    }

    public List<DownloadJob> findAll() {
        return jdbcTemplate.query("SELECT * FROM downloads ORDER BY created_at ASC, queue_seq ASC", JOB_MAPPER);
    }

    public List<DownloadJob> findByStatus(DownloadStatus status) {
        return jdbcTemplate.query(
                "SELECT * FROM downloads WHERE status = ? ORDER BY created_at ASC, queue_seq ASC",
                JOB_MAPPER,
                status.name()
        );
    }

    public long maxQueueSeq() {
        try {
            Long max = jdbcTemplate.queryForObject("SELECT MAX(queue_seq) FROM downloads", Long.class);
            return max == null ? 0L : max;
        } catch (EmptyResultDataAccessException e) {
            return 0L;
        }
    }
}
