package com.flagship.account_ledger.projection;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.OptionalLong;
import java.util.UUID;

/**
 * Per-account projection cursor: the sequence number of the last event applied to the
 * read-model. Written in the same transaction as the read-model change it records.
 */
@Repository
@RequiredArgsConstructor
public class ProjectionCursorRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Reads the cursor and locks the row until the transaction ends.
     */
    public OptionalLong findSeqNoForUpdate(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT seq_no FROM account_projection_cursor WHERE account_id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getLong("seq_no"),
            accountId
        ).stream().mapToLong(Long::longValue).findFirst();
    }

    public void advance(UUID accountId, long seqNo) {
        jdbcTemplate.update("""
            INSERT INTO account_projection_cursor (account_id, seq_no)
            VALUES (?, ?)
            ON CONFLICT (account_id) DO UPDATE SET seq_no = EXCLUDED.seq_no
            """,
            accountId,
            seqNo
        );
    }
}
