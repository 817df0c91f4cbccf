package com.flagship.account_ledger.account;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * {@link AccountRepository} over the {@code account} table.
 *
 * Balances are stored as signed BIGINT; the projection only ever writes values in
 * {@code 0 .. Long.MAX_VALUE}.
 */
@Repository
@RequiredArgsConstructor
public class JdbcAccountRepository implements AccountRepository {

    private static final RowMapper<Account> ACCOUNT_ROW_MAPPER = (rs, rowNum) -> new Account(
        rs.getObject("id", UUID.class),
        rs.getLong("balance")
    );

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Stream<Account> accounts() {
        return jdbcTemplate.queryForStream(
            "SELECT id, balance FROM account ORDER BY id",
            ACCOUNT_ROW_MAPPER
        );
    }

    @Override
    public Optional<Account> accountById(UUID id) {
        return jdbcTemplate.query(
            "SELECT id, balance FROM account WHERE id = ?",
            ACCOUNT_ROW_MAPPER,
            id
        ).stream().findFirst();
    }
}
