package com.flagship.leave_ledger.directory;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDelegationDirectory implements DelegationDirectory {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public boolean isDelegate(UUID approverId, UUID delegateId, LocalDate on) {
        Integer count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM delegations
            WHERE from_user_id = ? AND to_user_id = ? AND is_active AND ? BETWEEN start_date AND end_date
            """,
            Integer.class,
            approverId, delegateId, Date.valueOf(on)
        );
        return count != null && count > 0;
    }

    @Override
    public Set<UUID> delegatorsOf(UUID delegateId, LocalDate on) {
        return new HashSet<>(jdbcTemplate.query("""
            SELECT DISTINCT from_user_id FROM delegations
            WHERE to_user_id = ? AND is_active AND ? BETWEEN start_date AND end_date
            """,
            (rs, rowNum) -> rs.getObject("from_user_id", UUID.class),
            delegateId, Date.valueOf(on)
        ));
    }
}
