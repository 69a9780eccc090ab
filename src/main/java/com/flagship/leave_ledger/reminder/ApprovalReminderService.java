package com.flagship.leave_ledger.reminder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Finds requests that have waited on an approver for longer than
 * leave.reminders.pending-after and reminds their approvers, at most once
 * per leave.reminders.repeat-after.
 *
 * Candidates are read without locks; each one is then claimed in its own
 * transaction by {@link ReminderClaimer}, which re-checks eligibility. A
 * failed claim does not stop the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalReminderService {

    private final JdbcTemplate jdbcTemplate;
    private final ReminderClaimer reminderClaimer;

    @Value("${leave.reminders.pending-after:48h}")
    private Duration pendingAfter;

    @Value("${leave.reminders.repeat-after:24h}")
    private Duration repeatAfter;

    @Value("${leave.reminders.batch-size:200}")
    private int batchSize;

    /**
     * @return number of reminders claimed by this run
     */
    public int runOnce(Instant now) {
        Instant pendingBefore = now.minus(pendingAfter);
        Instant remindedBefore = now.minus(repeatAfter);

        List<UUID> candidates = jdbcTemplate.query(
            "SELECT id FROM leave_requests " +
            "WHERE status IN ('PENDING_MANAGER', 'PENDING_HR') AND submitted_at < ? " +
            "AND (last_reminder_sent_at IS NULL OR last_reminder_sent_at < ?) " +
            "ORDER BY submitted_at LIMIT ?",
            (rs, rowNum) -> UUID.fromString(rs.getString("id")),
            Timestamp.from(pendingBefore), Timestamp.from(remindedBefore), batchSize
        );

        if (candidates.isEmpty()) {
            return 0;
        }
        log.debug("Found {} leave requests due a reminder", candidates.size());

        int claimed = 0;
        for (UUID candidate : candidates) {
            try {
                if (reminderClaimer.claim(candidate, now, pendingBefore, remindedBefore)) {
                    claimed++;
                }
            } catch (Exception e) {
                log.error("Failed to claim reminder for leave request {}: {}", candidate, e.getMessage(), e);
            }
        }

        log.info("Reminder run finished: candidates={}, claimed={}", candidates.size(), claimed);
        return claimed;
    }
}
