package com.flagship.leave_ledger.reminder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
@ConditionalOnProperty(name = "leave.reminders.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ApprovalReminderJob {

    private final ApprovalReminderService reminderService;

    @Scheduled(cron = "${leave.reminders.cron:0 0 * * * *}")
    public void remindPendingApprovers() {
        try {
            reminderService.runOnce(Instant.now());
        } catch (Exception e) {
            log.error("Error in approval reminder job", e);
        }
    }
}
