package com.flagship.leave_ledger.leave;

import com.flagship.leave_ledger.balance.BalanceType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Office-scoped leave type, read from the organization directory.
 *
 * balanceExempt marks types (such as exceptional leave) that never touch a
 * balance, whatever deductsFromBalance says.
 */
@Value
public class LeaveTypeConfig {
    UUID id;
    UUID officeId;
    String code;
    String labelFr;
    String labelEn;
    boolean deductsFromBalance;
    BalanceType balanceType;
    boolean balanceExempt;
    boolean requiresAttachment;
    BigDecimal attachmentFromDay;
    String color;
    boolean active;

    /**
     * Whether requests of this type reserve, commit and release balance days.
     */
    public boolean chargesBalance() {
        return deductsFromBalance && !balanceExempt && balanceType != null;
    }

    /**
     * Whether a request of the given length must carry at least one attachment.
     */
    public boolean requiresAttachmentFor(BigDecimal totalDays) {
        if (!requiresAttachment) {
            return false;
        }
        return attachmentFromDay == null || totalDays.compareTo(attachmentFromDay) >= 0;
    }
}
