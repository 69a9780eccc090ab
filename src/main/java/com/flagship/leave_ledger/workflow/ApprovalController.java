package com.flagship.leave_ledger.workflow;

import com.flagship.leave_ledger.workflow.dto.PendingApprovalResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Approval inbox of the acting user.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalInboxService inboxService;

    @GetMapping("/pending")
    public ResponseEntity<List<PendingApprovalResponse>> pending(@RequestHeader("X-Actor-Id") UUID actorId) {
        List<PendingApprovalResponse> body = inboxService.actionableFor(actorId).stream()
            .map(PendingApprovalResponse::from)
            .toList();
        return ResponseEntity.ok(body);
    }
}
