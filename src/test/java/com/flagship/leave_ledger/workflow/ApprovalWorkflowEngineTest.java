package com.flagship.leave_ledger.workflow;

import com.flagship.leave_ledger.LeaveTestFixtures;
import com.flagship.leave_ledger.balance.BalanceKey;
import com.flagship.leave_ledger.balance.BalanceType;
import com.flagship.leave_ledger.balance.LeaveBalance;
import com.flagship.leave_ledger.balance.LeaveBalanceLedger;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;
import com.flagship.leave_ledger.exception.ApprovalAuthorizationException;
import com.flagship.leave_ledger.exception.InvalidTransitionException;
import com.flagship.leave_ledger.exception.LeaveValidationException;
import com.flagship.leave_ledger.leave.LeaveRequest;
import com.flagship.leave_ledger.leave.LeaveRequestCommand;
import com.flagship.leave_ledger.leave.LeaveRequestService;
import com.flagship.leave_ledger.outbox.OutboxEvent;
import com.flagship.leave_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Approval workflows end to end against PostgreSQL: stage progression,
 * ledger settlement exactly once, and rejected decisions leaving no trace.
 */
@SpringBootTest
@Testcontainers
class ApprovalWorkflowEngineTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("leave_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("leave.reminders.enabled", () -> "false");
    }

    private static final LocalDate MONDAY = LocalDate.of(2026, 1, 5);
    private static final LocalDate FRIDAY = LocalDate.of(2026, 1, 9);

    @Autowired
    private ApprovalWorkflowEngine engine;

    @Autowired
    private LeaveRequestService leaveRequestService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ApprovalInboxService inboxService;

    @SpyBean
    private LeaveBalanceLedger ledger;

    private LeaveTestFixtures fixtures;
    private LeaveTestFixtures.Organization org;
    private BalanceKey annualKey;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        fixtures = new LeaveTestFixtures(jdbcTemplate);
        org = fixtures.organization();
        annualKey = BalanceKey.of(org.employeeId(), 2026, BalanceType.ANNUAL);
        fixtures.balance(org.employeeId(), 2026, BalanceType.ANNUAL, new BigDecimal("25"));
    }

    private LeaveRequest submitWeek(UUID leaveTypeId) {
        LeaveRequestCommand command = LeaveRequestCommand.builder()
            .employeeId(org.employeeId())
            .leaveTypeId(leaveTypeId)
            .startDate(MONDAY)
            .endDate(FRIDAY)
            .reason("Winter holiday")
            .build();
        LeaveRequest request = leaveRequestService.create(command, org.employeeId(), null).getRequest();
        clearInvocations(ledger);
        return request;
    }

    private ApprovalStep stepOf(LeaveRequest request, UUID approverId) {
        return engine.currentRound(leaveRequestService.get(request.getId())).stream()
            .filter(step -> step.getApproverId().equals(approverId))
            .findFirst()
            .orElseThrow();
    }

    private LeaveBalance balance() {
        return ledger.find(annualKey).orElseThrow();
    }

    @Nested
    @DisplayName("Sequential MANAGER then HR")
    class Sequential {

        @Test
        @DisplayName("Manager approval moves to PENDING_HR with days still pending; HR approval commits")
        void managerThenHr() {
            printTestHeader("Sequential Approval");
            LeaveRequest request = submitWeek(org.annualTypeId());
            printInput("Request", request.getId() + " " + request.getStatus() + " " + request.getTotalDays() + " days");

            assertEquals(LeaveStatus.PENDING_MANAGER, request.getStatus());
            assertEquals(0, request.getTotalDays().compareTo(new BigDecimal("5")));
            assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("5")));

            TransitionResult afterManager = engine.decideStep(request.getId(),
                    stepOf(request, org.managerId()).getId(), org.managerId(), ApprovalAction.APPROVED, null);
            printOutput("After manager", afterManager);

            assertEquals(LeaveStatus.PENDING_HR, afterManager.getNewStatus());
            assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("5")));
            assertEquals(0, balance().getUsedDays().signum());
            verify(ledger, never()).commit(any(), any(), any());

            TransitionResult afterHr = engine.decideStep(request.getId(),
                    stepOf(request, org.hrOneId()).getId(), org.hrOneId(), ApprovalAction.APPROVED, "Enjoy");
            printOutput("After HR", afterHr);

            assertEquals(LeaveStatus.APPROVED, afterHr.getNewStatus());
            LeaveBalance settled = balance();
            assertEquals(0, settled.getUsedDays().compareTo(new BigDecimal("5")));
            assertEquals(0, settled.getPendingDays().signum());
            assertEquals(0, settled.remaining().compareTo(new BigDecimal("20")));
            verify(ledger, times(1)).commit(eq(annualKey), any(), eq(request.getId()));
            printSuccess("Days committed once on final approval");
        }

        @Test
        @DisplayName("HR cannot decide before the manager stage is cleared")
        void hrBeforeManager() {
            printTestHeader("HR Before Manager");
            LeaveRequest request = submitWeek(org.annualTypeId());
            UUID hrStepId = stepOf(request, org.hrOneId()).getId();

            assertThrows(ApprovalAuthorizationException.class, () -> engine.decideStep(request.getId(),
                    hrStepId, org.hrOneId(), ApprovalAction.APPROVED, null));

            assertEquals(LeaveStatus.PENDING_MANAGER, leaveRequestService.get(request.getId()).getStatus());
            assertFalse(stepOf(request, org.hrOneId()).isDecided());
            printSuccess("Stage order enforced");
        }

        @Test
        @DisplayName("RETURNED releases the days and the request can be resubmitted as a new round")
        void returnAndResubmit() {
            printTestHeader("Return And Resubmit");
            LeaveRequest request = submitWeek(org.annualTypeId());

            TransitionResult returned = engine.decideStep(request.getId(),
                    stepOf(request, org.managerId()).getId(), org.managerId(), ApprovalAction.RETURNED,
                    "Please shorten by a day");
            assertEquals(LeaveStatus.RETURNED, returned.getNewStatus());
            assertEquals(0, balance().getPendingDays().signum());
            verify(ledger, times(1)).release(eq(annualKey), any(), eq(request.getId()));

            TransitionResult resubmitted = leaveRequestService.submit(request.getId(), org.employeeId());
            printOutput("Resubmitted", resubmitted);

            assertEquals(LeaveStatus.PENDING_MANAGER, resubmitted.getNewStatus());
            LeaveRequest reloaded = leaveRequestService.get(request.getId());
            assertEquals(2, reloaded.getSubmissionRound());
            assertEquals(2, engine.currentRound(reloaded).size());
            assertTrue(engine.currentRound(reloaded).stream().noneMatch(ApprovalStep::isDecided));
            assertEquals(4, engine.history(request.getId()).size());
            assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("5")));
            printSuccess("Second round opened with a fresh reservation");
        }
    }

    @Nested
    @DisplayName("Parallel HR + HR")
    class Parallel {

        @BeforeEach
        void parallelWorkflow() {
            fixtures.workflow(org.officeId(), WorkflowMode.PARALLEL, StepType.HR, StepType.HR);
        }

        @Test
        @DisplayName("Approved only once both HR steps approve")
        void bothMustApprove() {
            printTestHeader("Parallel Both Approve");
            LeaveRequest request = submitWeek(org.annualTypeId());
            assertEquals(LeaveStatus.PENDING_HR, request.getStatus());

            TransitionResult first = engine.decideStep(request.getId(),
                    stepOf(request, org.hrOneId()).getId(), org.hrOneId(), ApprovalAction.APPROVED, null);
            printOutput("After first HR", first);
            assertEquals(LeaveStatus.PENDING_HR, first.getNewStatus());
            verify(ledger, never()).commit(any(), any(), any());

            TransitionResult second = engine.decideStep(request.getId(),
                    stepOf(request, org.hrTwoId()).getId(), org.hrTwoId(), ApprovalAction.APPROVED, null);
            printOutput("After second HR", second);
            assertEquals(LeaveStatus.APPROVED, second.getNewStatus());
            verify(ledger, times(1)).commit(eq(annualKey), any(), eq(request.getId()));
            printSuccess("Approval required every parallel step");
        }

        @Test
        @DisplayName("One refusal refuses at once, releases once, and closes the other step")
        void oneRefusalRefuses() {
            printTestHeader("Parallel Refusal");
            LeaveRequest request = submitWeek(org.annualTypeId());
            UUID otherStepId = stepOf(request, org.hrTwoId()).getId();

            TransitionResult refused = engine.decideStep(request.getId(),
                    stepOf(request, org.hrOneId()).getId(), org.hrOneId(), ApprovalAction.REFUSED, "Team is short");
            printOutput("After refusal", refused);

            assertEquals(LeaveStatus.REFUSED, refused.getNewStatus());
            assertEquals(0, balance().getPendingDays().signum());
            assertEquals(0, balance().remaining().compareTo(new BigDecimal("25")));
            verify(ledger, times(1)).release(eq(annualKey), any(), eq(request.getId()));

            assertThrows(InvalidTransitionException.class, () -> engine.decideStep(request.getId(),
                    otherStepId, org.hrTwoId(), ApprovalAction.APPROVED, null));
            verify(ledger, times(1)).release(any(), any(), any());
            verify(ledger, never()).commit(any(), any(), any());
            printSuccess("Refusal settled the reservation exactly once");
        }

        @Test
        @DisplayName("Concurrent approve and refuse settle the ledger exactly once")
        void concurrentDecisions() throws InterruptedException {
            printTestHeader("Parallel Concurrent Decisions");
            LeaveRequest request = submitWeek(org.annualTypeId());
            UUID stepOne = stepOf(request, org.hrOneId()).getId();
            UUID stepTwo = stepOf(request, org.hrTwoId()).getId();

            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(2);
            AtomicInteger succeeded = new AtomicInteger();

            executor.submit(() -> {
                try {
                    start.await();
                    engine.decideStep(request.getId(), stepOne, org.hrOneId(), ApprovalAction.APPROVED, null);
                    succeeded.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Approve failed: " + e.getMessage());
                } finally {
                    done.countDown();
                }
            });
            executor.submit(() -> {
                try {
                    start.await();
                    engine.decideStep(request.getId(), stepTwo, org.hrTwoId(), ApprovalAction.REFUSED, "No");
                    succeeded.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Refuse failed: " + e.getMessage());
                } finally {
                    done.countDown();
                }
            });
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            LeaveRequest reloaded = leaveRequestService.get(request.getId());
            printOutput("Succeeded", succeeded.get());
            printOutput("Final status", reloaded.getStatus());

            assertEquals(LeaveStatus.REFUSED, reloaded.getStatus());
            assertEquals(0, balance().getPendingDays().signum());
            assertEquals(0, balance().getUsedDays().signum());
            verify(ledger, times(1)).release(any(), any(), any());
            verify(ledger, never()).commit(any(), any(), any());
            printSuccess("Ledger settled once");
        }
    }

    @Nested
    @DisplayName("Rejected decisions")
    class RejectedDecisions {

        @Test
        @DisplayName("A second decision on the same step fails and changes nothing")
        void doubleDecision() {
            printTestHeader("Double Decision");
            LeaveRequest request = submitWeek(org.annualTypeId());
            UUID managerStepId = stepOf(request, org.managerId()).getId();

            engine.decideStep(request.getId(), managerStepId, org.managerId(), ApprovalAction.APPROVED, null);
            long eventsBefore = transitionEvents(request).size();

            assertThrows(InvalidTransitionException.class, () -> engine.decideStep(request.getId(),
                    managerStepId, org.managerId(), ApprovalAction.REFUSED, "Changed my mind"));
            assertThrows(ApprovalAuthorizationException.class, () -> engine.decideStep(request.getId(),
                    managerStepId, org.hrOneId(), ApprovalAction.REFUSED, "Not your step"));

            ApprovalStep step = stepOf(request, org.managerId());
            assertEquals(ApprovalAction.APPROVED, step.getAction());
            assertEquals(LeaveStatus.PENDING_HR, leaveRequestService.get(request.getId()).getStatus());
            assertEquals(eventsBefore, transitionEvents(request).size());
            assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("5")));
            printSuccess("First decision stands");
        }

        @Test
        @DisplayName("Refusing without a comment is rejected")
        void refusalNeedsComment() {
            printTestHeader("Refusal Without Comment");
            LeaveRequest request = submitWeek(org.annualTypeId());
            UUID managerStepId = stepOf(request, org.managerId()).getId();

            assertThrows(LeaveValidationException.class, () -> engine.decideStep(request.getId(),
                    managerStepId, org.managerId(), ApprovalAction.REFUSED, "   "));

            assertFalse(stepOf(request, org.managerId()).isDecided());
            verify(ledger, never()).release(any(), any(), any());
            printSuccess("Comment required");
        }

        @Test
        @DisplayName("Someone other than the assigned approver is refused")
        void wrongApprover() {
            printTestHeader("Wrong Approver");
            LeaveRequest request = submitWeek(org.annualTypeId());
            UUID managerStepId = stepOf(request, org.managerId()).getId();

            ApprovalAuthorizationException e = assertThrows(ApprovalAuthorizationException.class,
                    () -> engine.decideStep(request.getId(), managerStepId, org.hrTwoId(),
                            ApprovalAction.APPROVED, null));
            printOutput("Exception", e.getMessage());

            assertFalse(stepOf(request, org.managerId()).isDecided());
            printSuccess("Unauthorized decision rejected");
        }

        @Test
        @DisplayName("A delegate may decide on the approver's behalf")
        void delegateDecides() {
            printTestHeader("Delegate Decides");
            UUID delegateId = fixtures.employee(org.officeId(), null, "Deputy", false, LocalDate.of(2018, 1, 1));
            fixtures.delegation(org.managerId(), delegateId, LocalDate.now().minusDays(1), LocalDate.now().plusDays(1));
            LeaveRequest request = submitWeek(org.annualTypeId());

            TransitionResult result = engine.decideStep(request.getId(),
                    stepOf(request, org.managerId()).getId(), delegateId, ApprovalAction.APPROVED, null);

            assertEquals(LeaveStatus.PENDING_HR, result.getNewStatus());
            assertEquals(delegateId, stepOf(request, org.managerId()).getDecidedBy());
            printSuccess("Delegation honoured");
        }
    }

    @Nested
    @DisplayName("Cancellation and exempt types")
    class CancellationAndExempt {

        @Test
        @DisplayName("Cancelling a pending request releases its days; cancelling again fails")
        void cancelPending() {
            printTestHeader("Cancel Pending");
            LeaveRequest request = submitWeek(org.annualTypeId());

            TransitionResult cancelled = engine.cancel(request.getId(), org.employeeId());
            assertEquals(LeaveStatus.CANCELLED, cancelled.getNewStatus());
            assertEquals(0, balance().remaining().compareTo(new BigDecimal("25")));

            assertThrows(InvalidTransitionException.class, () -> engine.cancel(request.getId(), org.employeeId()));
            verify(ledger, times(1)).release(any(), any(), any());
            printSuccess("Terminal request cannot be cancelled twice");
        }

        @Test
        @DisplayName("Only the owner may cancel")
        void cancelByOther() {
            printTestHeader("Cancel By Other");
            LeaveRequest request = submitWeek(org.annualTypeId());

            assertThrows(ApprovalAuthorizationException.class, () -> engine.cancel(request.getId(), org.managerId()));
            assertEquals(LeaveStatus.PENDING_MANAGER, leaveRequestService.get(request.getId()).getStatus());
            printSuccess("Cancellation restricted to the owner");
        }

        @Test
        @DisplayName("An exempt leave type never touches the ledger, even when it deducts from the annual balance")
        void exemptTypeSkipsLedger() {
            printTestHeader("Exempt Type");
            LeaveRequestCommand command = LeaveRequestCommand.builder()
                .employeeId(org.employeeId())
                .leaveTypeId(org.exceptionalTypeId())
                .startDate(MONDAY)
                .endDate(FRIDAY)
                .exceptionalReason("Family event")
                .build();
            LeaveRequest request = leaveRequestService.create(command, org.employeeId(), null).getRequest();
            assertNull(request.getBalanceType());

            engine.decideStep(request.getId(), stepOf(request, org.managerId()).getId(),
                    org.managerId(), ApprovalAction.APPROVED, null);
            TransitionResult approved = engine.decideStep(request.getId(), stepOf(request, org.hrOneId()).getId(),
                    org.hrOneId(), ApprovalAction.APPROVED, null);

            assertEquals(LeaveStatus.APPROVED, approved.getNewStatus());
            verify(ledger, never()).reserve(any(), any(), any());
            verify(ledger, never()).commit(any(), any(), any());
            verify(ledger, never()).release(any(), any(), any());
            assertEquals(0, balance().remaining().compareTo(new BigDecimal("25")));
            printSuccess("Balance untouched");
        }
    }

    @Test
    @DisplayName("Every transition lands in the outbox in the same transaction")
    void transitionsReachOutbox() {
        printTestHeader("Transition Events");
        LeaveRequest request = submitWeek(org.annualTypeId());
        engine.decideStep(request.getId(), stepOf(request, org.managerId()).getId(),
                org.managerId(), ApprovalAction.APPROVED, null);

        List<OutboxEvent> events = transitionEvents(request);
        printOutput("Events", events.size());

        assertEquals(2, events.size());
        assertTrue(events.get(0).getPayload().contains("\"newStatus\":\"PENDING_MANAGER\""));
        assertTrue(events.get(1).getPayload().contains("\"newStatus\":\"PENDING_HR\""));
        assertTrue(events.get(1).getPayload().contains(org.hrOneId().toString()));
        printSuccess("Submission and decision events recorded");
    }

    @Nested
    @DisplayName("Approval inbox")
    class Inbox {

        private List<ApprovalInboxService.PendingApproval> inboxOf(UUID actorId, LeaveRequest request) {
            return inboxService.actionableFor(actorId).stream()
                .filter(pending -> pending.getRequest().getId().equals(request.getId()))
                .toList();
        }

        @Test
        @DisplayName("Only the approver of the current stage sees the step")
        void followsCurrentStage() {
            printTestHeader("Inbox Follows Stage");
            LeaveRequest request = submitWeek(org.annualTypeId());

            assertEquals(1, inboxOf(org.managerId(), request).size());
            assertTrue(inboxOf(org.hrOneId(), request).isEmpty());

            engine.decideStep(request.getId(), stepOf(request, org.managerId()).getId(),
                    org.managerId(), ApprovalAction.APPROVED, null);

            assertTrue(inboxOf(org.managerId(), request).isEmpty());
            List<ApprovalInboxService.PendingApproval> hrInbox = inboxOf(org.hrOneId(), request);
            printOutput("HR inbox", hrInbox.size());
            assertEquals(1, hrInbox.size());
            assertEquals(StepType.HR, hrInbox.get(0).getStep().getStepType());
            assertFalse(hrInbox.get(0).isDelegated());
            assertTrue(inboxOf(org.employeeId(), request).isEmpty());
            printSuccess("Inbox moved with the stage");
        }

        @Test
        @DisplayName("A delegate sees the delegator's steps flagged as delegated")
        void delegateInbox() {
            printTestHeader("Delegate Inbox");
            UUID delegateId = fixtures.employee(org.officeId(), null, "Deputy", false, LocalDate.of(2018, 1, 1));
            fixtures.delegation(org.managerId(), delegateId, LocalDate.now().minusDays(1), LocalDate.now().plusDays(1));
            LeaveRequest request = submitWeek(org.annualTypeId());

            List<ApprovalInboxService.PendingApproval> inbox = inboxOf(delegateId, request);

            assertEquals(1, inbox.size());
            assertTrue(inbox.get(0).isDelegated());
            assertEquals(org.managerId(), inbox.get(0).getStep().getApproverId());
            printSuccess("Delegated step listed");
        }
    }

    private List<OutboxEvent> transitionEvents(LeaveRequest request) {
        return outboxService.getEventsForAggregate(WorkflowTransitionEvent.AGGREGATE_TYPE, request.getId());
    }
}
