package com.flagship.leave_ledger.workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowStateMachineTest {

    private static final UUID REQUEST_ID = UUID.randomUUID();

    private final WorkflowStateMachine stateMachine = new WorkflowStateMachine();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static ApprovalStep step(int order, StepType type) {
        return ApprovalStep.open(REQUEST_ID, 1, order, type, UUID.randomUUID());
    }

    private static ApprovalStep decided(ApprovalStep step, ApprovalAction action) {
        return step.decide(action, "comment", step.getApproverId(), Instant.now());
    }

    @Nested
    @DisplayName("Sequential workflow")
    class Sequential {

        private final ApprovalStep manager = step(1, StepType.MANAGER);
        private final ApprovalStep hr = step(2, StepType.HR);

        @Test
        @DisplayName("Submission waits on the manager")
        void initialStatus() {
            printTestHeader("Sequential Initial Status");

            LeaveStatus status = stateMachine.evaluate(WorkflowMode.SEQUENTIAL, LeaveStatus.DRAFT, List.of(manager, hr));
            printOutput("Status", status);

            assertEquals(LeaveStatus.PENDING_MANAGER, status);
            printSuccess("Manager stage first");
        }

        @Test
        @DisplayName("Manager approval moves the request to HR, HR approval approves it")
        void managerThenHr() {
            printTestHeader("Manager Then HR");

            List<ApprovalStep> afterManager = List.of(decided(manager, ApprovalAction.APPROVED), hr);
            LeaveStatus status = stateMachine.evaluate(WorkflowMode.SEQUENTIAL, LeaveStatus.PENDING_MANAGER, afterManager);
            printOutput("After manager", status);
            assertEquals(LeaveStatus.PENDING_HR, status);

            List<ApprovalStep> afterHr = List.of(afterManager.get(0), decided(hr, ApprovalAction.APPROVED));
            status = stateMachine.evaluate(WorkflowMode.SEQUENTIAL, LeaveStatus.PENDING_HR, afterHr);
            printOutput("After HR", status);
            assertEquals(LeaveStatus.APPROVED, status);
            printSuccess("MANAGER -> HR -> APPROVED");
        }

        @Test
        @DisplayName("Only the lowest undecided step is actionable")
        void onlyFirstActionable() {
            printTestHeader("Sequential Actionable Steps");

            List<ApprovalStep> steps = List.of(manager, hr);
            List<ApprovalStep> actionable = stateMachine.actionableSteps(
                    WorkflowMode.SEQUENTIAL, LeaveStatus.PENDING_MANAGER, steps);
            printOutput("Actionable", actionable.size());

            assertEquals(List.of(manager), actionable);
            assertFalse(stateMachine.isActionable(WorkflowMode.SEQUENTIAL, LeaveStatus.PENDING_MANAGER, steps, hr),
                    "HR must wait for the manager");
            printSuccess("HR step not decidable out of order");
        }

        @Test
        @DisplayName("A refusal ends the workflow even with steps left")
        void refusalWins() {
            printTestHeader("Sequential Refusal");

            LeaveStatus status = stateMachine.evaluate(WorkflowMode.SEQUENTIAL, LeaveStatus.PENDING_MANAGER,
                    List.of(decided(manager, ApprovalAction.REFUSED), hr));

            assertEquals(LeaveStatus.REFUSED, status);
            printSuccess("Refused immediately");
        }

        @Test
        @DisplayName("Returning sends the request back to the employee")
        void returned() {
            printTestHeader("Sequential Return");

            LeaveStatus status = stateMachine.evaluate(WorkflowMode.SEQUENTIAL, LeaveStatus.PENDING_MANAGER,
                    List.of(decided(manager, ApprovalAction.RETURNED), hr));

            assertEquals(LeaveStatus.RETURNED, status);
            printSuccess("Returned for revision");
        }
    }

    @Nested
    @DisplayName("Parallel workflow")
    class Parallel {

        private final ApprovalStep hrOne = step(1, StepType.HR);
        private final ApprovalStep hrTwo = step(2, StepType.HR);

        @Test
        @DisplayName("Both HR steps are actionable at once")
        void allStageStepsActionable() {
            printTestHeader("Parallel Actionable Steps");

            List<ApprovalStep> actionable = stateMachine.actionableSteps(
                    WorkflowMode.PARALLEL, LeaveStatus.PENDING_HR, List.of(hrOne, hrTwo));

            assertEquals(2, actionable.size());
            printSuccess("Both steps decidable");
        }

        @Test
        @DisplayName("One approval out of two keeps the request pending")
        void partialApproval() {
            printTestHeader("Parallel Partial Approval");

            LeaveStatus status = stateMachine.evaluate(WorkflowMode.PARALLEL, LeaveStatus.PENDING_HR,
                    List.of(decided(hrOne, ApprovalAction.APPROVED), hrTwo));
            printOutput("Status", status);

            assertEquals(LeaveStatus.PENDING_HR, status);
            printSuccess("Still waiting on the second approver");
        }

        @Test
        @DisplayName("Approval by every step approves the request")
        void allApproved() {
            printTestHeader("Parallel Full Approval");

            LeaveStatus status = stateMachine.evaluate(WorkflowMode.PARALLEL, LeaveStatus.PENDING_HR,
                    List.of(decided(hrOne, ApprovalAction.APPROVED), decided(hrTwo, ApprovalAction.APPROVED)));

            assertEquals(LeaveStatus.APPROVED, status);
            printSuccess("Approved");
        }

        @Test
        @DisplayName("One refusal refuses the request while the other step is open")
        void singleRefusal() {
            printTestHeader("Parallel Refusal");

            LeaveStatus status = stateMachine.evaluate(WorkflowMode.PARALLEL, LeaveStatus.PENDING_HR,
                    List.of(hrOne, decided(hrTwo, ApprovalAction.REFUSED)));

            assertEquals(LeaveStatus.REFUSED, status);
            printSuccess("Refused without waiting");
        }

        @Test
        @DisplayName("Manager and HR stages still run one after the other")
        void stagesInOrder() {
            printTestHeader("Parallel Stages");

            ApprovalStep manager = step(1, StepType.MANAGER);
            ApprovalStep hr = step(2, StepType.HR);

            assertFalse(stateMachine.isActionable(WorkflowMode.PARALLEL, LeaveStatus.PENDING_MANAGER,
                    List.of(manager, hr), hr));
            LeaveStatus status = stateMachine.evaluate(WorkflowMode.PARALLEL, LeaveStatus.PENDING_MANAGER,
                    List.of(decided(manager, ApprovalAction.APPROVED), hr));
            assertEquals(LeaveStatus.PENDING_HR, status);
            printSuccess("HR stage opens once the manager stage clears");
        }
    }

    @Test
    @DisplayName("Decided steps are never actionable")
    void decidedNotActionable() {
        printTestHeader("Decided Step");

        ApprovalStep manager = decided(step(1, StepType.MANAGER), ApprovalAction.APPROVED);

        assertFalse(stateMachine.isActionable(WorkflowMode.SEQUENTIAL, LeaveStatus.PENDING_MANAGER,
                List.of(manager), manager));
        assertThrows(IllegalStateException.class,
                () -> manager.decide(ApprovalAction.REFUSED, "again", UUID.randomUUID(), Instant.now()));
        printSuccess("Second decision rejected");
    }
}
