package com.flagship.leave_ledger.leave;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.leave_ledger.LeaveTestFixtures;
import com.flagship.leave_ledger.balance.BalanceKey;
import com.flagship.leave_ledger.balance.BalanceType;
import com.flagship.leave_ledger.balance.LeaveBalance;
import com.flagship.leave_ledger.balance.LeaveBalanceLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP contract of leave intake and decisions: status codes, idempotent
 * replays and the absence of side effects on rejected requests.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class LeaveRequestControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("leave_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("leave.reminders.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private LeaveBalanceLedger ledger;

    @Autowired
    private RedisTemplate<String, String> redisTemplate;

    @Autowired
    private LeaveRequestService leaveRequestService;

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

    private Map<String, Object> body(String start, String end) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("employee_id", org.employeeId());
        body.put("leave_type_id", org.annualTypeId());
        body.put("start_date", start);
        body.put("end_date", end);
        body.put("reason", "Family trip");
        return body;
    }

    private MvcResult postCreate(Map<String, Object> body, String idempotencyKey) throws Exception {
        var request = post("/api/leave-requests")
            .contentType(MediaType.APPLICATION_JSON)
            .header("X-Actor-Id", org.employeeId().toString())
            .content(objectMapper.writeValueAsString(body));
        if (idempotencyKey != null) {
            request = request.header("Idempotency-Key", idempotencyKey);
        }
        return mockMvc.perform(request).andReturn();
    }

    private LeaveBalance balance() {
        return ledger.find(annualKey).orElseThrow();
    }

    @Test
    @DisplayName("Creating a request returns 201 and reserves its working days")
    void create() throws Exception {
        printTestHeader("Create Leave Request");
        Map<String, Object> body = body("2026-01-05", "2026-01-09");
        printInput("Body", body);

        mockMvc.perform(post("/api/leave-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.employeeId().toString())
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.status").value("PENDING_MANAGER"))
            .andExpect(jsonPath("$.total_days").value(5.0));

        assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("5")));
        printSuccess("Request created and days reserved");
    }

    @Test
    @DisplayName("Replaying an idempotency key returns the original request with 200")
    void idempotentReplay() throws Exception {
        printTestHeader("Idempotent Replay");
        String key = UUID.randomUUID().toString();
        Map<String, Object> body = body("2026-02-02", "2026-02-03");

        MvcResult first = postCreate(body, key);
        MvcResult second = postCreate(body, key);
        printOutput("First", first.getResponse().getStatus() + " " + first.getResponse().getContentAsString());
        printOutput("Second", second.getResponse().getStatus() + " " + second.getResponse().getContentAsString());

        assertEquals(201, first.getResponse().getStatus());
        assertEquals(200, second.getResponse().getStatus());
        JsonNode firstJson = objectMapper.readTree(first.getResponse().getContentAsString());
        JsonNode secondJson = objectMapper.readTree(second.getResponse().getContentAsString());
        assertEquals(firstJson.get("id").asText(), secondJson.get("id").asText());
        assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("2")), "Reserved only once");
        printSuccess("Same request returned");
    }

    @Test
    @DisplayName("The database answers a replay when Redis has lost the key")
    void replayFromDatabase() throws Exception {
        printTestHeader("Replay From Database");
        String key = UUID.randomUUID().toString();
        Map<String, Object> body = body("2026-03-02", "2026-03-02");

        MvcResult first = postCreate(body, key);
        redisTemplate.delete("leave-idempotency:" + key);
        MvcResult second = postCreate(body, key);

        assertEquals(200, second.getResponse().getStatus());
        assertEquals(objectMapper.readTree(first.getResponse().getContentAsString()).get("id").asText(),
                objectMapper.readTree(second.getResponse().getContentAsString()).get("id").asText());
        printSuccess("Database fallback replayed the request");
    }

    @Test
    @DisplayName("Intake replays a stored key behind the employee lock, whatever the caches say")
    void intakeReplaysStoredKey() {
        printTestHeader("Intake Replays Stored Key");
        String key = UUID.randomUUID().toString();
        LeaveRequestCommand command = LeaveRequestCommand.builder()
            .employeeId(org.employeeId())
            .leaveTypeId(org.annualTypeId())
            .startDate(LocalDate.of(2026, 4, 6))
            .endDate(LocalDate.of(2026, 4, 7))
            .reason("Family trip")
            .build();

        IntakeResult first = leaveRequestService.create(command, org.employeeId(), key);
        IntakeResult second = leaveRequestService.create(command, org.employeeId(), key);
        printOutput("First", first);
        printOutput("Second", second);

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getRequest().getId(), second.getRequest().getId());
        assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("2")), "Reserved only once");
        printSuccess("Second call replayed instead of reporting an overlap");
    }

    @Test
    @DisplayName("Concurrent creates with the same idempotency key yield one 201 and one 200")
    void concurrentIdempotentCreates() throws Exception {
        printTestHeader("Concurrent Idempotent Creates");
        String key = UUID.randomUUID().toString();
        Map<String, Object> body = body("2026-05-04", "2026-05-05");
        printInput("Idempotency-Key", key);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MvcResult>> calls = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            calls.add(executor.submit(() -> {
                start.await();
                return postCreate(body, key);
            }));
        }
        start.countDown();

        List<Integer> statuses = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (Future<MvcResult> call : calls) {
            MvcResult result = call.get(30, TimeUnit.SECONDS);
            printOutput("Response", result.getResponse().getStatus() + " " + result.getResponse().getContentAsString());
            statuses.add(result.getResponse().getStatus());
            ids.add(objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText());
        }
        executor.shutdown();

        Collections.sort(statuses);
        assertEquals(List.of(200, 201), statuses);
        assertEquals(1, ids.size(), "Both calls answer with the same request");
        assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("2")), "Reserved only once");
        printSuccess("One created, one replayed");
    }

    @Test
    @DisplayName("An end date before the start date is rejected with 400")
    void invalidDates() throws Exception {
        printTestHeader("Invalid Dates");

        MvcResult result = postCreate(body("2026-01-09", "2026-01-05"), null);
        printOutput("Response", result.getResponse().getContentAsString());

        assertEquals(400, result.getResponse().getStatus());
        assertEquals(0, balance().getPendingDays().signum());
        printSuccess("Range rejected");
    }

    @Test
    @DisplayName("A request larger than the remaining balance is rejected with 400")
    void insufficientBalance() throws Exception {
        printTestHeader("Insufficient Balance");
        jdbcTemplate.update("UPDATE leave_balances SET total_days = 2 WHERE employee_id = ?", org.employeeId());

        mockMvc.perform(post("/api/leave-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.employeeId().toString())
                .content(objectMapper.writeValueAsString(body("2026-01-05", "2026-01-09"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Insufficient Balance"))
            .andExpect(jsonPath("$.details.remaining").value("2.0"))
            .andExpect(jsonPath("$.details.requested").value("5.0"));

        assertEquals(0, balance().getPendingDays().signum());
        Integer requests = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM leave_requests WHERE employee_id = ?", Integer.class, org.employeeId());
        assertEquals(0, requests);
        printSuccess("Nothing persisted");
    }

    @Test
    @DisplayName("Overlapping a pending request returns 409 and reserves nothing")
    void overlap() throws Exception {
        printTestHeader("Overlap");
        MvcResult first = postCreate(body("2026-01-05", "2026-01-09"), null);
        assertEquals(201, first.getResponse().getStatus());
        String existingId = objectMapper.readTree(first.getResponse().getContentAsString()).get("id").asText();

        mockMvc.perform(post("/api/leave-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.employeeId().toString())
                .content(objectMapper.writeValueAsString(body("2026-01-08", "2026-01-12"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.conflictingRequestId").value(existingId));

        assertEquals(0, balance().getPendingDays().compareTo(new BigDecimal("5")), "Only the first reservation");
        printSuccess("Overlap refused");
    }

    @Test
    @DisplayName("Creating for someone else is forbidden")
    void createForSomeoneElse() throws Exception {
        printTestHeader("Create For Someone Else");

        mockMvc.perform(post("/api/leave-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.managerId().toString())
                .content(objectMapper.writeValueAsString(body("2026-01-05", "2026-01-09"))))
            .andExpect(status().isForbidden());
        printSuccess("Only the owner may create");
    }

    @Test
    @DisplayName("Decision endpoint: 200 for the approver, 403 for others even on a decided step, 400 for a refusal without comment")
    void decisions() throws Exception {
        printTestHeader("Decisions");
        MvcResult created = postCreate(body("2026-04-06", "2026-04-07"), null);
        String requestId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();

        MvcResult detail = mockMvc.perform(get("/api/leave-requests/" + requestId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.steps.length()").value(2))
            .andReturn();
        JsonNode steps = objectMapper.readTree(detail.getResponse().getContentAsString()).get("steps");
        String managerStepId = steps.get(0).get("id").asText();
        assertEquals("MANAGER", steps.get(0).get("step_type").asText());
        String decisionUrl = "/api/leave-requests/" + requestId + "/steps/" + managerStepId + "/decision";

        mockMvc.perform(post(decisionUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.hrOneId().toString())
                .content("{\"action\":\"APPROVED\"}"))
            .andExpect(status().isForbidden());

        mockMvc.perform(post(decisionUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.managerId().toString())
                .content("{\"action\":\"REFUSED\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post(decisionUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.managerId().toString())
                .content("{\"action\":\"APPROVED\",\"comment\":\"Fine by me\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.old_status").value("PENDING_MANAGER"))
            .andExpect(jsonPath("$.new_status").value("PENDING_HR"));

        mockMvc.perform(post(decisionUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.managerId().toString())
                .content("{\"action\":\"APPROVED\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post(decisionUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", org.hrOneId().toString())
                .content("{\"action\":\"APPROVED\"}"))
            .andExpect(status().isForbidden());
        printSuccess("Decision contract honoured");
    }

    @Test
    @DisplayName("Cancelling twice returns 400 the second time")
    void cancelTwice() throws Exception {
        printTestHeader("Cancel Twice");
        MvcResult created = postCreate(body("2026-05-04", "2026-05-05"), null);
        String requestId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();

        mockMvc.perform(post("/api/leave-requests/" + requestId + "/cancel")
                .header("X-Actor-Id", org.employeeId().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.new_status").value("CANCELLED"));

        mockMvc.perform(post("/api/leave-requests/" + requestId + "/cancel")
                .header("X-Actor-Id", org.employeeId().toString()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.status").value("CANCELLED"));

        assertEquals(0, balance().getPendingDays().signum());
        printSuccess("Terminal request left alone");
    }

    @Test
    @DisplayName("Working-days preview subtracts office holidays and half days")
    void workingDaysPreview() throws Exception {
        printTestHeader("Working Days Preview");
        fixtures.holiday(org.officeId(), LocalDate.of(2026, 1, 7));

        mockMvc.perform(get("/api/leave-requests/working-days")
                .param("employeeId", org.employeeId().toString())
                .param("start", "2026-01-05")
                .param("end", "2026-01-09"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_days").value(4.0))
            .andExpect(jsonPath("$.holidays[0]").value("2026-01-07"));

        mockMvc.perform(get("/api/leave-requests/working-days")
                .param("employeeId", org.employeeId().toString())
                .param("start", "2026-01-05")
                .param("end", "2026-01-09")
                .param("startHalfDay", "AFTERNOON")
                .param("endHalfDay", "MORNING"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_days").value(3.0));
        printSuccess("Preview computed");
    }

    @Test
    @DisplayName("Missing actor header is a bad request")
    void missingActor() throws Exception {
        printTestHeader("Missing Actor");

        mockMvc.perform(post("/api/leave-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body("2026-01-05", "2026-01-09"))))
            .andExpect(status().isBadRequest());
        printSuccess("Header required");
    }

    @Test
    @DisplayName("The manager's inbox lists the new request's step")
    void approvalInbox() throws Exception {
        printTestHeader("Approval Inbox");
        MvcResult created = postCreate(body("2026-04-06", "2026-04-07"), null);
        String requestId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();

        MvcResult inbox = mockMvc.perform(get("/api/approvals/pending")
                .header("X-Actor-Id", org.managerId().toString()))
            .andExpect(status().isOk())
            .andReturn();
        printOutput("Inbox", inbox.getResponse().getContentAsString());

        JsonNode entry = null;
        for (JsonNode node : objectMapper.readTree(inbox.getResponse().getContentAsString())) {
            if (requestId.equals(node.get("leave_request_id").asText())) {
                entry = node;
            }
        }
        assertNotNull(entry);
        assertEquals("MANAGER", entry.get("step_type").asText());
        assertFalse(entry.get("delegated").asBoolean());
        assertEquals("PENDING_MANAGER", entry.get("status").asText());
        printSuccess("Step listed for the manager");
    }
}
