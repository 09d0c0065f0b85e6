package com.flagship.credit_ledger.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.transaction.dto.CreateTransactionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP contract of the transaction endpoints.
 */
@SpringBootTest
@Testcontainers
@AutoConfigureMockMvc
class TransactionControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("credit_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = "api-" + UUID.randomUUID();
    }

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

    private String body(String type, String amount, String idempotencyKey) throws Exception {
        return objectMapper.writeValueAsString(new CreateTransactionRequest(
            type, userId, "GOLD_COINS", amount, idempotencyKey, Map.of("source", "test")));
    }

    private String postTyped(String path, String amount, String idempotencyKey, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/transactions/" + path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(null, amount, idempotencyKey)))
            .andExpect(status().is(expectedStatus))
            .andReturn();
        return result.getResponse().getContentAsString();
    }

    @Test
    @DisplayName("First TOPUP returns 201; the same request again returns 200 with the same body")
    void testTopupIsIdempotent() throws Exception {
        printTestHeader("Idempotent Top-up over HTTP");
        String idempotencyKey = "k1-" + UUID.randomUUID();

        String first = postTyped("topup", "100.00", idempotencyKey, 201);
        String second = postTyped("topup", "100.00", idempotencyKey, 200);
        printOutput("First", first);
        printOutput("Second", second);

        JsonNode firstJson = objectMapper.readTree(first);
        JsonNode secondJson = objectMapper.readTree(second);
        assertEquals(firstJson, secondJson);
        assertEquals("TOPUP", firstJson.get("transaction_type").asText());
        assertEquals("COMPLETED", firstJson.get("status").asText());
        assertEquals("100.00", firstJson.get("amount").asText());
        assertEquals("test", firstJson.get("metadata").get("source").asText());

        mockMvc.perform(get("/api/v1/wallets/" + userId + "/balance"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balances[0].balance").value("100.00"));
        printSuccess("One transaction, balance 100.00");
    }

    @Test
    @DisplayName("SPEND above the balance returns 422 with balance details")
    void testInsufficientBalance() throws Exception {
        postTyped("topup", "50.00", "seed-" + UUID.randomUUID(), 201);

        mockMvc.perform(post("/api/v1/transactions/spend")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(null, "75.00", "k2-" + UUID.randomUUID())))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("Insufficient Balance"))
            .andExpect(jsonPath("$.retryable").value(false))
            .andExpect(jsonPath("$.details.current_balance").value("50.00"))
            .andExpect(jsonPath("$.details.required_amount").value("75.00"))
            .andExpect(jsonPath("$.details.asset_type").value("GOLD_COINS"));
    }

    @Test
    @DisplayName("Generic endpoint takes the type from the body")
    void testGenericEndpoint() throws Exception {
        mockMvc.perform(post("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("bonus", "7.25", "bonus-" + UUID.randomUUID())))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.transaction_type").value("BONUS"))
            .andExpect(jsonPath("$.amount").isString())
            .andExpect(jsonPath("$.amount").value("7.25"));

        mockMvc.perform(post("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(null, "7.25", "none-" + UUID.randomUUID())))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown, reserved and mismatched types are rejected with 400")
    void testRejectedTypes() throws Exception {
        postTyped("withdraw", "1.00", "t-" + UUID.randomUUID(), 400);
        postTyped("refund", "1.00", "t-" + UUID.randomUUID(), 400);
        postTyped("adjustment", "1.00", "t-" + UUID.randomUUID(), 400);

        mockMvc.perform(post("/api/v1/transactions/topup")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("SPEND", "1.00", "t-" + UUID.randomUUID())))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Malformed amounts and bodies are rejected with 400")
    void testInvalidRequests() throws Exception {
        mockMvc.perform(post("/api/v1/transactions/topup")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(null, "1.005", "t-" + UUID.randomUUID())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"));

        mockMvc.perform(post("/api/v1/transactions/topup")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(null, "ten", "t-" + UUID.randomUUID())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amount").exists());

        mockMvc.perform(post("/api/v1/transactions/topup")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(null, "1.00", "")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.idempotency_key").doesNotExist())
            .andExpect(jsonPath("$.details.idempotencyKey").exists());

        mockMvc.perform(post("/api/v1/transactions/topup")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    @DisplayName("A transaction and its two legs can be read back")
    void testGetTransactionAndEntries() throws Exception {
        String created = postTyped("topup", "12.00", "read-" + UUID.randomUUID(), 201);
        String id = objectMapper.readTree(created).get("id").asText();

        mockMvc.perform(get("/api/v1/transactions/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id))
            .andExpect(jsonPath("$.user_id").value(userId));

        mockMvc.perform(get("/api/v1/transactions/" + id + "/entries"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].entry_type").value("DEBIT"))
            .andExpect(jsonPath("$[1].entry_type").value("CREDIT"))
            .andExpect(jsonPath("$[0].amount").value("12.00"))
            .andExpect(jsonPath("$[1].amount").value("12.00"));
    }

    @Test
    @DisplayName("Unknown transaction ids return 404")
    void testUnknownTransaction() throws Exception {
        String id = UUID.randomUUID().toString();

        mockMvc.perform(get("/api/v1/transactions/" + id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));
        mockMvc.perform(get("/api/v1/transactions/" + id + "/entries"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Correlation id is echoed back, or generated when absent")
    void testCorrelationIdHeader() throws Exception {
        mockMvc.perform(get("/api/v1/assets").header("X-Correlation-ID", "trace-123"))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Correlation-ID", "trace-123"));

        mockMvc.perform(get("/api/v1/assets"))
            .andExpect(status().isOk())
            .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    @DisplayName("Error bodies carry the request's correlation id")
    void testErrorCarriesCorrelationId() throws Exception {
        mockMvc.perform(get("/api/v1/transactions/" + UUID.randomUUID())
                .header("X-Correlation-ID", "trace-404"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.correlation_id").value("trace-404"));
    }

    @Test
    @DisplayName("Unknown paths return 404 and unsupported methods return 405")
    void testRoutingErrors() throws Exception {
        printTestHeader("Routing Errors");

        mockMvc.perform(get("/api/v1/no-such-endpoint"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));

        MvcResult result = mockMvc.perform(delete("/api/v1/transactions/" + UUID.randomUUID()))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.error").value("Method Not Allowed"))
            .andExpect(header().exists("Allow"))
            .andReturn();
        printOutput("Allow", result.getResponse().getHeader("Allow"));
        printSuccess("Routing errors are not reported as 500");
    }
}
