package com.flagship.budget_ledger.budget;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.account.CurrencyCode;
import com.flagship.budget_ledger.account.Party;
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

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Budget endpoints over HTTP: status codes, error bodies and the snake_case
 * wire format.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class BudgetControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_budget_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("rollover.retry.enabled", () -> "false");
    }

    private static final String USER_HEADER = "X-User-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountService accountService;

    private UUID user;
    private UUID groceries;

    @BeforeEach
    void setUp() {
        user = accountService.createParty(Party.PartyType.USER, "Controller test").getId();
        groceries = accountService.createAccount(user, "Groceries", AccountType.EXPENSE, null, CurrencyCode.USD)
            .getId();
    }

    @Test
    @DisplayName("Creating a budget returns 201 with the stored categories")
    void createBudget() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/budgets")
                .header(USER_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(budgetJson("2024-05", groceries, "250.00")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.year_month").value("2024-05"))
            .andExpect(jsonPath("$.rollover_needs_recalc").value(false))
            .andExpect(jsonPath("$.categories[0].category_id").value(groceries.toString()))
            .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertEquals(0, body.get("categories").get(0).get("budget_amount").decimalValue()
            .compareTo(new BigDecimal("250.00")));
    }

    @Test
    @DisplayName("A second budget for the same month is a conflict")
    void duplicateMonthIsConflict() throws Exception {
        mockMvc.perform(post("/api/budgets")
                .header(USER_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(budgetJson("2024-06", groceries, "100")))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/budgets")
                .header(USER_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(budgetJson("2024-06", groceries, "100")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    @DisplayName("A malformed month is rejected with 422")
    void malformedMonth() throws Exception {
        mockMvc.perform(post("/api/budgets")
                .header(USER_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(budgetJson("2024-13", groceries, "100")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.details.year_month").exists());
    }

    @Test
    @DisplayName("A negative limit is rejected with 422 and names the offending category")
    void negativeLimit() throws Exception {
        mockMvc.perform(post("/api/budgets")
                .header(USER_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(budgetJson("2024-07", groceries, "-5")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.details['categories[0].budget_amount']").exists());
    }

    @Test
    @DisplayName("Requests without the user header are rejected with 400")
    void missingUserHeader() throws Exception {
        mockMvc.perform(get("/api/budgets"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Asking for a month without a budget returns 404")
    void missingBudget() throws Exception {
        mockMvc.perform(get("/api/budgets")
                .header(USER_HEADER, user)
                .param("year_month", "1999-01"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Updating a category of another user's budget returns 404")
    void otherUsersBudgetIsHidden() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/budgets")
                .header(USER_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(budgetJson("2024-08", groceries, "100")))
            .andExpect(status().isCreated())
            .andReturn();
        String budgetId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();
        UUID stranger = accountService.createParty(Party.PartyType.USER, "Stranger").getId();

        mockMvc.perform(put("/api/budgets/{id}/categories/{categoryId}", budgetId, groceries)
                .header(USER_HEADER, stranger)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"budget_amount\": 10}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Status of a month without a budget is NO_BUDGETS")
    void statusWithoutBudget() throws Exception {
        mockMvc.perform(get("/api/budgets/status")
                .header(USER_HEADER, user)
                .param("year_month", "2030-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.overall_status").value("NO_BUDGETS"));
    }

    private static String budgetJson(String yearMonth, UUID categoryId, String amount) {
        return String.format(
            "{\"year_month\": \"%s\", \"categories\": [{\"category_id\": \"%s\", \"budget_amount\": %s}]}",
            yearMonth, categoryId, amount);
    }
}
