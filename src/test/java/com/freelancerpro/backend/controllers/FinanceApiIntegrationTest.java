package com.freelancerpro.backend.controllers;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.freelancerpro.backend.entities.User;
import com.freelancerpro.backend.services.UserService;
import com.freelancerpro.backend.security.JwtService;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class FinanceApiIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    UserService userService;

    @Autowired
    JwtService jwtService;

    private String aliceToken;
    private String bobToken;

    @BeforeEach
    void setUp() {
        aliceToken = tokenFor(userService.createUser("Alice", "alice-" + UUID.randomUUID() + "@example.com", null));
        bobToken = tokenFor(userService.createUser("Bob", "bob-" + UUID.randomUUID() + "@example.com", null));
    }

    private String tokenFor(User user) {
        return "Bearer " + jwtService.generateToken(user.getId(), user.getEmail());
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private String createProject(String token, String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/projects")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "name", name,
                                "clientName", "Local Bakery",
                                "expectedPayment", 2500))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("active"))
                .andReturn();
        return dataId(result);
    }

    private String createIncome(String token, String projectId, String date) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/income")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "projectId", projectId,
                                "amount", 800,
                                "description", "Milestone payment",
                                "date", date))))
                .andExpect(status().isCreated())
                .andReturn();
        return dataId(result);
    }

    private String dataId(MvcResult result) throws Exception {
        JsonNode root = objectMapper.readTree(result.getResponse().getContentAsString());
        return root.path("data").path("id").asText();
    }

    @Test
    void requestWithoutToken_isUnauthorized() throws Exception {
        mockMvc.perform(get("/api/projects"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void requestWithTamperedToken_isUnauthorized() throws Exception {
        mockMvc.perform(get("/api/projects").header(HttpHeaders.AUTHORIZATION, aliceToken + "x"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid token"));
    }

    @Test
    void projects_areInvisibleToOtherUsers() throws Exception {
        String projectId = createProject(aliceToken, "Website redesign");

        mockMvc.perform(get("/api/projects/{id}", projectId).header(HttpHeaders.AUTHORIZATION, bobToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mockMvc.perform(get("/api/projects").header(HttpHeaders.AUTHORIZATION, bobToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pagination.total").value(0));
    }

    @Test
    void income_againstAnotherUsersProject_isNotFound() throws Exception {
        String projectId = createProject(aliceToken, "Logo design");

        mockMvc.perform(post("/api/income")
                        .header(HttpHeaders.AUTHORIZATION, bobToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "projectId", projectId,
                                "amount", 100,
                                "description", "Sneaky entry"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Project not found"));
    }

    @Test
    void income_listFilteredByEndDate_includesEntriesLaterThatDay() throws Exception {
        String projectId = createProject(aliceToken, "Mobile app");
        createIncome(aliceToken, projectId, "2024-01-31T18:45:00");
        createIncome(aliceToken, projectId, "2024-02-01T00:00:00");

        mockMvc.perform(get("/api/income")
                        .header(HttpHeaders.AUTHORIZATION, aliceToken)
                        .param("startDate", "2024-01-01")
                        .param("endDate", "2024-01-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pagination.total").value(1))
                .andExpect(jsonPath("$.data.records[0].project.name").value("Mobile app"));
    }

    @Test
    void deletedIncome_disappearsFromReadsAndStats() throws Exception {
        String projectId = createProject(aliceToken, "Consulting");
        String incomeId = createIncome(aliceToken, projectId, "2024-03-05T10:00:00");

        mockMvc.perform(get("/api/income/stats").header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.count").value(1));

        mockMvc.perform(delete("/api/income/{id}", incomeId).header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/api/income/{id}", incomeId).header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/income/stats").header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.count").value(0));
    }

    @Test
    void income_byProject_reportsProjectName() throws Exception {
        String projectId = createProject(aliceToken, "Branding");
        createIncome(aliceToken, projectId, "2024-04-01T09:00:00");

        mockMvc.perform(get("/api/income/by-project").header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].projectName", hasItem("Branding")));
    }

    @Test
    void savingsProgress_overdraft_isRejectedWithDedicatedCode() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/savings")
                        .header(HttpHeaders.AUTHORIZATION, aliceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "title", "New laptop",
                                "targetAmount", 2000,
                                "currentAmount", 100,
                                "deadline", LocalDateTime.now().plusMonths(3).withNano(0).toString()))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.isCompleted").value(false))
                .andReturn();
        String goalId = dataId(created);

        mockMvc.perform(patch("/api/savings/{id}/progress", goalId)
                        .header(HttpHeaders.AUTHORIZATION, aliceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("action", "subtract", "amount", 150))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PROGRESS"));

        mockMvc.perform(patch("/api/savings/{id}/progress", goalId)
                        .header(HttpHeaders.AUTHORIZATION, aliceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("action", "add", "amount", 1900))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isCompleted").value(true));
    }

    @Test
    void savings_withPastDeadline_isRejected() throws Exception {
        mockMvc.perform(post("/api/savings")
                        .header(HttpHeaders.AUTHORIZATION, aliceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "title", "Vacation",
                                "targetAmount", 1500,
                                "deadline", "2020-01-01T00:00:00"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Deadline must be in the future"));
    }

    @Test
    void unknownJsonField_isRejected() throws Exception {
        mockMvc.perform(post("/api/projects")
                        .header(HttpHeaders.AUTHORIZATION, aliceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "name", "Site",
                                "clientName", "Acme",
                                "expectedPayment", 100,
                                "userId", UUID.randomUUID().toString()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown field: userId"));
    }

    @Test
    void invalidPayload_reportsValidationErrors() throws Exception {
        mockMvc.perform(post("/api/projects")
                        .header(HttpHeaders.AUTHORIZATION, aliceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "S", "clientName", "Acme", "expectedPayment", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.errors").isArray());
    }

    @Test
    void pageLimitAboveMaximum_isRejected() throws Exception {
        mockMvc.perform(get("/api/projects").param("limit", "101").header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pageFarBeyondLastPage_returnsEmptyPage() throws Exception {
        String projectId = createProject(aliceToken, "Archive");
        createIncome(aliceToken, projectId, "2024-06-01T08:00:00");

        mockMvc.perform(get("/api/income")
                        .param("page", "21474838")
                        .param("limit", "100")
                        .header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.records").isEmpty())
                .andExpect(jsonPath("$.data.pagination.total").value(1))
                .andExpect(jsonPath("$.data.pagination.hasNext").value(false));
    }

    @Test
    void invalidProjectStatus_isRejected() throws Exception {
        mockMvc.perform(get("/api/projects/status/{status}", "archived").header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid status. Must be one of: active, completed, on-hold"));
    }

    @Test
    void profile_reportsTotalsFromLiveRecords() throws Exception {
        String projectId = createProject(aliceToken, "Retainer");
        createIncome(aliceToken, projectId, "2024-05-01T12:00:00");

        mockMvc.perform(get("/api/users/me").header(HttpHeaders.AUTHORIZATION, aliceToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Alice"))
                .andExpect(jsonPath("$.data.totalIncome").value(800.0))
                .andExpect(jsonPath("$.data.netWorth").value(800.0));
    }
}
