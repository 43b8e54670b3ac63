package com.gymledger.backend.modules.staff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gymledger.backend.modules.staff.presentation.dto.LoginRequest;
import com.gymledger.backend.support.AbstractPostgresIntegrationTest;
import com.gymledger.backend.support.TestTenantFactory;
import com.gymledger.backend.support.TestTenantFactory.Tenant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestTenantFactory tenantFactory;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = tenantFactory.createTenant("Nyx Gym");
    }

    @Test
    void loginIssuesBearerToken() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(tenant.ownerEmail(), TestTenantFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.expiresIn").value(900))
                .andExpect(jsonPath("$.staff.role").value("OWNER"))
                .andExpect(jsonPath("$.staff.gymId").value(tenant.gymId().toString()));
    }

    @Test
    void wrongPasswordIsAProblemResponse() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(tenant.ownerEmail(), "not-the-password")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.status").value(401));
    }

    @Test
    void requestsWithoutTokenAreRejected() throws Exception {
        mockMvc.perform(get("/members"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, startsWith("Bearer")))
                .andExpect(jsonPath("$.code").value("unauthorized"))
                .andExpect(jsonPath("$.detail").value("A valid staff access token is required"))
                .andExpect(jsonPath("$.instance").value("/members"));
    }

    @Test
    void tamperedTokenIsRejected() throws Exception {
        mockMvc.perform(get("/members").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void deskStaffCannotManagePlansOrStaff() throws Exception {
        String token = login(tenant.staffEmail());

        mockMvc.perform(post("/plans")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Monthly\",\"durationDays\":30,\"price\":250000}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("OWNER_ROLE_REQUIRED"));

        mockMvc.perform(get("/staff").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/memberships/status-sweep").param("asOf", "2026-02-01")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isForbidden());
    }

    @Test
    void deskStaffRegistersMemberAndSeesDuplicateAsConflict() throws Exception {
        String token = login(tenant.staffEmail());
        String body = "{\"fullName\":\"Budi Santoso\",\"phone\":\"+6281234567890\",\"gender\":\"M\"}";

        MvcResult created = mockMvc.perform(post("/members")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.memberCode").exists())
                .andReturn();
        String memberId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();

        mockMvc.perform(post("/members")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_PHONE"))
                .andExpect(jsonPath("$.context.conflictingMemberId").value(memberId));

        mockMvc.perform(get("/members").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)));
    }

    @Test
    void invalidBodyIsUnprocessable() throws Exception {
        String token = login(tenant.staffEmail());

        mockMvc.perform(post("/members")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"\",\"phone\":\"+6281234567890\",\"gender\":\"M\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void ownerManagesStaffAndInactiveStaffCannotLogIn() throws Exception {
        String ownerToken = login(tenant.ownerEmail());

        mockMvc.perform(patch("/staff/{id}/status", tenant.staffId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"INACTIVE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("INACTIVE"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(tenant.staffEmail(), TestTenantFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("STAFF_INACTIVE"));

        mockMvc.perform(delete("/staff/{id}", tenant.ownerId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STAFF_SELF_MODIFICATION"));
    }

    @Test
    void tokenOfDeactivatedStaffStopsWorkingImmediately() throws Exception {
        String ownerToken = login(tenant.ownerEmail());
        String staffToken = login(tenant.staffEmail());
        String checkIn = "{\"memberId\":\"" + UUID.randomUUID() + "\",\"admittedBy\":\"Front desk\"}";

        mockMvc.perform(patch("/staff/{id}/status", tenant.staffId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"INACTIVE\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/check-ins")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + staffToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(checkIn))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("STAFF_INACTIVE"));
        mockMvc.perform(get("/members").header(HttpHeaders.AUTHORIZATION, "Bearer " + staffToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("STAFF_INACTIVE"));

        mockMvc.perform(patch("/staff/{id}/status", tenant.staffId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"ACTIVE\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/members").header(HttpHeaders.AUTHORIZATION, "Bearer " + staffToken))
                .andExpect(status().isOk());
    }

    @Test
    void tokenOfOffboardedStaffIsUnauthorized() throws Exception {
        String ownerToken = login(tenant.ownerEmail());
        String staffToken = login(tenant.staffEmail());

        mockMvc.perform(delete("/staff/{id}", tenant.staffId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken))
                .andExpect(status().is2xxSuccessful());

        mockMvc.perform(get("/members").header(HttpHeaders.AUTHORIZATION, "Bearer " + staffToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("STAFF_OFFBOARDED"));
    }

    @Test
    void gymOnboardingIsOpenAndReturnsOwner() throws Exception {
        String email = "founder-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
        String body = """
                {"name":"Iron Temple","address":"Jl. Sudirman 1","phone":"+62215550000",
                 "owner":{"fullName":"Iron Owner","email":"%s","password":"password123"}}
                """.formatted(email);

        MvcResult result = mockMvc.perform(post("/gyms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.owner.role").value("OWNER"))
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(json.get("gym").get("id").asText()).isEqualTo(json.get("owner").get("gymId").asText());

        String token = login(email);
        mockMvc.perform(get("/gyms/current").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Iron Temple"));
    }

    private String login(String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email, TestTenantFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("accessToken").asText();
    }

    private String loginBody(String email, String password) throws Exception {
        return objectMapper.writeValueAsString(new LoginRequest(email, password));
    }
}
