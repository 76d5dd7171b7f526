package com.facet.backend.modules.admin;

import static com.facet.backend.support.TestApiClient.ADMIN_HEADER;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;
import java.util.UUID;

import com.facet.backend.support.AbstractPostgresIntegrationTest;
import com.facet.backend.support.TestApiClient;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AdminIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private TestApiClient api;
    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        api = new TestApiClient(mockMvc, objectMapper);
        adminToken = api.adminToken();
    }

    @Test
    void weakAndDuplicatePinsAreRejected() throws Exception {
        api.createEmployee(adminToken, "Alice", "583902", "STAFF");

        mockMvc.perform(post("/api/v1/admin/employees")
                        .header(ADMIN_HEADER, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(api.json(Map.of("name", "Bob", "pin", "123456", "role", "STAFF"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/v1/admin/employees")
                        .header(ADMIN_HEADER, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(api.json(Map.of("name", "Bob", "pin", "583902", "role", "STAFF"))))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/v1/admin/employees").header(ADMIN_HEADER, adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].name").value("Alice"));
    }

    @Test
    void reactivatedEmployeeCanSignInAgain() throws Exception {
        UUID aliceId = api.createEmployee(adminToken, "Alice", "583902", "STAFF");

        mockMvc.perform(post("/api/v1/admin/employees/{id}/deactivate", aliceId).header(ADMIN_HEADER, adminToken))
                .andExpect(status().isOk());
        api.createEmployee(adminToken, "Bob", "583902", "STAFF");

        // the old PIN now belongs to Bob
        mockMvc.perform(post("/api/v1/admin/employees/{id}/reactivate", aliceId)
                        .header(ADMIN_HEADER, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(api.json(Map.of("pin", "583902"))))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/api/v1/admin/employees/{id}/reactivate", aliceId)
                        .header(ADMIN_HEADER, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(api.json(Map.of("pin", "640275"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true));

        mockMvc.perform(post("/api/v1/auth/employee/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(api.json(Map.of("pin", "640275"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.employeeId").value(aliceId.toString()));
        mockMvc.perform(post("/api/v1/auth/employee/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(api.json(Map.of("pin", "583902"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Bob"));
    }

    @Test
    void settingsUpdateLeavesOmittedFieldsAlone() throws Exception {
        mockMvc.perform(put("/api/v1/admin/settings")
                        .header(ADMIN_HEADER, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(api.json(Map.of("storePhone", "555-0142"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.storePhone").value("555-0142"))
                .andExpect(jsonPath("$.ticketPrefix").value("T"));
    }

    @Test
    void changingTheAdminPinEndsOtherAdminSessions() throws Exception {
        String otherTerminal = api.adminToken();
        String newPin = "736150";

        try {
            mockMvc.perform(post("/api/v1/admin/settings/pin")
                            .header(ADMIN_HEADER, adminToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(api.json(Map.of("currentPin", INITIAL_ADMIN_PIN, "newPin", newPin))))
                    .andExpect(status().isNoContent());

            mockMvc.perform(get("/api/v1/admin/settings").header(ADMIN_HEADER, adminToken))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.setupComplete").value(true));
            mockMvc.perform(get("/api/v1/admin/settings").header(ADMIN_HEADER, otherTerminal))
                    .andExpect(status().isUnauthorized());
        } finally {
            // later tests sign in with the initial PIN
            mockMvc.perform(post("/api/v1/admin/settings/pin")
                            .header(ADMIN_HEADER, adminToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(api.json(Map.of("currentPin", newPin, "newPin", INITIAL_ADMIN_PIN))))
                    .andExpect(status().isNoContent());
        }
    }
}
