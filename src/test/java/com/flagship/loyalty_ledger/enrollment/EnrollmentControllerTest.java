package com.flagship.loyalty_ledger.enrollment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.loyalty_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of the enrollment workflow, scans, polling and health.
 */
class EnrollmentControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode invite(String customerId, String programId, String businessId) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/enrollments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format("{\"customer_id\":\"%s\",\"program_id\":\"%s\",\"business_id\":\"%s\"}",
                    customerId, programId, businessId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING_APPROVAL"))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Invite, accept, duplicate accept, revoke")
    void testEnrollmentLifecycle() throws Exception {
        printTestHeader("Enrollment lifecycle over HTTP");
        String customerId = uniqueId("cust");
        String programId = uniqueId("prog");
        String businessId = uniqueId("biz");

        JsonNode invitation = invite(customerId, programId, businessId);
        String enrollmentId = invitation.get("enrollment_id").asText();
        printOutput("Invitation", invitation);

        mockMvc.perform(post("/api/enrollments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format("{\"customer_id\":\"%s\",\"program_id\":\"%s\",\"business_id\":\"%s\"}",
                    customerId, programId, businessId)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ALREADY_ENROLLED"));

        mockMvc.perform(post("/api/enrollments/{id}/respond", enrollmentId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accept\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.card_id").isString());

        mockMvc.perform(post("/api/approval-requests/{id}/respond", invitation.get("approval_request_id").asText())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accept\":true}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ALREADY_RESPONDED"));

        mockMvc.perform(get("/api/customers/{customerId}/cards", customerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].balance").value(0));

        mockMvc.perform(post("/api/enrollments/{id}/revoke", enrollmentId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"left the program\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("REVOKED"));

        mockMvc.perform(get("/api/enrollments/{id}", enrollmentId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("REVOKED"))
            .andExpect(jsonPath("$.end_reason").value("left the program"));
    }

    @Test
    @DisplayName("Unknown ids are 404, malformed bodies 400")
    void testErrors() throws Exception {
        mockMvc.perform(get("/api/enrollments/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("ENROLLMENT_NOT_FOUND"));

        mockMvc.perform(post("/api/approval-requests/{id}/respond", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accept\":false}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("APPROVAL_REQUEST_NOT_FOUND"));

        mockMvc.perform(post("/api/enrollments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customer_id\":\"c\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Scanning a customer code over HTTP invites, and a replayed code is 403")
    void testScanEndpoint() throws Exception {
        printTestHeader("POST /api/scans");
        String customerId = uniqueId("cust");
        String programId = uniqueId("prog");
        String businessId = uniqueId("biz");

        MvcResult qr = mockMvc.perform(get("/api/customers/{customerId}/qr-payload", customerId)
                .param("business_id", businessId))
            .andExpect(status().isOk())
            .andReturn();
        String payload = objectMapper.readTree(qr.getResponse().getContentAsString()).get("qr_payload").asText();

        String scan = String.format(
            "{\"qr_payload\":\"%s\",\"business_id\":\"%s\",\"program_id\":\"%s\",\"points\":10,\"scan_id\":\"%s\"}",
            payload, businessId, programId, UUID.randomUUID());
        mockMvc.perform(post("/api/scans").contentType(MediaType.APPLICATION_JSON).content(scan))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("ENROLLMENT_REQUESTED"))
            .andExpect(jsonPath("$.enrollment_id").isString());

        String replay = String.format(
            "{\"qr_payload\":\"%s\",\"business_id\":\"%s\",\"program_id\":\"%s\",\"points\":10,\"scan_id\":\"%s\"}",
            payload, businessId, programId, UUID.randomUUID());
        mockMvc.perform(post("/api/scans").contentType(MediaType.APPLICATION_JSON).content(replay))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("REPLAY_DETECTED"));

        mockMvc.perform(get("/api/notifications").param("target_id", customerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].type").value("ENROLLMENT_REQUESTED"));
    }

    @Test
    @DisplayName("Health reports the database as UP")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.database").value("UP"));
    }
}
