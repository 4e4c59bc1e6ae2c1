package com.medledger.consentservice.controllers;

import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.exceptions.GlobalExceptionHandler;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.UserRole;
import com.medledger.consentservice.services.AuditHashing;
import com.medledger.consentservice.services.AuditTrailService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuditControllerTest {

    private static final String LOGIN_EVENT = "{\"eventType\":\"login_attempt\",\"userId\":\"patient-7\","
            + "\"role\":\"patient\",\"outcome\":\"success\"}";

    private AuditTrailService auditTrailService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        auditTrailService = mock(AuditTrailService.class);
        AuditController controller = new AuditController(auditTrailService, mock(AuditHashing.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("POST /api/v1/audit/events")
    class LogEvent {

        @Test
        void subjectReportsItsOwnLogin() throws Exception {
            AuditEntry entry = AuditEntry.builder()
                    .entryId("entry-1")
                    .blockNumber(3L)
                    .eventType(AuditEventType.LOGIN_ATTEMPT)
                    .userId("patient-7")
                    .timestamp(Instant.parse("2026-06-01T08:00:00Z"))
                    .signerKeyRef("patient-7")
                    .build();
            when(auditTrailService.recordAccountEvent(eq("patient-7"), eq(UserRole.PATIENT),
                    eq(AuditEventType.LOGIN_ATTEMPT), eq("patient-7"), isNull(), any())).thenReturn(entry);

            mockMvc.perform(post("/api/v1/audit/events")
                            .header("X-User-Id", "patient-7")
                            .header("X-User-Role", "PATIENT")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(LOGIN_EVENT))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.blockNumber").value(3))
                    .andExpect(jsonPath("$.signerKeyRef").value("patient-7"));
        }

        @Test
        void anonymousCallerIsRejected() throws Exception {
            mockMvc.perform(post("/api/v1/audit/events")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(LOGIN_EVENT))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(auditTrailService);
        }

        @Test
        void reportingForAnotherUserIsForbidden() throws Exception {
            when(auditTrailService.recordAccountEvent(eq("doctor-2"), eq(UserRole.DOCTOR), any(), eq("patient-7"),
                    any(), any())).thenThrow(new ForbiddenException("Account events can only be reported by the user"));

            mockMvc.perform(post("/api/v1/audit/events")
                            .header("X-User-Id", "doctor-2")
                            .header("X-User-Role", "DOCTOR")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(LOGIN_EVENT))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("FORBIDDEN"));
        }
    }

    @Test
    void integrityVerificationNeedsAuditorOrAdministrator() throws Exception {
        mockMvc.perform(get("/api/v1/audit/verify").header("X-User-Role", "DOCTOR"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(auditTrailService);
    }
}
