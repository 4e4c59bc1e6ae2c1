package com.medledger.consentservice.controllers;

import com.medledger.consentservice.collaborators.BlobStore;
import com.medledger.consentservice.repository.AuditEntryRepository;
import com.medledger.consentservice.services.AccessCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HealthCheckControllerTest {

    private DataSource dataSource;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        dataSource = mock(DataSource.class);
        AccessCache accessCache = mock(AccessCache.class);
        AuditEntryRepository auditEntries = mock(AuditEntryRepository.class);
        when(accessCache.stats()).thenReturn(Map.of());
        when(auditEntries.findTopByOrderByBlockNumberDesc()).thenReturn(Optional.empty());

        HealthCheckController controller = new HealthCheckController();
        ReflectionTestUtils.setField(controller, "dataSource", dataSource);
        ReflectionTestUtils.setField(controller, "blobStore", mock(BlobStore.class));
        ReflectionTestUtils.setField(controller, "accessCache", accessCache);
        ReflectionTestUtils.setField(controller, "auditEntries", auditEntries);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void unreachableDatabaseDegradesHealth() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        mockMvc.perform(get("/api/v1/consent/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.database.status").value("DOWN"))
                .andExpect(jsonPath("$.blobStore.status").value("UP"))
                .andExpect(jsonPath("$.auditChain.headBlock").value(0));
    }

    @Test
    void livenessIgnoresDependencies() throws Exception {
        mockMvc.perform(get("/api/v1/consent/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void readinessFollowsTheDatabase() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        mockMvc.perform(get("/api/v1/consent/health/ready"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("NOT_READY"));
    }
}
