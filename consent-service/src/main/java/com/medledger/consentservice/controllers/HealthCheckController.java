package com.medledger.consentservice.controllers;

import com.medledger.consentservice.collaborators.BlobStore;
import com.medledger.consentservice.repository.AuditEntryRepository;
import com.medledger.consentservice.services.AccessCache;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Statement;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/consent/health")
public class HealthCheckController {

    @Autowired
    private DataSource dataSource;

    @Autowired
    private BlobStore blobStore;

    @Autowired
    private AccessCache accessCache;

    @Autowired
    private AuditEntryRepository auditEntries;

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        Map<String, Object> database = getDatabaseStatus();
        Map<String, Object> storage = getBlobStoreStatus();
        boolean up = "UP".equals(database.get("status")) && "UP".equals(storage.get("status"));

        health.put("status", up ? "UP" : "DEGRADED");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "consent-service");
        health.put("database", database);
        health.put("blobStore", storage);
        health.put("auditChain", getAuditChainStatus());
        health.put("caches", accessCache.stats());
        health.put("memory", getMemoryInfo());
        health.put("uptime", getUptime());

        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    private Map<String, Object> getDatabaseStatus() {
        Map<String, Object> dbStatus = new LinkedHashMap<>();
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.executeQuery("SELECT 1");
            DatabaseMetaData metaData = connection.getMetaData();
            dbStatus.put("status", "UP");
            dbStatus.put("product", metaData.getDatabaseProductName());
            dbStatus.put("version", metaData.getDatabaseProductVersion());
        } catch (Exception e) {
            dbStatus.put("status", "DOWN");
            dbStatus.put("error", e.getMessage());
        }
        return dbStatus;
    }

    private Map<String, Object> getBlobStoreStatus() {
        Map<String, Object> storeStatus = new LinkedHashMap<>();
        try {
            // Any well-formed lookup proves the store answers.
            blobStore.exists("0".repeat(64));
            storeStatus.put("status", "UP");
            storeStatus.put("implementation", blobStore.getClass().getSimpleName());
        } catch (Exception e) {
            storeStatus.put("status", "DOWN");
            storeStatus.put("error", e.getMessage());
        }
        return storeStatus;
    }

    private Map<String, Object> getAuditChainStatus() {
        Map<String, Object> chain = new LinkedHashMap<>();
        try {
            auditEntries.findTopByOrderByBlockNumberDesc().ifPresentOrElse(head -> {
                chain.put("headBlock", head.getBlockNumber());
                chain.put("headHash", head.getEntryHash());
            }, () -> chain.put("headBlock", 0));
        } catch (Exception e) {
            chain.put("error", e.getMessage());
        }
        return chain;
    }

    private Map<String, Object> getMemoryInfo() {
        Map<String, Object> memoryInfo = new LinkedHashMap<>();
        MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
        long heapUsed = memoryBean.getHeapMemoryUsage().getUsed();
        long heapMax = memoryBean.getHeapMemoryUsage().getMax();

        memoryInfo.put("heapUsed", formatBytes(heapUsed));
        memoryInfo.put("heapMax", heapMax > 0 ? formatBytes(heapMax) : "undefined");
        memoryInfo.put("availableProcessors", Runtime.getRuntime().availableProcessors());
        return memoryInfo;
    }

    private Map<String, Object> getUptime() {
        Map<String, Object> uptimeInfo = new LinkedHashMap<>();
        long uptimeMillis = ManagementFactory.getRuntimeMXBean().getUptime();

        long seconds = uptimeMillis / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;

        uptimeInfo.put("milliseconds", uptimeMillis);
        uptimeInfo.put("formatted", String.format("%d hours, %d minutes, %d seconds",
                hours, minutes % 60, seconds % 60));
        return uptimeInfo;
    }

    private String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        int exp = (int) (Math.log(bytes) / Math.log(1024));
        String pre = "KMGTPE".charAt(exp - 1) + "";
        return String.format("%.2f %sB", bytes / Math.pow(1024, exp), pre);
    }

    @GetMapping("/live")
    public ResponseEntity<Map<String, String>> liveness() {
        return ResponseEntity.ok(Map.of("status", "UP", "check", "liveness"));
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readiness() {
        Map<String, Object> response = new LinkedHashMap<>();
        Map<String, Object> database = getDatabaseStatus();
        boolean ready = "UP".equals(database.get("status"));

        response.put("database", database.get("status"));
        response.put("status", ready ? "READY" : "NOT_READY");
        response.put("check", "readiness");
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
