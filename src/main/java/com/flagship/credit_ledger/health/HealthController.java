package com.flagship.credit_ledger.health;

import com.flagship.credit_ledger.asset.AssetRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight liveness/readiness probe, separate from the Actuator health endpoint.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final AssetRegistry assetRegistry;

    public HealthController(DataSource dataSource, AssetRegistry assetRegistry) {
        this.dataSource = dataSource;
        this.assetRegistry = assetRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("active_asset_types", assetRegistry.findAllActive().size());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
