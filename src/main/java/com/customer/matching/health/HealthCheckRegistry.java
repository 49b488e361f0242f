package com.customer.matching.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the registered health checks and folds them into one status.
 *
 * <p>The aggregate takes the worst individual status; its message names the
 * check responsible. Each check's own result is attached as a detail under the
 * check's name. A check that throws counts as DOWN.</p>
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status worst = HealthStatus.Status.UP;
        String message = "OK";
        Map<String, Object> perCheck = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("status", result.status().name());
            summary.put("message", result.message());
            summary.put("details", result.details());
            perCheck.put(check.getName(), summary);

            HealthStatus.Status folded = worst.worseOf(result.status());
            if (folded != worst) {
                worst = folded;
                message = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, message, perCheck);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("Health check '{}' failed: {}", check.getName(), e.getMessage());
            return HealthStatus.down("Check failed: " + e.getMessage());
        }
    }
}
