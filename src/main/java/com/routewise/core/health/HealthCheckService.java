package com.routewise.core.health;

import com.routewise.core.catalog.CapabilityCatalog;
import com.routewise.core.model.ProviderCategory;
import com.routewise.core.recording.ExecutionRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CapabilityCatalog catalog;
    private final ExecutionRecordStore recordStore;
    private final DataSource dataSource;

    public HealthCheckService(
            CapabilityCatalog catalog,
            ExecutionRecordStore recordStore,
            @Autowired(required = false) DataSource dataSource) {
        this.catalog = catalog;
        this.recordStore = recordStore;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCatalog());
        results.add(checkCategories());
        results.add(checkRecordStore());
        return results;
    }

    /**
     * DOWN beats DEGRADED beats UP.
     */
    public static HealthStatus.Status overall(List<HealthStatus> checks) {
        if (checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DOWN)) {
            return HealthStatus.Status.DOWN;
        }
        if (checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DEGRADED)) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }

    private HealthStatus checkCatalog() {
        int size = catalog.providers().size();
        if (size == 0) {
            return new HealthStatus("catalog", HealthStatus.Status.DOWN,
                    "No capability providers configured", Map.of());
        }
        return new HealthStatus("catalog", HealthStatus.Status.UP,
                size + " providers registered", Map.of("providers", String.valueOf(size)));
    }

    private HealthStatus checkCategories() {
        List<ProviderCategory> missing = Arrays.stream(ProviderCategory.values())
                .filter(category -> catalog.byCategory(category).isEmpty())
                .toList();
        if (missing.isEmpty()) {
            return new HealthStatus("categories", HealthStatus.Status.UP,
                    "Every category has a provider", Map.of());
        }
        String names = missing.stream().map(Enum::name).collect(Collectors.joining(","));
        return new HealthStatus("categories", HealthStatus.Status.DEGRADED,
                "No provider for " + names, Map.of("missing", names));
    }

    private HealthStatus checkRecordStore() {
        String type = recordStore.getClass().getSimpleName();
        if (dataSource == null) {
            return new HealthStatus("records", HealthStatus.Status.UP,
                    "In-memory record store (" + recordStore.count() + " records)", Map.of("store", type));
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("records", HealthStatus.Status.UP,
                        "Database connection valid (" + recordStore.count() + " records)", Map.of("store", type));
            }
            return new HealthStatus("records", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of("store", type));
        } catch (Exception e) {
            log.warn("Record store health check failed: {}", e.getMessage());
            return new HealthStatus("records", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of("store", type));
        }
    }
}
