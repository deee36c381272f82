package org.scriptonbasestar.loader.spring.actuator;

import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.engine.metrics.LoaderMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot Actuator HealthIndicator for the config loader.
 * <p>
 * DOWN when the batch failure rate exceeds the configured maximum. Batches that left the
 * store ahead of the cache tier are reported as a warning.
 * </p>
 *
 * <h3>Response Format:</h3>
 * <pre>{@code
 * {
 *   "status": "UP",
 *   "details": {
 *     "loaderId": "*default",
 *     "batchCount": 12,
 *     "failureRate": "8.33%",
 *     "cacheOutOfSyncCount": 1,
 *     "registeredGroups": ["*internal:*caches"],
 *     "warnings": ["1 batch(es) stored without cache notification"]
 *   }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
public class LoaderHealthIndicator implements HealthIndicator {

	private final String loaderId;
	private final LoaderMetrics metrics;
	private final ConnectorPool connectorPool;
	private final double maxFailureRate;

	public LoaderHealthIndicator(String loaderId, LoaderMetrics metrics, ConnectorPool connectorPool,
								 double maxFailureRate) {
		if (loaderId == null || loaderId.trim().isEmpty()) {
			throw new IllegalArgumentException("loaderId must not be null or empty");
		}
		if (metrics == null) {
			throw new IllegalArgumentException("metrics must not be null");
		}
		if (connectorPool == null) {
			throw new IllegalArgumentException("connectorPool must not be null");
		}
		if (maxFailureRate < 0 || maxFailureRate > 1) {
			throw new IllegalArgumentException("maxFailureRate must be between 0 and 1: " + maxFailureRate);
		}
		this.loaderId = loaderId;
		this.metrics = metrics;
		this.connectorPool = connectorPool;
		this.maxFailureRate = maxFailureRate;
	}

	@Override
	public Health health() {
		List<String> warnings = new ArrayList<>();
		List<String> errors = new ArrayList<>();

		if (metrics.batchCount() > 0 && metrics.failureRate() > maxFailureRate) {
			errors.add(String.format("Batch failure rate %.2f%% exceeds %.2f%%",
				metrics.failureRate() * 100, maxFailureRate * 100));
		}
		if (metrics.cacheOutOfSyncCount() > 0) {
			warnings.add(metrics.cacheOutOfSyncCount() + " batch(es) stored without cache notification");
		}
		if (connectorPool.registeredGroups().isEmpty()) {
			warnings.add("No connector group registered");
		}

		Health.Builder builder = errors.isEmpty() ? Health.up() : Health.down();

		builder.withDetail("loaderId", loaderId);
		builder.withDetail("batchCount", metrics.batchCount());
		builder.withDetail("batchSuccessCount", metrics.batchSuccessCount());
		builder.withDetail("batchFailureCount", metrics.batchFailureCount());
		builder.withDetail("failureRate", String.format("%.2f%%", metrics.failureRate() * 100));
		builder.withDetail("recordCount", metrics.recordCount());
		builder.withDetail("unsupportedMethodCount", metrics.unsupportedMethodCount());
		builder.withDetail("cacheOutOfSyncCount", metrics.cacheOutOfSyncCount());
		builder.withDetail("averageBatchTime", String.format("%.2fms", metrics.averageBatchTime() / 1_000_000.0));
		builder.withDetail("registeredGroups", connectorPool.registeredGroups());
		builder.withDetail("liveGroups", connectorPool.liveGroups());

		if (!warnings.isEmpty()) {
			builder.withDetail("warnings", warnings);
		}
		if (!errors.isEmpty()) {
			builder.withDetail("errors", errors);
		}
		return builder.build();
	}

	public String getLoaderId() {
		return loaderId;
	}

	public boolean isHealthy() {
		return metrics.batchCount() == 0 || metrics.failureRate() <= maxFailureRate;
	}
}
