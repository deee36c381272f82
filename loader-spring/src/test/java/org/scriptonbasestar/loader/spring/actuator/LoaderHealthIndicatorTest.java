package org.scriptonbasestar.loader.spring.actuator;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.loader.connector.ConnectorGroups;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.engine.metrics.LoaderMetrics;
import org.scriptonbasestar.loader.engine.processor.BatchState;
import org.scriptonbasestar.loader.engine.report.BatchOperation;
import org.scriptonbasestar.loader.engine.report.BatchReport;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.Collection;

import static org.junit.Assert.*;

/**
 * LoaderHealthIndicator 테스트
 *
 * @author archmagece
 * @since 2025-03
 */
public class LoaderHealthIndicatorTest {

	private LoaderMetrics metrics;
	private ConnectorPool pool;
	private LoaderHealthIndicator indicator;

	@Before
	public void setUp() {
		metrics = new LoaderMetrics();
		pool = new ConnectorPool().registerInternal(ConnectorGroups.INTERNAL_CACHES, (method, args) -> "OK");
		indicator = new LoaderHealthIndicator("test-loader", metrics, pool, 0.5);
	}

	private static BatchReport.Builder report() {
		return BatchReport.builder()
			.loaderId("test-loader")
			.operation(BatchOperation.CONTENT)
			.profileType(ProfileType.RESOURCES)
			.cacheAction("*reload")
			.records(1)
			.duration(Duration.ofMillis(4));
	}

	private static BatchReport failed() {
		return report()
			.failure(BatchState.CACHE_NOTIFIED, TenantID.of("cgrates.org", "RES1"),
				new UnsupportedServiceMethodException("CacheSv1.ReloadCache"))
			.build();
	}

	@Test
	public void testNoBatchesIsUp() {
		Health health = indicator.health();

		assertEquals(Status.UP, health.getStatus());
		assertEquals("test-loader", health.getDetails().get("loaderId"));
		assertEquals(0L, health.getDetails().get("batchCount"));
		assertTrue(indicator.isHealthy());
	}

	@Test
	public void testOutOfSyncIsWarning() {
		// Given - 실패율 25%
		for (int i = 0; i < 3; i++) {
			metrics.onBatchCompleted(report().build());
		}
		metrics.onBatchCompleted(failed());

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
		assertEquals("25.00%", health.getDetails().get("failureRate"));
		assertEquals(1L, health.getDetails().get("cacheOutOfSyncCount"));
		assertNotNull(health.getDetails().get("warnings"));
		assertTrue(((Collection<?>) health.getDetails().get("registeredGroups")).contains(ConnectorGroups.INTERNAL_CACHES));
	}

	@Test
	public void testHighFailureRateIsDown() {
		// Given - 실패율 75%
		metrics.onBatchCompleted(report().build());
		for (int i = 0; i < 3; i++) {
			metrics.onBatchCompleted(failed());
		}

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.DOWN, health.getStatus());
		assertNotNull(health.getDetails().get("errors"));
		assertFalse(indicator.isHealthy());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidThreshold() {
		new LoaderHealthIndicator("test-loader", metrics, pool, 1.5);
	}
}
