package org.scriptonbasestar.loader.source.file;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.loader.connector.ConnectorGroups;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.core.exception.RecordSourceException;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.RateProfile;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.core.model.Threshold;
import org.scriptonbasestar.loader.core.model.ThresholdProfile;
import org.scriptonbasestar.loader.core.source.RecordSource;
import org.scriptonbasestar.loader.core.store.DataManager;
import org.scriptonbasestar.loader.core.store.InternalDataDriver;
import org.scriptonbasestar.loader.engine.Loader;
import org.scriptonbasestar.loader.engine.report.BatchReport;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * 디렉토리 기반 소스로 로더를 구동하는 테스트
 *
 * @author archmagece
 * @since 2025-03
 */
public class JsonDirectoryRecordSourceProviderTest {

	private Path fixtures;
	private JsonDirectoryRecordSourceProvider provider;

	@Before
	public void setUp() throws Exception {
		fixtures = Paths.get(getClass().getResource("/fixtures").toURI());
		provider = new JsonDirectoryRecordSourceProvider(fixtures);
	}

	@Test
	public void fileNamePerProfileType() {
		assertEquals(fixtures.resolve("RateProfiles.json").toFile(), provider.fileFor(ProfileType.RATE_PROFILES));
		assertEquals(fixtures.resolve("Thresholds.json").toFile(), provider.fileFor(ProfileType.THRESHOLDS));
	}

	@Test
	public void missingTypeFileIsEmpty() {
		try (RecordSource source = provider.open(ProfileType.FILTERS)) {
			assertNull(source.next());
		}
	}

	@Test
	public void loaderReadsFromDirectory() {
		// Given
		DataManager store = new DataManager(new InternalDataDriver());
		Loader loader = Loader.builder()
			.dataStore(store)
			.connectorPool(new ConnectorPool())
			.cacheConns(Collections.singletonList(ConnectorGroups.INTERNAL_CACHES))
			.timezone("UTC")
			.recordSourceProvider(provider)
			.build();

		// When
		BatchReport rates = loader.processContent(ProfileType.RATE_PROFILES, "*none");
		BatchReport thresholds = loader.processContent("*thresholds", "*none");

		// Then
		assertEquals(2, rates.getRecords());
		RateProfile rp1 = (RateProfile) store.getProfile(ProfileType.RATE_PROFILES, TenantID.of("cgrates.org", "RP1"));
		assertEquals(20.0, rp1.getWeight(), 0.0);
		assertEquals(Arrays.asList("*string:~*req.Subject:1001", "*string:~*req.Account:1001"), rp1.getFilterIds());
		assertEquals(Instant.parse("2014-07-29T15:00:00Z"), rp1.getActivationInterval().getActivationTime());
		assertEquals(0, new BigDecimal("0.6").compareTo(rp1.getMaxCost()));
		RateProfile rp2 = (RateProfile) store.getProfile(ProfileType.RATE_PROFILES, TenantID.of("cgrates.org", "RP2"));
		assertEquals(Arrays.asList("FLTR_RP_1", "FLTR_RP_2"), rp2.getFilterIds());

		assertEquals(1, thresholds.getRecords());
		TenantID th1 = TenantID.of("cgrates.org", "TH1");
		ThresholdProfile profile = (ThresholdProfile) store.getProfile(ProfileType.THRESHOLDS, th1);
		assertEquals(12, profile.getMaxHits());
		assertEquals(Duration.ofSeconds(1), profile.getMinSleep());
		assertTrue(profile.isBlocker());
		assertTrue(store.getItem(ProfileType.THRESHOLDS, th1) instanceof Threshold);
	}

	@Test
	public void brokenRecordAbortsBatch() {
		DataManager store = new DataManager(new InternalDataDriver());
		Loader loader = Loader.builder()
			.dataStore(store)
			.connectorPool(new ConnectorPool())
			.recordSourceProvider(provider)
			.build();

		try {
			loader.processContent(ProfileType.CHARGERS, "*none");
			fail("CH2 has a nested object");
		} catch (RecordSourceException e) {
			assertTrue(e.getMessage().contains("RunID"));
		}
		assertNotNull(store.getProfile(ProfileType.CHARGERS, TenantID.of("cgrates.org", "CH1")));
		assertNull(store.getProfile(ProfileType.CHARGERS, TenantID.of("cgrates.org", "CH2")));
	}
}
