package org.scriptonbasestar.loader.core.store;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.loader.core.model.AttributeProfile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.core.model.Threshold;
import org.scriptonbasestar.loader.core.model.ThresholdProfile;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-03
 */
public class DataManagerTest {

	private static final TenantID TH1 = TenantID.of("cgrates.org", "TH1");

	private InternalDataDriver driver;
	private DataManager store;

	@Before
	public void setUp() {
		driver = new InternalDataDriver();
		store = new DataManager(driver);
	}

	private static ThresholdProfile threshold(String id, List<String> filters) {
		return new ThresholdProfile(TenantID.of("cgrates.org", id), filters, null,
			1, 0, Duration.ofSeconds(1), false, 10, Collections.emptyList(), false);
	}

	@Test
	public void setProfileIndexesEveryFilter() {
		store.setProfile(threshold("TH1", Arrays.asList("FLTR_1", "FLTR_2")));
		store.setProfile(threshold("TH2", Arrays.asList("FLTR_1")));

		Map<String, Set<String>> indexes = store.getIndexes(ProfileType.THRESHOLDS, "cgrates.org", null);
		assertEquals(new HashSet<>(Arrays.asList("TH1", "TH2")), indexes.get("FLTR_1"));
		assertEquals(Collections.singleton("TH1"), indexes.get("FLTR_2"));
	}

	@Test
	public void unfilteredProfileUsesNoneKey() {
		store.setProfile(threshold("TH1", Collections.emptyList()));

		Map<String, Set<String>> indexes = store.getIndexes(ProfileType.THRESHOLDS, "cgrates.org", DataManager.NONE_INDEX_KEY);
		assertEquals(Collections.singleton("TH1"), indexes.get(DataManager.NONE_INDEX_KEY));
	}

	@Test
	public void replacingProfileMovesIndexEntries() {
		store.setProfile(threshold("TH1", Arrays.asList("FLTR_1")));
		store.setProfile(threshold("TH1", Arrays.asList("FLTR_2")));

		Map<String, Set<String>> indexes = store.getIndexes(ProfileType.THRESHOLDS, "cgrates.org", null);
		assertFalse(indexes.containsKey("FLTR_1"));
		assertEquals(Collections.singleton("TH1"), indexes.get("FLTR_2"));
	}

	@Test
	public void removeProfileDropsIndexesAndIsIdempotent() {
		store.setProfile(threshold("TH1", Arrays.asList("FLTR_1")));

		store.removeProfile(ProfileType.THRESHOLDS, TH1);
		store.removeProfile(ProfileType.THRESHOLDS, TH1);

		assertNull(store.getProfile(ProfileType.THRESHOLDS, TH1));
		assertTrue(store.getIndexes(ProfileType.THRESHOLDS, "cgrates.org", null).isEmpty());
	}

	@Test
	public void attributeProfilesIndexPerContext() {
		AttributeProfile profile = new AttributeProfile(TenantID.of("cgrates.org", "ATTR_1"),
			Arrays.asList("*sessions", "*cdrs"), Arrays.asList("FLTR_ACNT"), null,
			Collections.emptyList(), false, 20);
		store.setProfile(profile);

		assertEquals(Collections.singleton("ATTR_1"),
			store.getIndexes(ProfileType.ATTRIBUTES, "cgrates.org:*sessions", "FLTR_ACNT").get("FLTR_ACNT"));
		assertEquals(Collections.singleton("ATTR_1"),
			store.getIndexes(ProfileType.ATTRIBUTES, "cgrates.org:*cdrs", "FLTR_ACNT").get("FLTR_ACNT"));
		assertTrue(store.getIndexes(ProfileType.ATTRIBUTES, "cgrates.org", null).isEmpty());
	}

	@Test
	public void runtimeItemsAreStoredSeparately() {
		store.setItem(new Threshold(TH1, 0));
		assertEquals(1, driver.itemCount(ProfileType.THRESHOLDS));
		assertEquals(0, driver.profileCount(ProfileType.THRESHOLDS));

		store.removeItem(ProfileType.THRESHOLDS, TH1);
		store.removeItem(ProfileType.THRESHOLDS, TH1);
		assertNull(store.getItem(ProfileType.THRESHOLDS, TH1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void driverIsRequired() {
		new DataManager(null);
	}
}
