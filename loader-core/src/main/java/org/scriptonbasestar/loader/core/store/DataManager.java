package org.scriptonbasestar.loader.core.store;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.loader.core.exception.StoreException;
import org.scriptonbasestar.loader.core.model.Profile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.RuntimeItem;
import org.scriptonbasestar.loader.core.model.TenantID;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default {@link DataStore}: delegates persistence to a {@link DataDriver} and keeps the
 * filter indexes in line with the stored profiles.
 * <p>
 * A profile is indexed under each of its filter IDs, per tenant context. Profiles without
 * filters are indexed under {@value #NONE_INDEX_KEY}.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * DataStore store = new DataManager(new InternalDataDriver());
 * store.setProfile(thresholdProfile);
 * store.getIndexes(ProfileType.THRESHOLDS, "cgrates.org", "FLTR_1"); // {FLTR_1=[TH1]}
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
@Slf4j
public class DataManager implements DataStore {

	public static final String NONE_INDEX_KEY = "*none:*any:*any";

	private final DataDriver driver;

	public DataManager(DataDriver driver) {
		if (driver == null) {
			throw new IllegalArgumentException("driver must not be null");
		}
		this.driver = driver;
	}

	public DataDriver getDriver() {
		return driver;
	}

	@Override
	public Profile getProfile(ProfileType type, TenantID tenantID) throws StoreException {
		return driver.getProfileDrv(type, tenantID);
	}

	@Override
	public void setProfile(Profile profile) throws StoreException {
		ProfileType type = profile.getProfileType();
		Profile previous = type.getIndexPartition().isPresent()
			? driver.getProfileDrv(type, profile.getTenantID())
			: null;
		driver.setProfileDrv(profile);
		if (type.getIndexPartition().isEmpty()) {
			return;
		}
		if (previous != null) {
			dropIndexes(previous);
		}
		for (String context : profile.indexContexts()) {
			driver.setIndexesDrv(type, context, indexEntries(profile));
		}
		log.trace("stored {} {} with index keys {}", type, profile.getTenantID(), indexKeys(profile));
	}

	@Override
	public void removeProfile(ProfileType type, TenantID tenantID) throws StoreException {
		Profile previous = driver.getProfileDrv(type, tenantID);
		if (previous == null) {
			log.trace("{} {} not stored, nothing to remove", type, tenantID);
			return;
		}
		driver.removeProfileDrv(type, tenantID);
		if (type.getIndexPartition().isPresent()) {
			dropIndexes(previous);
		}
	}

	@Override
	public RuntimeItem getItem(ProfileType type, TenantID tenantID) throws StoreException {
		return driver.getItemDrv(type, tenantID);
	}

	@Override
	public void setItem(RuntimeItem item) throws StoreException {
		driver.setItemDrv(item);
	}

	@Override
	public void removeItem(ProfileType type, TenantID tenantID) throws StoreException {
		driver.removeItemDrv(type, tenantID);
	}

	@Override
	public Map<String, Set<String>> getIndexes(ProfileType type, String tenantContext, String indexKey) throws StoreException {
		Map<String, Set<String>> indexes = driver.getIndexesDrv(type, tenantContext, indexKey);
		return indexes == null ? Collections.emptyMap() : indexes;
	}

	@Override
	public void setIndexes(ProfileType type, String tenantContext, Map<String, Set<String>> indexes) throws StoreException {
		driver.setIndexesDrv(type, tenantContext, indexes);
	}

	private void dropIndexes(Profile profile) {
		List<String> ids = List.of(profile.getId());
		for (String context : profile.indexContexts()) {
			for (String key : indexKeys(profile)) {
				driver.removeIndexesDrv(profile.getProfileType(), context, key, ids);
			}
		}
	}

	private static Map<String, Set<String>> indexEntries(Profile profile) {
		Map<String, Set<String>> entries = new HashMap<>();
		for (String key : indexKeys(profile)) {
			Set<String> ids = new HashSet<>();
			ids.add(profile.getId());
			entries.put(key, ids);
		}
		return entries;
	}

	static List<String> indexKeys(Profile profile) {
		return profile.getFilterIds().isEmpty() ? List.of(NONE_INDEX_KEY) : profile.getFilterIds();
	}
}
