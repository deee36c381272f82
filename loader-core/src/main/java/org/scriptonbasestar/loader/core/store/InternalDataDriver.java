package org.scriptonbasestar.loader.core.store;

import org.scriptonbasestar.loader.core.model.Profile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.RuntimeItem;
import org.scriptonbasestar.loader.core.model.TenantID;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리 기반 {@link DataDriver}
 *
 * 프로세스 내부 테스트와 단독 실행용입니다. 모든 연산은 thread-safe 합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class InternalDataDriver implements DataDriver {

	private final Map<ProfileType, Map<TenantID, Profile>> profiles = new EnumMap<>(ProfileType.class);
	private final Map<ProfileType, Map<TenantID, RuntimeItem>> items = new EnumMap<>(ProfileType.class);
	private final Map<String, Map<String, Set<String>>> indexes = new ConcurrentHashMap<>();

	public InternalDataDriver() {
		for (ProfileType type : ProfileType.values()) {
			profiles.put(type, new ConcurrentHashMap<>());
			items.put(type, new ConcurrentHashMap<>());
		}
	}

	@Override
	public Profile getProfileDrv(ProfileType type, TenantID tenantID) {
		return profiles.get(type).get(tenantID);
	}

	@Override
	public void setProfileDrv(Profile profile) {
		profiles.get(profile.getProfileType()).put(profile.getTenantID(), profile);
	}

	@Override
	public void removeProfileDrv(ProfileType type, TenantID tenantID) {
		profiles.get(type).remove(tenantID);
	}

	@Override
	public RuntimeItem getItemDrv(ProfileType type, TenantID tenantID) {
		return items.get(type).get(tenantID);
	}

	@Override
	public void setItemDrv(RuntimeItem item) {
		items.get(item.getProfileType()).put(item.getTenantID(), item);
	}

	@Override
	public void removeItemDrv(ProfileType type, TenantID tenantID) {
		items.get(type).remove(tenantID);
	}

	@Override
	public Map<String, Set<String>> getIndexesDrv(ProfileType type, String tenantContext, String indexKey) {
		Map<String, Set<String>> bucket = indexes.get(bucketKey(type, tenantContext));
		if (bucket == null) {
			return Collections.emptyMap();
		}
		Map<String, Set<String>> result = new HashMap<>();
		synchronized (bucket) {
			for (Map.Entry<String, Set<String>> entry : bucket.entrySet()) {
				if (indexKey == null || indexKey.equals(entry.getKey())) {
					result.put(entry.getKey(), new HashSet<>(entry.getValue()));
				}
			}
		}
		return result;
	}

	@Override
	public void setIndexesDrv(ProfileType type, String tenantContext, Map<String, Set<String>> entries) {
		Map<String, Set<String>> bucket = indexes.computeIfAbsent(bucketKey(type, tenantContext), k -> new HashMap<>());
		synchronized (bucket) {
			for (Map.Entry<String, Set<String>> entry : entries.entrySet()) {
				bucket.computeIfAbsent(entry.getKey(), k -> new HashSet<>()).addAll(entry.getValue());
			}
		}
	}

	@Override
	public void removeIndexesDrv(ProfileType type, String tenantContext, String indexKey, Collection<String> profileIds) {
		Map<String, Set<String>> bucket = indexes.get(bucketKey(type, tenantContext));
		if (bucket == null) {
			return;
		}
		synchronized (bucket) {
			Set<String> ids = bucket.get(indexKey);
			if (ids != null) {
				ids.removeAll(profileIds);
				if (ids.isEmpty()) {
					bucket.remove(indexKey);
				}
			}
		}
	}

	public int profileCount(ProfileType type) {
		return profiles.get(type).size();
	}

	public int itemCount(ProfileType type) {
		return items.get(type).size();
	}

	private static String bucketKey(ProfileType type, String tenantContext) {
		return type.getTag() + '|' + tenantContext;
	}
}
