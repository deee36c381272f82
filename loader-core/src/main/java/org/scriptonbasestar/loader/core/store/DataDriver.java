package org.scriptonbasestar.loader.core.store;

import org.scriptonbasestar.loader.core.exception.StoreException;
import org.scriptonbasestar.loader.core.model.Profile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.RuntimeItem;
import org.scriptonbasestar.loader.core.model.TenantID;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Raw storage SPI under {@link DataManager}.
 * <p>
 * Drivers only persist what they are handed; index bookkeeping lives in {@link DataManager}.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public interface DataDriver {

	Profile getProfileDrv(ProfileType type, TenantID tenantID) throws StoreException;

	void setProfileDrv(Profile profile) throws StoreException;

	void removeProfileDrv(ProfileType type, TenantID tenantID) throws StoreException;

	RuntimeItem getItemDrv(ProfileType type, TenantID tenantID) throws StoreException;

	void setItemDrv(RuntimeItem item) throws StoreException;

	void removeItemDrv(ProfileType type, TenantID tenantID) throws StoreException;

	Map<String, Set<String>> getIndexesDrv(ProfileType type, String tenantContext, String indexKey) throws StoreException;

	void setIndexesDrv(ProfileType type, String tenantContext, Map<String, Set<String>> indexes) throws StoreException;

	/**
	 * Drop the given profile IDs from the index keys; keys left empty are deleted.
	 */
	void removeIndexesDrv(ProfileType type, String tenantContext, String indexKey, Collection<String> profileIds) throws StoreException;

	/**
	 * 저장소 연결 종료. 기본 구현은 아무것도 하지 않습니다.
	 */
	default void close() {
	}
}
