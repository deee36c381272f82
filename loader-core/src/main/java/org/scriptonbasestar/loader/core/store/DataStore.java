package org.scriptonbasestar.loader.core.store;

import org.scriptonbasestar.loader.core.exception.StoreException;
import org.scriptonbasestar.loader.core.model.Profile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.RuntimeItem;
import org.scriptonbasestar.loader.core.model.TenantID;

import java.util.Map;
import java.util.Set;

/**
 * Authoritative tenant-scoped store the loader writes into.
 * <p>
 * Profiles are addressed by (tenant, ID, {@link ProfileType}). Implementations keep the
 * filter indexes consistent with the profiles they hold: {@link #setProfile} replaces the
 * index entries of the previous version and {@link #removeProfile} drops them.
 * </p>
 *
 * <h3>Error Handling:</h3>
 * <p>
 * Every operation may raise {@link StoreException}; a missing backend surfaces as
 * {@link org.scriptonbasestar.loader.core.exception.NoDatabaseConnectionException}
 * and must reach the caller unchanged.
 * </p>
 *
 * <h3>Thread Safety:</h3>
 * <p>
 * Implementations must be thread-safe; batches of different profile types run concurrently.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public interface DataStore {

	/**
	 * @return the stored profile or {@code null} when absent
	 */
	Profile getProfile(ProfileType type, TenantID tenantID) throws StoreException;

	/**
	 * Insert or replace a profile together with its filter index entries.
	 */
	void setProfile(Profile profile) throws StoreException;

	/**
	 * Remove a profile and its filter index entries. Removing a missing profile is a no-op.
	 */
	void removeProfile(ProfileType type, TenantID tenantID) throws StoreException;

	RuntimeItem getItem(ProfileType type, TenantID tenantID) throws StoreException;

	void setItem(RuntimeItem item) throws StoreException;

	void removeItem(ProfileType type, TenantID tenantID) throws StoreException;

	/**
	 * Filter index lookup.
	 *
	 * @param type indexed profile type
	 * @param tenantContext {@code tenant} or {@code tenant:context}
	 * @param indexKey filter ID, or {@code null} for every key under the context
	 * @return index key to profile IDs, never {@code null}
	 */
	Map<String, Set<String>> getIndexes(ProfileType type, String tenantContext, String indexKey) throws StoreException;

	/**
	 * Merge profile IDs into the given index keys.
	 */
	void setIndexes(ProfileType type, String tenantContext, Map<String, Set<String>> indexes) throws StoreException;
}
