package org.scriptonbasestar.loader.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Persistable configuration entity built from a record.
 * <p>
 * Always addressed by (tenant, ID, {@link ProfileType}). Instances are immutable and
 * transient inside the loader: they are built, handed to the store and dropped.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public abstract class Profile {

	private final TenantID tenantID;
	private final List<String> filterIds;
	private final double weight;

	protected Profile(TenantID tenantID, List<String> filterIds, double weight) {
		if (tenantID == null) {
			throw new IllegalArgumentException("tenantID must not be null");
		}
		this.tenantID = tenantID;
		this.filterIds = filterIds == null ? Collections.emptyList() : List.copyOf(filterIds);
		this.weight = weight;
	}

	public abstract ProfileType getProfileType();

	public TenantID getTenantID() {
		return tenantID;
	}

	public String getTenant() {
		return tenantID.getTenant();
	}

	public String getId() {
		return tenantID.getId();
	}

	public List<String> getFilterIds() {
		return filterIds;
	}

	public double getWeight() {
		return weight;
	}

	/**
	 * Tenant contexts under which the profile's filter indexes are kept.
	 */
	public List<String> indexContexts() {
		return List.of(getTenant());
	}

	/**
	 * Fresh runtime companion for stateful types, empty otherwise.
	 */
	public Optional<RuntimeItem> newRuntimeItem() {
		return Optional.empty();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + tenantID + ", weight=" + weight + ", filterIds=" + filterIds + '}';
	}
}
