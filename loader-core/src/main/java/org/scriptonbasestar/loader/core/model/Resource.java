package org.scriptonbasestar.loader.core.model;

import java.util.Collections;
import java.util.Map;

/**
 * Runtime usage holder of a {@link ResourceProfile}. A freshly loaded resource has no usages.
 *
 * @author archmagece
 * @since 2025-03
 */
public class Resource extends RuntimeItem {

	private final Map<String, Double> usages;

	public Resource(TenantID tenantID) {
		this(tenantID, Collections.emptyMap());
	}

	public Resource(TenantID tenantID, Map<String, Double> usages) {
		super(tenantID);
		this.usages = usages == null ? Collections.emptyMap() : Map.copyOf(usages);
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.RESOURCES;
	}

	public Map<String, Double> getUsages() {
		return usages;
	}
}
