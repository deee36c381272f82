package org.scriptonbasestar.loader.core.model;

import java.util.Collections;
import java.util.List;

/**
 * @author archmagece
 * @since 2025-03
 */
public class ChargerProfile extends Profile {

	private final String runId;
	private final List<String> attributeIds;

	public ChargerProfile(TenantID tenantID, List<String> filterIds, String runId,
						  List<String> attributeIds, double weight) {
		super(tenantID, filterIds, weight);
		this.runId = runId;
		this.attributeIds = attributeIds == null ? Collections.emptyList() : List.copyOf(attributeIds);
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.CHARGERS;
	}

	public String getRunId() {
		return runId;
	}

	public List<String> getAttributeIds() {
		return attributeIds;
	}
}
