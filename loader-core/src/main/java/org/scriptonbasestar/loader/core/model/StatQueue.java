package org.scriptonbasestar.loader.core.model;

import java.util.Collections;
import java.util.List;

/**
 * @author archmagece
 * @since 2025-03
 */
public class StatQueue extends RuntimeItem {

	private final List<String> metricIds;

	public StatQueue(TenantID tenantID, List<String> metricIds) {
		super(tenantID);
		this.metricIds = metricIds == null ? Collections.emptyList() : List.copyOf(metricIds);
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.STATS;
	}

	public List<String> getMetricIds() {
		return metricIds;
	}
}
