package org.scriptonbasestar.loader.core.model;

/**
 * Runtime hit counter of a {@link ThresholdProfile}.
 *
 * @author archmagece
 * @since 2025-03
 */
public class Threshold extends RuntimeItem {

	private final int hits;

	public Threshold(TenantID tenantID, int hits) {
		super(tenantID);
		this.hits = hits;
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.THRESHOLDS;
	}

	public int getHits() {
		return hits;
	}
}
