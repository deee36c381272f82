package org.scriptonbasestar.loader.core.model;

/**
 * 상태를 가지는 프로파일(Threshold, StatQueue, Resource)의 런타임 항목
 *
 * 프로파일과 같은 (tenant, ID) 키를 사용합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public abstract class RuntimeItem {

	private final TenantID tenantID;

	protected RuntimeItem(TenantID tenantID) {
		if (tenantID == null) {
			throw new IllegalArgumentException("tenantID must not be null");
		}
		this.tenantID = tenantID;
	}

	public abstract ProfileType getProfileType();

	public TenantID getTenantID() {
		return tenantID;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + tenantID + '}';
	}
}
