package org.scriptonbasestar.loader.core.model;

import java.util.Objects;

/**
 * 테넌트와 ID로 구성된 전역 키
 *
 * 문자열 표현은 {@code tenant:id} 입니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public final class TenantID {

	public static final char SEPARATOR = ':';

	private final String tenant;
	private final String id;

	private TenantID(String tenant, String id) {
		this.tenant = tenant;
		this.id = id;
	}

	public static TenantID of(String tenant, String id) {
		if (tenant == null || tenant.isEmpty()) {
			throw new IllegalArgumentException("tenant must not be null or empty");
		}
		if (id == null || id.isEmpty()) {
			throw new IllegalArgumentException("id must not be null or empty");
		}
		return new TenantID(tenant, id);
	}

	/**
	 * {@code tenant:id} 문자열을 파싱합니다. ID에는 구분자가 포함될 수 있습니다.
	 */
	public static TenantID parse(String concatenated) {
		int idx = concatenated == null ? -1 : concatenated.indexOf(SEPARATOR);
		if (idx <= 0 || idx == concatenated.length() - 1) {
			throw new IllegalArgumentException("Not a tenant:id key: " + concatenated);
		}
		return new TenantID(concatenated.substring(0, idx), concatenated.substring(idx + 1));
	}

	public String getTenant() {
		return tenant;
	}

	public String getId() {
		return id;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TenantID)) {
			return false;
		}
		TenantID other = (TenantID) o;
		return tenant.equals(other.tenant) && id.equals(other.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tenant, id);
	}

	@Override
	public String toString() {
		return tenant + SEPARATOR + id;
	}
}
