package org.scriptonbasestar.loader.engine.dispatch;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code CacheSv1.Clear} 인자: 비울 캐시 파티션 목록
 *
 * @author archmagece
 * @since 2025-03
 */
public class CacheClearArgs implements Serializable {

	private static final long serialVersionUID = 1L;

	private String tenant;
	private List<String> cacheIds = new ArrayList<>();

	public CacheClearArgs() {
	}

	public CacheClearArgs(String tenant, List<String> cacheIds) {
		this.tenant = tenant;
		this.cacheIds = cacheIds == null ? new ArrayList<>() : new ArrayList<>(cacheIds);
	}

	public String getTenant() {
		return tenant;
	}

	public void setTenant(String tenant) {
		this.tenant = tenant;
	}

	public List<String> getCacheIds() {
		return cacheIds;
	}

	public void setCacheIds(List<String> cacheIds) {
		this.cacheIds = cacheIds == null ? new ArrayList<>() : cacheIds;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CacheClearArgs)) {
			return false;
		}
		CacheClearArgs other = (CacheClearArgs) o;
		return Objects.equals(tenant, other.tenant) && cacheIds.equals(other.cacheIds);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tenant, cacheIds);
	}

	@Override
	public String toString() {
		return "CacheClearArgs{tenant=" + tenant + ", cacheIds=" + cacheIds + '}';
	}
}
