package org.scriptonbasestar.loader.engine.dispatch;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments of {@code LoadCache}, {@code ReloadCache} and {@code RemoveItems}:
 * cache partition → {@code tenant:ID} keys.
 *
 * @author archmagece
 * @since 2025-03
 */
public class CacheReloadArgs implements Serializable {

	private static final long serialVersionUID = 1L;

	private String tenant;
	private Map<String, List<String>> argsCache = new LinkedHashMap<>();

	public CacheReloadArgs() {
	}

	public CacheReloadArgs(String tenant) {
		this.tenant = tenant;
	}

	public CacheReloadArgs add(String partition, String key) {
		argsCache.computeIfAbsent(partition, p -> new ArrayList<>()).add(key);
		return this;
	}

	public String getTenant() {
		return tenant;
	}

	public void setTenant(String tenant) {
		this.tenant = tenant;
	}

	public Map<String, List<String>> getArgsCache() {
		return argsCache;
	}

	public void setArgsCache(Map<String, List<String>> argsCache) {
		this.argsCache = argsCache == null ? new LinkedHashMap<>() : argsCache;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CacheReloadArgs)) {
			return false;
		}
		CacheReloadArgs other = (CacheReloadArgs) o;
		return Objects.equals(tenant, other.tenant) && argsCache.equals(other.argsCache);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tenant, argsCache);
	}

	@Override
	public String toString() {
		return "CacheReloadArgs{tenant=" + tenant + ", argsCache=" + argsCache + '}';
	}
}
