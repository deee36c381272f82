package org.scriptonbasestar.loader.engine.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;
import org.scriptonbasestar.loader.core.model.CacheAction;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.TenantID;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns a cache action into at most one call on the connector pool.
 *
 * <h3>Mapping:</h3>
 * <ul>
 *   <li>{@code *none} - no call</li>
 *   <li>{@code *load} - {@value CacheMethods#LOAD_CACHE} with {@link CacheReloadArgs}</li>
 *   <li>{@code *reload} - {@value CacheMethods#RELOAD_CACHE} with {@link CacheReloadArgs}</li>
 *   <li>{@code *remove} - {@value CacheMethods#REMOVE_ITEMS} with {@link CacheReloadArgs}</li>
 *   <li>{@code *clear} - {@value CacheMethods#CLEAR} with the partitions of the profile type</li>
 * </ul>
 * <p>
 * Stateful types carry their runtime item partition next to the profile partition.
 * An unknown action tag raises {@link UnsupportedServiceMethodException} without any call;
 * pool failures propagate unchanged.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
@Slf4j
public class CacheDispatcher {

	private final ConnectorPool pool;
	private final List<String> cacheConns;

	/**
	 * @param pool shared connector pool
	 * @param cacheConns connector group IDs to try, in order
	 */
	public CacheDispatcher(ConnectorPool pool, List<String> cacheConns) {
		if (pool == null) {
			throw new IllegalArgumentException("pool must not be null");
		}
		this.pool = pool;
		this.cacheConns = cacheConns == null ? List.of() : List.copyOf(cacheConns);
	}

	public List<String> getCacheConns() {
		return cacheConns;
	}

	/**
	 * @param type profile type of the keys
	 * @param actionTag cache action tag, e.g. {@code *reload}
	 * @param keys affected profiles
	 * @throws UnsupportedServiceMethodException unknown action, or no connector serves the method
	 */
	public void dispatch(ProfileType type, String actionTag, Collection<TenantID> keys) {
		Optional<CacheAction> action = CacheAction.fromTag(actionTag);
		if (action.isEmpty()) {
			log.debug("Unknown cache action {} for {}", actionTag, type);
			throw new UnsupportedServiceMethodException(actionTag, cacheConns);
		}
		String reply;
		switch (action.get()) {
			case NONE:
				return;
			case LOAD:
				reply = call(CacheMethods.LOAD_CACHE, reloadArgs(type, keys));
				break;
			case RELOAD:
				reply = call(CacheMethods.RELOAD_CACHE, reloadArgs(type, keys));
				break;
			case REMOVE:
				reply = call(CacheMethods.REMOVE_ITEMS, reloadArgs(type, keys));
				break;
			case CLEAR:
				reply = call(CacheMethods.CLEAR, new CacheClearArgs(tenantOf(keys), type.cachePartitions()));
				break;
			default:
				throw new UnsupportedServiceMethodException(actionTag, cacheConns);
		}
		if (!CacheMethods.OK.equals(reply)) {
			log.warn("Cache service answered {} with {} for {}", action.get(), reply, type);
		}
	}

	static CacheReloadArgs reloadArgs(ProfileType type, Collection<TenantID> keys) {
		CacheReloadArgs args = new CacheReloadArgs(tenantOf(keys));
		for (TenantID key : keys) {
			args.add(type.getProfilePartition(), key.toString());
			type.getItemPartition().ifPresent(partition -> args.add(partition, key.toString()));
		}
		return args;
	}

	private static String tenantOf(Collection<TenantID> keys) {
		return keys.isEmpty() ? null : keys.iterator().next().getTenant();
	}

	private String call(String method, Object args) {
		log.trace("Dispatching {} {} to {}", method, args, cacheConns);
		return pool.call(cacheConns, method, args, String.class);
	}
}
