package org.scriptonbasestar.loader.engine.dispatch;

import org.scriptonbasestar.loader.connector.endpoint.MethodRegistry;

/**
 * {@link CacheService} 를 커넥터 엔드포인트로 노출합니다.
 *
 * <pre>{@code
 * pool.registerInternal(ConnectorGroups.INTERNAL_CACHES, CacheServiceEndpoint.of(cacheService));
 * new RpcServer(CacheServiceEndpoint.of(cacheService), new JsonRpcCodec());
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
public final class CacheServiceEndpoint {

	private CacheServiceEndpoint() {
	}

	public static MethodRegistry of(CacheService service) {
		if (service == null) {
			throw new IllegalArgumentException("service must not be null");
		}
		return new MethodRegistry()
			.register(CacheMethods.LOAD_CACHE, CacheReloadArgs.class, service::loadCache)
			.register(CacheMethods.RELOAD_CACHE, CacheReloadArgs.class, service::reloadCache)
			.register(CacheMethods.REMOVE_ITEMS, CacheReloadArgs.class, service::removeItems)
			.register(CacheMethods.CLEAR, CacheClearArgs.class, service::clear);
	}
}
