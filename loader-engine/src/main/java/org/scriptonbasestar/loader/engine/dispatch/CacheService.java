package org.scriptonbasestar.loader.engine.dispatch;

/**
 * Cache tier API the loader drives. Each method answers {@link CacheMethods#OK}.
 *
 * @author archmagece
 * @since 2025-03
 */
public interface CacheService {

	String loadCache(CacheReloadArgs args);

	String reloadCache(CacheReloadArgs args);

	String removeItems(CacheReloadArgs args);

	String clear(CacheClearArgs args);
}
