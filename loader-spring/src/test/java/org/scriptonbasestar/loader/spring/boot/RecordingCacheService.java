package org.scriptonbasestar.loader.spring.boot;

import org.scriptonbasestar.loader.engine.dispatch.CacheClearArgs;
import org.scriptonbasestar.loader.engine.dispatch.CacheMethods;
import org.scriptonbasestar.loader.engine.dispatch.CacheReloadArgs;
import org.scriptonbasestar.loader.engine.dispatch.CacheService;

import java.util.Collections;
import java.util.ArrayList;
import java.util.List;

/**
 * 호출된 캐시 메서드를 기록하는 테스트용 캐시 서비스
 */
public class RecordingCacheService implements CacheService {

	private final List<String> methods = Collections.synchronizedList(new ArrayList<>());

	@Override
	public String loadCache(CacheReloadArgs args) {
		methods.add(CacheMethods.LOAD_CACHE);
		return CacheMethods.OK;
	}

	@Override
	public String reloadCache(CacheReloadArgs args) {
		methods.add(CacheMethods.RELOAD_CACHE);
		return CacheMethods.OK;
	}

	@Override
	public String removeItems(CacheReloadArgs args) {
		methods.add(CacheMethods.REMOVE_ITEMS);
		return CacheMethods.OK;
	}

	@Override
	public String clear(CacheClearArgs args) {
		methods.add(CacheMethods.CLEAR);
		return CacheMethods.OK;
	}

	public List<String> getMethods() {
		return methods;
	}
}
