package org.scriptonbasestar.loader.engine.dispatch;

/**
 * Remote cache service method names.
 *
 * @author archmagece
 * @since 2025-03
 */
public final class CacheMethods {

	public static final String LOAD_CACHE = "CacheSv1.LoadCache";
	public static final String RELOAD_CACHE = "CacheSv1.ReloadCache";
	public static final String REMOVE_ITEMS = "CacheSv1.RemoveItems";
	public static final String CLEAR = "CacheSv1.Clear";

	/** 성공 응답 */
	public static final String OK = "OK";

	private CacheMethods() {
	}
}
