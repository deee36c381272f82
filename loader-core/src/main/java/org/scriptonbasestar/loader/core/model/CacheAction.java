package org.scriptonbasestar.loader.core.model;

import java.util.Optional;

/**
 * Cache synchronization strategy requested after a store mutation.
 *
 * <h3>Semantics:</h3>
 * <table border="1">
 * <tr><th>Action</th><th>Cache tier behaviour</th></tr>
 * <tr><td>LOAD</td><td>populate the entries for the given keys, keep unrelated entries</td></tr>
 * <tr><td>RELOAD</td><td>atomically replace the entries for the given keys</td></tr>
 * <tr><td>REMOVE</td><td>evict exactly the given keys</td></tr>
 * <tr><td>CLEAR</td><td>drop every entry of the affected partitions</td></tr>
 * <tr><td>NONE</td><td>nothing, no remote call</td></tr>
 * </table>
 *
 * @author archmagece
 * @since 2025-03
 */
public enum CacheAction {
	NONE("*none"),
	LOAD("*load"),
	RELOAD("*reload"),
	REMOVE("*remove"),
	CLEAR("*clear");

	private final String tag;

	CacheAction(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	/**
	 * Unknown tags yield empty rather than an exception; the caller decides how to fail.
	 */
	public static Optional<CacheAction> fromTag(String tag) {
		for (CacheAction action : values()) {
			if (action.tag.equals(tag)) {
				return Optional.of(action);
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return tag;
	}
}
