package org.scriptonbasestar.loader.core.exception;

/**
 * Persistence or index maintenance failure reported by a {@code DataStore}.
 *
 * @author archmagece
 * @since 2025-03
 */
public class StoreException extends LoaderException {

	public StoreException(String message) {
		super(message);
	}

	public StoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
