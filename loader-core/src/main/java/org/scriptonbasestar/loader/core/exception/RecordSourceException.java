package org.scriptonbasestar.loader.core.exception;

/**
 * The record source failed while producing the next record.
 *
 * @author archmagece
 * @since 2025-03
 */
public class RecordSourceException extends LoaderException {

	public RecordSourceException(String message) {
		super(message);
	}

	public RecordSourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
