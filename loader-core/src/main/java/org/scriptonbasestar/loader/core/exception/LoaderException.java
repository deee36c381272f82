package org.scriptonbasestar.loader.core.exception;

/**
 * 로더 처리 중 발생하는 모든 예외의 기반 타입
 *
 * @author archmagece
 * @since 2025-03
 */
public class LoaderException extends RuntimeException {

	public LoaderException() {
		super();
	}

	public LoaderException(String message) {
		super(message);
	}

	public LoaderException(String message, Throwable cause) {
		super(message, cause);
	}

	public LoaderException(Throwable cause) {
		super(cause);
	}
}
