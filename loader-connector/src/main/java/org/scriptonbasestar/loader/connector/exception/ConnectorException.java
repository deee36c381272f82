package org.scriptonbasestar.loader.connector.exception;

/**
 * 커넥터 계층의 최상위 예외
 *
 * @author archmagece
 * @since 2025-03
 */
public class ConnectorException extends RuntimeException {

	public ConnectorException() {
		super();
	}

	public ConnectorException(String message) {
		super(message);
	}

	public ConnectorException(Throwable cause) {
		super(cause);
	}

	public ConnectorException(String message, Throwable cause) {
		super(message, cause);
	}
}
