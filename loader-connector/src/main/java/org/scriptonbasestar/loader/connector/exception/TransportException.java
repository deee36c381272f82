package org.scriptonbasestar.loader.connector.exception;

/**
 * Transport level failure: dial, timeout, broken connection, undecodable or
 * mistyped reply. Never triggers failover to another connector.
 *
 * @author archmagece
 * @since 2025-03
 */
public class TransportException extends ConnectorException {

	public TransportException(String message) {
		super(message);
	}

	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}
}
