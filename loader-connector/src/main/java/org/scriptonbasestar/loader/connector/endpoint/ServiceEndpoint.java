package org.scriptonbasestar.loader.connector.endpoint;

import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;

/**
 * Server side of a connector: dispatches a named method to its handler.
 * <p>
 * Used in process by internal connectors and behind {@code RpcServer} for the
 * networked transports.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
@FunctionalInterface
public interface ServiceEndpoint {

	/**
	 * @throws UnsupportedServiceMethodException the method is not exposed here
	 */
	Object serve(String serviceMethod, Object args);
}
