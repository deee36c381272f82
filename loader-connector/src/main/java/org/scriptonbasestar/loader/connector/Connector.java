package org.scriptonbasestar.loader.connector;

import org.scriptonbasestar.loader.connector.exception.TransportException;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;

/**
 * Performs named remote calls against one peer.
 * <p>
 * Capability is discovered at call time: a peer that does not expose the method raises
 * {@link UnsupportedServiceMethodException}, which lets the pool move on to the next
 * connector. Every other failure is a {@link TransportException} and stops the call.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public interface Connector extends AutoCloseable {

	/**
	 * @param serviceMethod e.g. {@code CacheSv1.ReloadCache}
	 * @param args request argument, serialized by the transport
	 * @param replyType expected reply type
	 * @return the typed reply
	 * @throws UnsupportedServiceMethodException the peer does not serve the method
	 * @throws TransportException dial, timeout, remote error or reply type mismatch
	 */
	<R> R call(String serviceMethod, Object args, Class<R> replyType);

	@Override
	void close();
}
