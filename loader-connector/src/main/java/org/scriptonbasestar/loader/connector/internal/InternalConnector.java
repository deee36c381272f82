package org.scriptonbasestar.loader.connector.internal;

import org.scriptonbasestar.loader.connector.Connector;
import org.scriptonbasestar.loader.connector.ReplyTypes;
import org.scriptonbasestar.loader.connector.endpoint.ServiceEndpoint;
import org.scriptonbasestar.loader.connector.exception.ConnectorException;
import org.scriptonbasestar.loader.connector.exception.RemoteCallException;
import org.scriptonbasestar.loader.connector.rpc.RemoteErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;

/**
 * In-process connector: calls a {@link ServiceEndpoint} directly, no serialization.
 * <p>
 * At most {@code capacity} calls run at once; further callers wait for a handle up to
 * the acquire timeout.
 * </p>
 * <p>
 * Endpoint failures surface as {@link RemoteCallException}, the same as over the
 * networked transports.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public class InternalConnector implements Connector {

	private static final Logger log = LoggerFactory.getLogger(InternalConnector.class);

	private final BoundedHandlePool<ServiceEndpoint> handles;
	private final Duration acquireTimeout;

	public InternalConnector(ServiceEndpoint endpoint, int capacity, Duration acquireTimeout) {
		if (endpoint == null) {
			throw new IllegalArgumentException("endpoint must not be null");
		}
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
		}
		this.handles = new BoundedHandlePool<>(Collections.nCopies(capacity, endpoint));
		this.acquireTimeout = acquireTimeout;
		log.debug("InternalConnector initialized with capacity {}", capacity);
	}

	@Override
	public <R> R call(String serviceMethod, Object args, Class<R> replyType) {
		try (BoundedHandlePool.Lease<ServiceEndpoint> lease = handles.acquire(acquireTimeout)) {
			log.trace("Internal call {}", serviceMethod);
			Object reply;
			try {
				reply = lease.get().serve(serviceMethod, args);
			} catch (ConnectorException e) {
				throw e;
			} catch (RuntimeException e) {
				log.trace("{} failed: {}", serviceMethod, e.getMessage());
				throw new RemoteCallException(serviceMethod, RemoteErrors.toError(e), e);
			}
			return ReplyTypes.cast(serviceMethod, reply, replyType);
		}
	}

	public int availableHandles() {
		return handles.available();
	}

	@Override
	public void close() {
		log.trace("InternalConnector closed");
	}
}
