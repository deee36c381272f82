package org.scriptonbasestar.loader.connector;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.loader.connector.exception.DialException;
import org.scriptonbasestar.loader.connector.exception.TransportException;

/**
 * 최초 호출 시점에 실제 커넥터를 생성하는 슬롯
 *
 * 생성은 double-checked locking 으로 한 번만 수행됩니다.
 * 생성(dial)에 실패하면 슬롯은 비어있는 채로 남고, 다음 호출에서 다시 시도합니다.
 * 닫힌 슬롯은 다시 생성하지 않습니다.
 *
 * @author archmagece
 * @since 2025-03
 */
@Slf4j
public class LazyConnector implements Connector {

	private final String groupId;
	private final int index;
	private final ConnectorFactory factory;
	private final Object lock = new Object();
	private volatile Connector delegate;
	private boolean closed;

	public LazyConnector(String groupId, int index, ConnectorFactory factory) {
		if (factory == null) {
			throw new IllegalArgumentException("factory must not be null");
		}
		this.groupId = groupId;
		this.index = index;
		this.factory = factory;
	}

	/**
	 * @return the live connector, dialling it on first use
	 * @throws DialException creation failed; the slot stays empty
	 * @throws TransportException the slot was closed
	 */
	public Connector obtain() throws DialException {
		Connector current = delegate;
		if (current == null) {
			synchronized (lock) {
				if (closed) {
					throw new TransportException("Connector " + groupId + "[" + index + "] is closed");
				}
				current = delegate;
				if (current == null) {
					log.debug("Creating connector {}[{}]", groupId, index);
					current = factory.create();
					delegate = current;
				}
			}
		}
		return current;
	}

	public boolean isLive() {
		return delegate != null;
	}

	@Override
	public <R> R call(String serviceMethod, Object args, Class<R> replyType) {
		return obtain().call(serviceMethod, args, replyType);
	}

	@Override
	public void close() {
		Connector current;
		synchronized (lock) {
			closed = true;
			current = delegate;
			delegate = null;
		}
		if (current != null) {
			log.debug("Closing connector {}[{}]", groupId, index);
			current.close();
		}
	}

	@Override
	public String toString() {
		return "LazyConnector{" + groupId + "[" + index + "], live=" + isLive() + '}';
	}
}
