package org.scriptonbasestar.loader.connector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of lazily created connectors registered under one group ID.
 *
 * @author archmagece
 * @since 2025-03
 */
public class ConnectorGroup implements AutoCloseable {

	private final String id;
	private final List<LazyConnector> connectors;

	public ConnectorGroup(String id, List<ConnectorFactory> factories) {
		if (id == null || id.isEmpty()) {
			throw new IllegalArgumentException("group id must not be empty");
		}
		if (factories == null || factories.isEmpty()) {
			throw new IllegalArgumentException("connector group " + id + " needs at least one connector");
		}
		List<LazyConnector> slots = new ArrayList<>(factories.size());
		for (int i = 0; i < factories.size(); i++) {
			slots.add(new LazyConnector(id, i, factories.get(i)));
		}
		this.id = id;
		this.connectors = Collections.unmodifiableList(slots);
	}

	public String getId() {
		return id;
	}

	public List<LazyConnector> getConnectors() {
		return connectors;
	}

	public int size() {
		return connectors.size();
	}

	public int liveCount() {
		int live = 0;
		for (LazyConnector connector : connectors) {
			if (connector.isLive()) {
				live++;
			}
		}
		return live;
	}

	@Override
	public void close() {
		for (LazyConnector connector : connectors) {
			connector.close();
		}
	}

	@Override
	public String toString() {
		return "ConnectorGroup{" + id + ", connectors=" + connectors.size() + ", live=" + liveCount() + '}';
	}
}
