package org.scriptonbasestar.loader.connector;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.loader.connector.endpoint.ServiceEndpoint;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;
import org.scriptonbasestar.loader.connector.internal.InternalConnector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Named connector groups with lazy creation and method-level failover.
 * <p>
 * Groups are registered up front (ID → connector factories) and materialised on first
 * lookup. {@link #call} walks the requested groups in order and, inside each group, the
 * connectors in order; only {@link UnsupportedServiceMethodException} moves on to the next
 * candidate.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * ConnectorPool pool = ConnectorPool.builder()
 *     .options(ConnectorOptions.defaults())
 *     .registerInternal(ConnectorGroups.INTERNAL_CACHES, cacheEndpoint)
 *     .registerRemote("*remote_caches", TransportKind.JSON, List.of("10.0.0.1:2012"))
 *     .build();
 *
 * String reply = pool.call(List.of("*internal:*caches", "*remote_caches"),
 *     "CacheSv1.ReloadCache", args, String.class);
 * }</pre>
 *
 * <h3>Thread Safety:</h3>
 * <p>
 * Shared by every loader batch. Group creation is an atomic insert-if-absent, connector
 * creation inside a group is done once per slot.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
@Slf4j
public class ConnectorPool implements AutoCloseable {

	private final ConnectorOptions options;
	private final Map<String, List<ConnectorFactory>> registrations = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<String, ConnectorGroup> groups = new ConcurrentHashMap<>();

	public ConnectorPool() {
		this(ConnectorOptions.defaults());
	}

	public ConnectorPool(ConnectorOptions options) {
		if (options == null) {
			throw new IllegalArgumentException("options must not be null");
		}
		this.options = options;
	}

	public static Builder builder() {
		return new Builder();
	}

	public ConnectorOptions getOptions() {
		return options;
	}

	/**
	 * 그룹을 등록합니다. 이미 생성된 같은 ID의 그룹은 닫고 새 등록으로 대체합니다.
	 */
	public ConnectorPool register(String groupId, List<ConnectorFactory> factories) {
		if (groupId == null || groupId.isEmpty()) {
			throw new IllegalArgumentException("groupId must not be empty");
		}
		if (factories == null || factories.isEmpty()) {
			throw new IllegalArgumentException("connector group " + groupId + " needs at least one connector");
		}
		List<ConnectorFactory> registration = List.copyOf(factories);
		// 같은 키의 acquire 는 교체가 끝날 때까지 대기하므로 이전 등록으로 그룹을 만들지 않는다
		AtomicReference<ConnectorGroup> evicted = new AtomicReference<>();
		groups.compute(groupId, (id, live) -> {
			registrations.put(id, registration);
			evicted.set(live);
			return null;
		});
		if (evicted.get() != null) {
			log.debug("Closing replaced connector group {}", groupId);
			evicted.get().close();
		}
		log.debug("Registered connector group {} with {} connector(s)", groupId, factories.size());
		return this;
	}

	public ConnectorPool register(String groupId, ConnectorFactory... factories) {
		return register(groupId, Arrays.asList(factories));
	}

	/**
	 * 같은 프로세스의 서비스 엔드포인트를 그룹으로 등록합니다.
	 */
	public ConnectorPool registerInternal(String groupId, ServiceEndpoint endpoint) {
		if (endpoint == null) {
			throw new IllegalArgumentException("endpoint must not be null");
		}
		return register(groupId, () -> new InternalConnector(endpoint,
			options.getInternalCapacity(), options.getAcquireTimeout()));
	}

	/**
	 * 원격 주소 목록을 그룹으로 등록합니다. 주소 순서가 failover 순서입니다.
	 */
	public ConnectorPool registerRemote(String groupId, TransportKind kind, List<String> addresses) {
		if (addresses == null || addresses.isEmpty()) {
			throw new IllegalArgumentException("connector group " + groupId + " needs at least one address");
		}
		List<ConnectorFactory> factories = new ArrayList<>(addresses.size());
		for (String address : addresses) {
			factories.add(ConnectorFactories.forAddress(kind, address, options));
		}
		return register(groupId, factories);
	}

	public boolean isRegistered(String groupId) {
		return registrations.containsKey(groupId);
	}

	public Set<String> registeredGroups() {
		return Collections.unmodifiableSet(new TreeSet<>(registrations.keySet()));
	}

	/**
	 * @return IDs of groups materialised so far
	 */
	public Set<String> liveGroups() {
		return Collections.unmodifiableSet(new TreeSet<>(groups.keySet()));
	}

	/**
	 * Looks a group up, creating it on first use.
	 *
	 * @return the group, or empty when the ID was never registered
	 */
	public Optional<ConnectorGroup> acquire(String groupId) {
		if (groupId == null || !registrations.containsKey(groupId)) {
			return Optional.empty();
		}
		return Optional.of(groups.computeIfAbsent(groupId, id -> {
			log.debug("Creating connector group {}", id);
			return new ConnectorGroup(id, registrations.get(id));
		}));
	}

	/**
	 * Calls the method on the first connector able to serve it.
	 *
	 * @param groupIds groups to try, in order; unregistered IDs are skipped
	 * @throws UnsupportedServiceMethodException no connector in any group serves the method
	 * @throws org.scriptonbasestar.loader.connector.exception.TransportException any other failure, raised at once
	 */
	public <R> R call(List<String> groupIds, String serviceMethod, Object args, Class<R> replyType) {
		for (String groupId : groupIds) {
			Optional<ConnectorGroup> group = acquire(groupId);
			if (group.isEmpty()) {
				log.trace("Connector group {} not registered, skipping", groupId);
				continue;
			}
			for (LazyConnector connector : group.get().getConnectors()) {
				try {
					R reply = connector.call(serviceMethod, args, replyType);
					log.trace("{} served by {}", serviceMethod, connector);
					return reply;
				} catch (UnsupportedServiceMethodException e) {
					log.trace("{} does not serve {}, trying next", connector, serviceMethod);
				}
			}
		}
		throw new UnsupportedServiceMethodException(serviceMethod, groupIds);
	}

	/**
	 * 생성된 그룹을 닫고 제거합니다. 등록 정보는 유지되어 다음 조회 시 다시 생성됩니다.
	 */
	public void remove(String groupId) {
		ConnectorGroup group = groups.remove(groupId);
		if (group != null) {
			log.debug("Closing connector group {}", groupId);
			group.close();
		}
	}

	public void clear() {
		for (String groupId : new ArrayList<>(groups.keySet())) {
			remove(groupId);
		}
	}

	@Override
	public void close() {
		clear();
	}

	public static class Builder {
		private ConnectorOptions options = ConnectorOptions.defaults();
		private final List<Consumer<ConnectorPool>> registrations = new ArrayList<>();

		public Builder options(ConnectorOptions options) {
			this.options = options;
			return this;
		}

		public Builder register(String groupId, ConnectorFactory... factories) {
			registrations.add(pool -> pool.register(groupId, factories));
			return this;
		}

		public Builder registerInternal(String groupId, ServiceEndpoint endpoint) {
			registrations.add(pool -> pool.registerInternal(groupId, endpoint));
			return this;
		}

		public Builder registerRemote(String groupId, TransportKind kind, List<String> addresses) {
			registrations.add(pool -> pool.registerRemote(groupId, kind, addresses));
			return this;
		}

		public ConnectorPool build() {
			ConnectorPool pool = new ConnectorPool(options);
			for (Consumer<ConnectorPool> registration : registrations) {
				registration.accept(pool);
			}
			return pool;
		}
	}
}
