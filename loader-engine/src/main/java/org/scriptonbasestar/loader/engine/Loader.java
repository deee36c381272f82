package org.scriptonbasestar.loader.engine;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.source.RecordSource;
import org.scriptonbasestar.loader.core.source.RecordSourceProvider;
import org.scriptonbasestar.loader.core.store.DataStore;
import org.scriptonbasestar.loader.core.util.TimeParser;
import org.scriptonbasestar.loader.engine.dispatch.CacheDispatcher;
import org.scriptonbasestar.loader.engine.processor.ContentProcessor;
import org.scriptonbasestar.loader.engine.processor.RemovalProcessor;
import org.scriptonbasestar.loader.engine.report.BatchListener;
import org.scriptonbasestar.loader.engine.report.BatchReport;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Applies or removes batches of configuration records and propagates the change to the
 * cache tier.
 * <p>
 * Batches run synchronously in the calling thread. Batches of different profile types may
 * run concurrently; batches of the same type on one loader are serialized.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Loader loader = Loader.builder()
 *     .loaderId("*default")
 *     .dataStore(new DataManager(new InternalDataDriver()))
 *     .connectorPool(pool)
 *     .cacheConns(List.of(ConnectorGroups.INTERNAL_CACHES))
 *     .timezone("UTC")
 *     .recordSourceProvider(new JsonDirectoryRecordSourceProvider(Paths.get("/var/spool/loader/in")))
 *     .listener(metrics)
 *     .build();
 *
 * loader.processContent(ProfileType.RATE_PROFILES, "*reload");
 * loader.removeContent(ProfileType.THRESHOLDS, "*remove");
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
@Slf4j
public class Loader {

	private final String loaderId;
	private final DataStore dataStore;
	private final ConnectorPool connectorPool;
	private final ZoneId timezone;
	private final RecordSourceProvider recordSourceProvider;
	private final CacheDispatcher dispatcher;
	private final ContentProcessor contentProcessor;
	private final RemovalProcessor removalProcessor;
	private final Map<ProfileType, ReentrantLock> typeLocks = new EnumMap<>(ProfileType.class);

	private Loader(Builder builder) {
		this.loaderId = builder.loaderId;
		this.dataStore = builder.dataStore;
		this.connectorPool = builder.connectorPool;
		this.timezone = builder.timezone;
		this.recordSourceProvider = builder.recordSourceProvider;
		this.dispatcher = new CacheDispatcher(connectorPool, builder.cacheConns);
		this.contentProcessor = new ContentProcessor(loaderId, dataStore, dispatcher, timezone, builder.listeners);
		this.removalProcessor = new RemovalProcessor(loaderId, dataStore, dispatcher, timezone, builder.listeners);
		for (ProfileType type : ProfileType.values()) {
			typeLocks.put(type, new ReentrantLock());
		}
		log.debug("Loader {} initialized: cacheConns={}, timezone={}", loaderId, builder.cacheConns, timezone);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Reads a batch from the configured {@link RecordSourceProvider}, stores every record and
	 * sends the cache action for each stored key.
	 *
	 * @param type profile type of the batch
	 * @param cacheAction {@code *none}, {@code *load}, {@code *reload}, {@code *remove} or {@code *clear}
	 */
	public BatchReport processContent(ProfileType type, String cacheAction) {
		return processContent(type, cacheAction, openSource(type));
	}

	public BatchReport processContent(ProfileType type, String cacheAction, RecordSource source) {
		return locked(type, () -> contentProcessor.process(type, cacheAction, source));
	}

	/**
	 * @param loaderType profile type tag, e.g. {@code *rate_profiles}
	 */
	public BatchReport processContent(String loaderType, String cacheAction) {
		return processContent(resolve(loaderType), cacheAction);
	}

	/**
	 * Reads a batch from the configured {@link RecordSourceProvider}, removes every
	 * referenced profile and sends the cache action for each key.
	 */
	public BatchReport removeContent(ProfileType type, String cacheAction) {
		return removeContent(type, cacheAction, openSource(type));
	}

	public BatchReport removeContent(ProfileType type, String cacheAction, RecordSource source) {
		return locked(type, () -> removalProcessor.process(type, cacheAction, source));
	}

	public BatchReport removeContent(String loaderType, String cacheAction) {
		return removeContent(resolve(loaderType), cacheAction);
	}

	public String getLoaderId() {
		return loaderId;
	}

	public DataStore getDataStore() {
		return dataStore;
	}

	public ConnectorPool getConnectorPool() {
		return connectorPool;
	}

	public List<String> getCacheConns() {
		return dispatcher.getCacheConns();
	}

	public ZoneId getTimezone() {
		return timezone;
	}

	private RecordSource openSource(ProfileType type) {
		if (recordSourceProvider == null) {
			throw new IllegalStateException("Loader " + loaderId + " has no record source provider");
		}
		return recordSourceProvider.open(type);
	}

	private static ProfileType resolve(String loaderType) {
		return ProfileType.fromTag(loaderType)
			.orElseThrow(() -> new IllegalArgumentException("Unknown loader type: " + loaderType));
	}

	private BatchReport locked(ProfileType type, Supplier<BatchReport> batch) {
		ReentrantLock lock = typeLocks.get(type);
		lock.lock();
		try {
			return batch.get();
		} finally {
			lock.unlock();
		}
	}

	public static class Builder {
		private String loaderId = "*default";
		private DataStore dataStore;
		private ConnectorPool connectorPool;
		private List<String> cacheConns = new ArrayList<>();
		private ZoneId timezone = ZoneId.systemDefault();
		private RecordSourceProvider recordSourceProvider;
		private final List<BatchListener> listeners = new ArrayList<>();

		public Builder loaderId(String loaderId) {
			this.loaderId = loaderId;
			return this;
		}

		public Builder dataStore(DataStore dataStore) {
			this.dataStore = dataStore;
			return this;
		}

		public Builder connectorPool(ConnectorPool connectorPool) {
			this.connectorPool = connectorPool;
			return this;
		}

		/**
		 * 캐시 커넥터 그룹 ID 목록. 순서대로 시도합니다.
		 */
		public Builder cacheConns(List<String> cacheConns) {
			this.cacheConns = new ArrayList<>(cacheConns);
			return this;
		}

		public Builder timezone(ZoneId timezone) {
			this.timezone = timezone;
			return this;
		}

		/**
		 * @param timezone zone ID, {@code Local} or empty for the system default
		 */
		public Builder timezone(String timezone) {
			this.timezone = TimeParser.zone(timezone);
			return this;
		}

		public Builder recordSourceProvider(RecordSourceProvider recordSourceProvider) {
			this.recordSourceProvider = recordSourceProvider;
			return this;
		}

		public Builder listener(BatchListener listener) {
			this.listeners.add(listener);
			return this;
		}

		public Loader build() {
			if (loaderId == null || loaderId.isEmpty()) {
				throw new IllegalArgumentException("loaderId must not be empty");
			}
			if (dataStore == null) {
				throw new IllegalArgumentException("dataStore must not be null");
			}
			if (connectorPool == null) {
				throw new IllegalArgumentException("connectorPool must not be null");
			}
			if (timezone == null) {
				throw new IllegalArgumentException("timezone must not be null");
			}
			return new Loader(this);
		}
	}
}
