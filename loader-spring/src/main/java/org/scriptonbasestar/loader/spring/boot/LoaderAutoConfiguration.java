package org.scriptonbasestar.loader.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.loader.connector.ConnectorGroups;
import org.scriptonbasestar.loader.connector.ConnectorOptions;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.core.source.RecordSourceProvider;
import org.scriptonbasestar.loader.core.store.DataManager;
import org.scriptonbasestar.loader.core.store.DataStore;
import org.scriptonbasestar.loader.core.store.InternalDataDriver;
import org.scriptonbasestar.loader.engine.Loader;
import org.scriptonbasestar.loader.engine.dispatch.CacheService;
import org.scriptonbasestar.loader.engine.dispatch.CacheServiceEndpoint;
import org.scriptonbasestar.loader.engine.metrics.LoaderMetrics;
import org.scriptonbasestar.loader.engine.report.BatchListener;
import org.scriptonbasestar.loader.metrics.micrometer.MicrometerBatchListener;
import org.scriptonbasestar.loader.source.file.JsonDirectoryRecordSourceProvider;
import org.scriptonbasestar.loader.spring.actuator.LoaderHealthIndicator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.Map;

/**
 * Spring Boot Auto-Configuration for the config loader.
 * <p>
 * Creates, unless the application defines its own:
 * <ul>
 *   <li>{@link ConnectorPool} from {@code sb-loader.connectors}, plus an in-process
 *   {@code *internal:*caches} group when a {@link CacheService} bean exists</li>
 *   <li>{@link DataStore} backed by {@link InternalDataDriver}</li>
 *   <li>{@link RecordSourceProvider} reading {@code sb-loader.data-path}, when set</li>
 *   <li>{@link LoaderMetrics} and the {@link Loader} itself</li>
 *   <li>{@link LoaderHealthIndicator} when Spring Boot Actuator is on the classpath</li>
 * </ul>
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 * @see LoaderProperties
 */
@Slf4j
@Configuration
@ConditionalOnClass(Loader.class)
@EnableConfigurationProperties(LoaderProperties.class)
public class LoaderAutoConfiguration {

	private final LoaderProperties properties;

	public LoaderAutoConfiguration(LoaderProperties properties) {
		this.properties = properties;
	}

	@Bean
	@ConditionalOnMissingBean
	public ConnectorPool loaderConnectorPool(ObjectProvider<CacheService> cacheService) {
		ConnectorOptions options = ConnectorOptions.builder()
			.connectTimeout(properties.getConnectTimeout())
			.replyTimeout(properties.getReplyTimeout())
			.acquireTimeout(properties.getAcquireTimeout())
			.internalCapacity(properties.getInternalCapacity())
			.build();
		ConnectorPool pool = new ConnectorPool(options);

		cacheService.ifAvailable(service -> {
			log.debug("Registering in-process cache service as {}", ConnectorGroups.INTERNAL_CACHES);
			pool.registerInternal(ConnectorGroups.INTERNAL_CACHES, CacheServiceEndpoint.of(service));
		});
		for (Map.Entry<String, LoaderProperties.ConnectorGroupConfig> entry : properties.getConnectors().entrySet()) {
			LoaderProperties.ConnectorGroupConfig config = entry.getValue();
			pool.registerRemote(entry.getKey(), config.transportKind(), config.getAddresses());
		}
		log.info("Connector pool registered groups {}", pool.registeredGroups());
		return pool;
	}

	@Bean
	@ConditionalOnMissingBean
	public DataStore loaderDataStore() {
		return new DataManager(new InternalDataDriver());
	}

	@Bean
	@ConditionalOnMissingBean
	public LoaderMetrics loaderMetrics() {
		return new LoaderMetrics();
	}

	@Bean
	@ConditionalOnMissingBean
	public Loader loader(DataStore dataStore, ConnectorPool connectorPool, LoaderMetrics loaderMetrics,
						 ObjectProvider<RecordSourceProvider> recordSourceProvider,
						 ObjectProvider<BatchListener> listeners,
						 ObjectProvider<MeterRegistry> meterRegistry) {
		Loader.Builder builder = Loader.builder()
			.loaderId(properties.getLoaderId())
			.dataStore(dataStore)
			.connectorPool(connectorPool)
			.cacheConns(properties.getCacheConns())
			.timezone(properties.getTimezone())
			.listener(loaderMetrics);

		RecordSourceProvider provider = recordSourceProvider.getIfAvailable();
		if (provider == null && properties.getDataPath() != null && !properties.getDataPath().isEmpty()) {
			provider = new JsonDirectoryRecordSourceProvider(Paths.get(properties.getDataPath()));
		}
		builder.recordSourceProvider(provider);

		listeners.orderedStream()
			.filter(listener -> listener != loaderMetrics)
			.forEach(builder::listener);

		meterRegistry.ifAvailable(registry -> {
			MicrometerBatchListener micrometer = new MicrometerBatchListener(registry);
			micrometer.bindGauges(loaderMetrics, properties.getLoaderId());
			builder.listener(micrometer);
		});

		return builder.build();
	}

	/**
	 * Only activated when Spring Boot Actuator is on the classpath.
	 */
	@Bean
	@ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
	@ConditionalOnMissingBean(name = "loaderHealthIndicator")
	public HealthIndicator loaderHealthIndicator(LoaderMetrics loaderMetrics, ConnectorPool connectorPool) {
		return new LoaderHealthIndicator(properties.getLoaderId(), loaderMetrics, connectorPool,
			properties.getHealth().getMaxFailureRate());
	}
}
