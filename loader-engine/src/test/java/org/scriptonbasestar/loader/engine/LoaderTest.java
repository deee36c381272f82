package org.scriptonbasestar.loader.engine;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.loader.connector.ConnectorGroups;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.connector.TransportKind;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;
import org.scriptonbasestar.loader.connector.rpc.JsonRpcCodec;
import org.scriptonbasestar.loader.connector.rpc.RpcServer;
import org.scriptonbasestar.loader.core.model.AttributeProfile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.RateProfile;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.core.record.Record;
import org.scriptonbasestar.loader.core.source.IterableRecordSource;
import org.scriptonbasestar.loader.core.source.RecordSource;
import org.scriptonbasestar.loader.core.store.DataManager;
import org.scriptonbasestar.loader.core.store.InternalDataDriver;
import org.scriptonbasestar.loader.engine.dispatch.CacheMethods;
import org.scriptonbasestar.loader.engine.dispatch.CacheReloadArgs;
import org.scriptonbasestar.loader.engine.dispatch.CacheServiceEndpoint;
import org.scriptonbasestar.loader.engine.metrics.LoaderMetrics;
import org.scriptonbasestar.loader.engine.report.BatchReport;

import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-03
 */
public class LoaderTest {

	private static final TenantID MOCK_RELOAD_ID = TenantID.of("cgrates.org", "MOCK_RELOAD_ID");

	private RecordingCacheService cacheService;
	private ConnectorPool pool;
	private DataManager store;
	private LoaderMetrics metrics;

	@Before
	public void setUp() {
		cacheService = new RecordingCacheService();
		pool = new ConnectorPool()
			.registerInternal(ConnectorGroups.INTERNAL_CACHES, CacheServiceEndpoint.of(cacheService));
		store = new DataManager(new InternalDataDriver());
		metrics = new LoaderMetrics();
	}

	@After
	public void tearDown() {
		pool.close();
	}

	private Loader loader(String cacheConn) {
		return Loader.builder()
			.loaderId("TestLoader")
			.dataStore(store)
			.connectorPool(pool)
			.cacheConns(Collections.singletonList(cacheConn))
			.timezone("UTC")
			.recordSourceProvider(type -> IterableRecordSource.of(rateProfile()))
			.listener(metrics)
			.build();
	}

	private static Record rateProfile() {
		return Record.builder()
			.put("Tenant", "cgrates.org")
			.put("ID", "MOCK_RELOAD_ID")
			.put("Weight", 20)
			.build();
	}

	@Test
	public void loadStoresRateProfileAndLoadsCache() {
		BatchReport report = loader(ConnectorGroups.INTERNAL_CACHES).processContent(ProfileType.RATE_PROFILES, "*load");

		assertTrue(report.isSuccess());
		RateProfile stored = (RateProfile) store.getProfile(ProfileType.RATE_PROFILES, MOCK_RELOAD_ID);
		assertEquals(MOCK_RELOAD_ID, stored.getTenantID());
		assertEquals(20.0, stored.getWeight(), 0.0);

		assertEquals(Collections.singletonList(CacheMethods.LOAD_CACHE), cacheService.getMethods());
		CacheReloadArgs args = (CacheReloadArgs) cacheService.lastArgs();
		assertEquals("cgrates.org", args.getTenant());
		assertEquals(Collections.singletonList("cgrates.org:MOCK_RELOAD_ID"), args.getArgsCache().get("*rate_profiles"));
	}

	@Test
	public void unregisteredGroupKeepsStoreWrite() {
		try {
			loader(ConnectorGroups.INTERNAL).processContent(ProfileType.RATE_PROFILES, "*load");
			fail("*internal is not registered");
		} catch (UnsupportedServiceMethodException e) {
			assertEquals(UnsupportedServiceMethodException.MESSAGE, e.getMessage());
			assertEquals(Collections.singletonList(ConnectorGroups.INTERNAL), e.getConnectorGroups());
		}
		RateProfile stored = (RateProfile) store.getProfile(ProfileType.RATE_PROFILES, MOCK_RELOAD_ID);
		assertEquals(20.0, stored.getWeight(), 0.0);
		assertEquals(1, metrics.unsupportedMethodCount());
		assertEquals(1, metrics.cacheOutOfSyncCount());
	}

	@Test
	public void attributesRemovedTwice() {
		Loader loader = loader(ConnectorGroups.INTERNAL_CACHES);
		Record attribute = Record.builder()
			.put("Tenant", "cgrates.org")
			.put("ID", "MOCK_RELOAD_ID")
			.put("Contexts", "*sessions")
			.put("Path", "*req.Account")
			.put("Type", "*constant")
			.put("Value", "1001")
			.build();
		loader.processContent(ProfileType.ATTRIBUTES, "*reload", IterableRecordSource.of(attribute));
		assertTrue(store.getProfile(ProfileType.ATTRIBUTES, MOCK_RELOAD_ID) instanceof AttributeProfile);

		Record key = Record.builder().put("Tenant", "cgrates.org").put("ID", "MOCK_RELOAD_ID").build();
		assertTrue(loader.removeContent(ProfileType.ATTRIBUTES, "*remove", IterableRecordSource.of(key)).isSuccess());
		assertTrue(loader.removeContent(ProfileType.ATTRIBUTES, "*remove", IterableRecordSource.of(key)).isSuccess());

		assertNull(store.getProfile(ProfileType.ATTRIBUTES, MOCK_RELOAD_ID));
		assertEquals(3, cacheService.getMethods().size());
		assertEquals(3, metrics.batchSuccessCount());
	}

	@Test
	public void loaderTypeTag() {
		BatchReport report = loader(ConnectorGroups.INTERNAL_CACHES).processContent("*rate_profiles", "*none");

		assertEquals(ProfileType.RATE_PROFILES, report.getProfileType());
		assertNotNull(store.getProfile(ProfileType.RATE_PROFILES, MOCK_RELOAD_ID));
		assertTrue(cacheService.getMethods().isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownLoaderTypeTag() {
		loader(ConnectorGroups.INTERNAL_CACHES).removeContent("*destinations", "*none");
	}

	@Test(expected = IllegalStateException.class)
	public void noRecordSourceProvider() {
		Loader.builder()
			.dataStore(store)
			.connectorPool(pool)
			.build()
			.processContent(ProfileType.RATE_PROFILES, "*none");
	}

	@Test(expected = IllegalArgumentException.class)
	public void dataStoreIsMandatory() {
		Loader.builder().connectorPool(pool).build();
	}

	@Test
	public void builderDefaults() {
		Loader loader = Loader.builder().dataStore(store).connectorPool(pool).timezone("Europe/Berlin").build();

		assertEquals("*default", loader.getLoaderId());
		assertEquals(ZoneId.of("Europe/Berlin"), loader.getTimezone());
		assertTrue(loader.getCacheConns().isEmpty());
		assertSame(store, loader.getDataStore());
		assertSame(pool, loader.getConnectorPool());
	}

	@Test
	public void sameTypeBatchesAreSerialized() throws Exception {
		Loader loader = loader(ConnectorGroups.INTERNAL_CACHES);
		CountDownLatch firstStarted = new CountDownLatch(1);
		CountDownLatch releaseFirst = new CountDownLatch(1);
		AtomicBoolean secondStarted = new AtomicBoolean(false);

		RecordSource blocking = new RecordSource() {
			private boolean done;

			@Override
			public Record next() {
				if (done) {
					return null;
				}
				done = true;
				firstStarted.countDown();
				try {
					releaseFirst.await(5, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return rateProfile();
			}
		};
		RecordSource second = () -> {
			secondStarted.set(true);
			return null;
		};

		Thread first = new Thread(() -> loader.processContent(ProfileType.RATE_PROFILES, "*none", blocking));
		first.start();
		assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

		Thread sameType = new Thread(() -> loader.processContent(ProfileType.RATE_PROFILES, "*none", second));
		sameType.start();

		// 다른 타입은 대기하지 않음
		assertTrue(loader.processContent(ProfileType.CHARGERS, "*none", IterableRecordSource.of()).isSuccess());

		Thread.sleep(200);
		assertFalse(secondStarted.get());

		releaseFirst.countDown();
		first.join(5000);
		sameType.join(5000);
		assertTrue(secondStarted.get());
	}

	@Test
	public void reloadOverJsonRpc() throws Exception {
		try (RpcServer server = new RpcServer(CacheServiceEndpoint.of(cacheService), new JsonRpcCodec())) {
			String group = ConnectorGroups.concat("*remote", ConnectorGroups.CACHES);
			pool.registerRemote(group, TransportKind.JSON, Collections.singletonList(server.getAddress()));

			Record threshold = Record.builder()
				.put("Tenant", "cgrates.org")
				.put("ID", "TH_REMOTE")
				.put("FilterIDs", "FLTR_1;FLTR_2")
				.build();
			BatchReport report = loader(group)
				.processContent(ProfileType.THRESHOLDS, "*reload", IterableRecordSource.of(threshold));

			assertTrue(report.isSuccess());
			assertEquals(1, server.getServedCount());
			CacheReloadArgs args = (CacheReloadArgs) cacheService.lastArgs();
			List<String> keys = args.getArgsCache().get("*threshold_profiles");
			assertEquals(Collections.singletonList("cgrates.org:TH_REMOTE"), keys);
			assertEquals(Collections.singletonList("cgrates.org:TH_REMOTE"), args.getArgsCache().get("*thresholds"));
		}
	}
}
