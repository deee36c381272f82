package org.scriptonbasestar.loader.connector.internal;

import org.junit.Test;
import org.scriptonbasestar.loader.connector.ConnectorGroups;
import org.scriptonbasestar.loader.connector.ConnectorOptions;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.connector.EchoArgs;
import org.scriptonbasestar.loader.connector.endpoint.MethodRegistry;
import org.scriptonbasestar.loader.connector.exception.RemoteCallException;
import org.scriptonbasestar.loader.connector.exception.TransportException;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-03
 */
public class InternalConnectorTest {

	private final MethodRegistry registry = new MethodRegistry()
		.register("EchoSv1.Echo", EchoArgs.class, args -> "echo:" + args.getText())
		.register("EchoSv1.Fail", EchoArgs.class, args -> {
			throw new IllegalStateException("SERVER_ERROR: " + args.getText());
		});

	@Test
	public void callsEndpointDirectly() {
		InternalConnector connector = new InternalConnector(registry, 1, Duration.ofSeconds(1));
		assertEquals("echo:hi", connector.call("EchoSv1.Echo", new EchoArgs("hi"), String.class));
		assertEquals(1, connector.availableHandles());
	}

	@Test
	public void handleIsReleasedWhenEndpointFails() {
		InternalConnector connector = new InternalConnector(registry, 1, Duration.ofMillis(100));
		try {
			connector.call("EchoSv1.Shout", new EchoArgs("hi"), String.class);
			fail("method not registered");
		} catch (UnsupportedServiceMethodException e) {
			assertEquals("EchoSv1.Shout", e.getServiceMethod());
		}
		assertEquals(1, connector.availableHandles());
		assertEquals("echo:again", connector.call("EchoSv1.Echo", new EchoArgs("again"), String.class));
	}

	@Test
	public void endpointFailureIsRemoteCallError() {
		InternalConnector connector = new InternalConnector(registry, 1, Duration.ofSeconds(1));
		try {
			connector.call("EchoSv1.Fail", new EchoArgs("boom"), String.class);
			fail("handler throws");
		} catch (RemoteCallException e) {
			assertEquals("EchoSv1.Fail", e.getServiceMethod());
			assertEquals("SERVER_ERROR: boom", e.getRemoteError());
			assertTrue(e.getCause() instanceof IllegalStateException);
		}
		assertEquals(1, connector.availableHandles());
	}

	@Test
	public void endpointFailureStopsPoolFailover() {
		// Given: 첫 그룹의 엔드포인트가 실패, 두 번째 그룹은 정상
		ConnectorPool pool = ConnectorPool.builder()
			.registerInternal(ConnectorGroups.INTERNAL_CACHES, (method, args) -> {
				throw new IllegalStateException("cache tier down");
			})
			.registerInternal("*internal:*backup", registry)
			.build();
		List<String> groups = Arrays.asList(ConnectorGroups.INTERNAL_CACHES, "*internal:*backup");

		// When / Then
		try {
			pool.call(groups, "EchoSv1.Echo", new EchoArgs("x"), String.class);
			fail("endpoint throws");
		} catch (TransportException e) {
			assertTrue(e instanceof RemoteCallException);
			assertEquals("cache tier down", ((RemoteCallException) e).getRemoteError());
		} finally {
			pool.close();
		}
	}

	@Test
	public void badArgumentsAreRemoteCallError() {
		InternalConnector connector = new InternalConnector(registry, 1, Duration.ofSeconds(1));
		try {
			connector.call("EchoSv1.Echo", Arrays.asList(1, 2), String.class);
			fail("arguments cannot be converted");
		} catch (RemoteCallException e) {
			assertEquals("EchoSv1.Echo", e.getServiceMethod());
			assertTrue(e.getCause() instanceof IllegalArgumentException);
		}
	}

	@Test
	public void secondCallerTimesOutWhileHandleIsBusy() throws Exception {
		// Given: 용량 1, 첫 호출이 핸들을 점유
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		MethodRegistry slow = new MethodRegistry().register("SlowSv1.Wait", EchoArgs.class, args -> {
			entered.countDown();
			try {
				release.await(5, TimeUnit.SECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			return "done";
		});
		InternalConnector connector = new InternalConnector(slow, 1, Duration.ofMillis(100));
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<String> first = executor.submit(() -> connector.call("SlowSv1.Wait", new EchoArgs(), String.class));
			assertTrue(entered.await(5, TimeUnit.SECONDS));

			// When / Then
			try {
				connector.call("SlowSv1.Wait", new EchoArgs(), String.class);
				fail("handle is busy");
			} catch (TransportException e) {
				assertTrue(e.getMessage().startsWith("No connector handle available"));
			}

			release.countDown();
			assertEquals("done", first.get(5, TimeUnit.SECONDS));
			assertEquals(1, connector.availableHandles());
		} finally {
			release.countDown();
			executor.shutdownNow();
		}
	}

	@Test
	public void poolRegistersInternalEndpoints() {
		ConnectorPool pool = ConnectorPool.builder()
			.options(ConnectorOptions.builder().internalCapacity(2).build())
			.registerInternal(ConnectorGroups.INTERNAL_CACHES, registry)
			.build();
		List<String> groups = Arrays.asList(ConnectorGroups.INTERNAL_CACHES);

		assertEquals("echo:pool", pool.call(groups, "EchoSv1.Echo", new EchoArgs("pool"), String.class));
		pool.close();
	}

	@Test
	public void leaseReturnsHandleOnce() {
		BoundedHandlePool<String> handles = new BoundedHandlePool<>(Arrays.asList("a", "b"));
		BoundedHandlePool.Lease<String> lease = handles.acquire(Duration.ofMillis(10));
		assertEquals(1, handles.available());

		lease.close();
		lease.close();

		assertEquals(2, handles.available());
		assertEquals(2, handles.capacity());
	}

	@Test(expected = IllegalStateException.class)
	public void releasedLeaseCannotBeUsed() {
		BoundedHandlePool<String> handles = new BoundedHandlePool<>(Arrays.asList("a"));
		BoundedHandlePool.Lease<String> lease = handles.acquire(Duration.ofMillis(10));
		lease.close();
		lease.get();
	}

	@Test(expected = IllegalArgumentException.class)
	public void capacityMustBePositive() {
		ConnectorOptions.builder().internalCapacity(0).build();
	}
}
