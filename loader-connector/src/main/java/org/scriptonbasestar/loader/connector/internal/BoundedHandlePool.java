package org.scriptonbasestar.loader.connector.internal;

import org.scriptonbasestar.loader.connector.exception.TransportException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed number of handles handed out as scoped leases.
 * <p>
 * {@link #acquire} blocks up to the timeout when every handle is out; closing the
 * {@link Lease} returns the handle, so try-with-resources releases it on every exit path.
 * </p>
 *
 * <pre>{@code
 * try (BoundedHandlePool.Lease<ServiceEndpoint> lease = pool.acquire(Duration.ofSeconds(2))) {
 *     return lease.get().serve(method, args);
 * }
 * }</pre>
 *
 * @param <T> handle type
 * @author archmagece
 * @since 2025-03
 */
public class BoundedHandlePool<T> {

	private final BlockingQueue<T> handles;
	private final int capacity;

	public BoundedHandlePool(List<T> handles) {
		if (handles == null || handles.isEmpty()) {
			throw new IllegalArgumentException("handle pool needs at least one handle");
		}
		this.capacity = handles.size();
		this.handles = new ArrayBlockingQueue<>(capacity, false, handles);
	}

	/**
	 * @throws TransportException no handle became free within the timeout, or the wait was interrupted
	 */
	public Lease<T> acquire(Duration timeout) {
		T handle;
		try {
			handle = handles.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransportException("Interrupted while waiting for a connector handle", e);
		}
		if (handle == null) {
			throw new TransportException("No connector handle available within " + timeout);
		}
		return new Lease<>(this, handle);
	}

	public int available() {
		return handles.size();
	}

	public int capacity() {
		return capacity;
	}

	private void release(T handle) {
		handles.offer(handle);
	}

	/**
	 * 빌린 핸들. close 시 풀로 반환되며 두 번 반환되지 않습니다.
	 */
	public static final class Lease<T> implements AutoCloseable {
		private final BoundedHandlePool<T> owner;
		private final T handle;
		private boolean released;

		private Lease(BoundedHandlePool<T> owner, T handle) {
			this.owner = owner;
			this.handle = handle;
		}

		public T get() {
			if (released) {
				throw new IllegalStateException("lease already released");
			}
			return handle;
		}

		@Override
		public void close() {
			if (!released) {
				released = true;
				owner.release(handle);
			}
		}
	}
}
