package org.scriptonbasestar.loader.connector.endpoint;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link ServiceEndpoint} backed by a method name → handler table.
 * <p>
 * Arguments that arrive in a generic shape (maps decoded from JSON) are converted to the
 * handler's argument type with Jackson before the handler runs.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MethodRegistry registry = new MethodRegistry()
 *     .register("CacheSv1.ReloadCache", CacheReloadArgs.class, cacheService::reloadCache)
 *     .register("CacheSv1.Clear", CacheClearArgs.class, cacheService::clear);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
@Slf4j
public class MethodRegistry implements ServiceEndpoint {

	private final ObjectMapper objectMapper;
	private final Map<String, Handler<?>> handlers = new ConcurrentHashMap<>();

	public MethodRegistry() {
		this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
	}

	public MethodRegistry(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public <A> MethodRegistry register(String serviceMethod, Class<A> argType, Function<A, ?> handler) {
		if (serviceMethod == null || serviceMethod.isEmpty()) {
			throw new IllegalArgumentException("serviceMethod must not be empty");
		}
		if (argType == null || handler == null) {
			throw new IllegalArgumentException("argType and handler must not be null");
		}
		handlers.put(serviceMethod, new Handler<>(argType, handler));
		return this;
	}

	public Set<String> methods() {
		return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
	}

	@Override
	public Object serve(String serviceMethod, Object args) {
		Handler<?> handler = handlers.get(serviceMethod);
		if (handler == null) {
			log.trace("No handler for {}", serviceMethod);
			throw new UnsupportedServiceMethodException(serviceMethod);
		}
		return handler.invoke(args);
	}

	private final class Handler<A> {
		private final Class<A> argType;
		private final Function<A, ?> function;

		private Handler(Class<A> argType, Function<A, ?> function) {
			this.argType = argType;
			this.function = function;
		}

		private Object invoke(Object args) {
			A converted = args == null || argType.isInstance(args)
				? argType.cast(args)
				: objectMapper.convertValue(args, argType);
			return function.apply(converted);
		}
	}
}
