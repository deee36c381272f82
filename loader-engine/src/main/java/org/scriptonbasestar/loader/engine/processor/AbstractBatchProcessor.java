package org.scriptonbasestar.loader.engine.processor;

import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.core.record.Record;
import org.scriptonbasestar.loader.core.source.RecordSource;
import org.scriptonbasestar.loader.core.store.DataStore;
import org.scriptonbasestar.loader.engine.dispatch.CacheDispatcher;
import org.scriptonbasestar.loader.engine.report.BatchListener;
import org.scriptonbasestar.loader.engine.report.BatchOperation;
import org.scriptonbasestar.loader.engine.report.BatchReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;

/**
 * Record-by-record batch skeleton shared by the content and removal processors.
 * <p>
 * Per record: {@link #prepare} ({@link BatchState#BUILDING}), {@link #persist}
 * ({@link BatchState#PERSISTED}), then the cache action for the record's key
 * ({@link BatchState#CACHE_NOTIFIED}). The first failure stops the batch; earlier records
 * stay applied and the original exception reaches the caller after the
 * {@link BatchReport} has been published.
 * </p>
 *
 * @param <T> what {@link #prepare} hands to {@link #persist}
 * @author archmagece
 * @since 2025-03
 */
public abstract class AbstractBatchProcessor<T> {

	private static final Logger log = LoggerFactory.getLogger(AbstractBatchProcessor.class);

	protected final String loaderId;
	protected final DataStore store;
	protected final CacheDispatcher dispatcher;
	protected final ZoneId zone;
	private final List<BatchListener> listeners;

	protected AbstractBatchProcessor(String loaderId, DataStore store, CacheDispatcher dispatcher,
									 ZoneId zone, List<BatchListener> listeners) {
		if (store == null || dispatcher == null) {
			throw new IllegalArgumentException("store and dispatcher must not be null");
		}
		this.loaderId = loaderId;
		this.store = store;
		this.dispatcher = dispatcher;
		this.zone = zone == null ? ZoneId.systemDefault() : zone;
		this.listeners = listeners == null ? Collections.emptyList() : List.copyOf(listeners);
	}

	protected abstract BatchOperation operation();

	/**
	 * Converts a record into the unit {@link #persist} applies.
	 */
	protected abstract T prepare(ProfileType type, Record record);

	protected abstract TenantID keyOf(T prepared);

	/**
	 * Applies the prepared unit to the store.
	 */
	protected abstract void persist(ProfileType type, T prepared);

	/**
	 * Runs one batch to completion or to its first failure.
	 *
	 * @return report of the successful batch
	 * @throws RuntimeException the first build, source, store or dispatch failure, unchanged
	 */
	public BatchReport process(ProfileType type, String cacheAction, RecordSource source) {
		if (type == null || source == null) {
			throw new IllegalArgumentException("type and source must not be null");
		}
		long started = System.nanoTime();
		BatchState state = BatchState.IDLE;
		TenantID key = null;
		int records = 0;
		log.debug("Loader {} starting {} batch for {} with cache action {}", loaderId, operation().getTag(), type, cacheAction);
		try (RecordSource batch = source) {
			while (true) {
				state = BatchState.BUILDING;
				key = null;
				Record record = batch.next();
				if (record == null) {
					break;
				}
				T prepared = prepare(type, record);
				key = keyOf(prepared);

				state = BatchState.PERSISTED;
				persist(type, prepared);

				state = BatchState.CACHE_NOTIFIED;
				dispatcher.dispatch(type, cacheAction, Collections.singletonList(key));

				records++;
				log.trace("Loader {} {} {} {} done", loaderId, operation().getTag(), type, key);
			}
			state = BatchState.IDLE;
		} catch (RuntimeException e) {
			BatchReport report = report(type, cacheAction, records, started)
				.failure(state, key, e)
				.build();
			log.warn("Loader {} {} batch for {} failed in state {} at {} after {} record(s), cache action {}, cache connectors {}: {}",
				loaderId, operation().getTag(), type, state, key, records, cacheAction, dispatcher.getCacheConns(), e.toString());
			publish(report);
			throw e;
		}
		BatchReport report = report(type, cacheAction, records, started).build();
		log.debug("Loader {} finished {} batch for {}: {} record(s) in {}", loaderId, operation().getTag(), type, records, report.getDuration());
		publish(report);
		return report;
	}

	private BatchReport.Builder report(ProfileType type, String cacheAction, int records, long started) {
		return BatchReport.builder()
			.loaderId(loaderId)
			.operation(operation())
			.profileType(type)
			.cacheAction(cacheAction)
			.cacheConns(dispatcher.getCacheConns())
			.records(records)
			.duration(Duration.ofNanos(System.nanoTime() - started));
	}

	private void publish(BatchReport report) {
		for (BatchListener listener : listeners) {
			try {
				listener.onBatchCompleted(report);
			} catch (RuntimeException e) {
				log.error("Batch listener {} failed for {}", listener, report, e);
			}
		}
	}
}
