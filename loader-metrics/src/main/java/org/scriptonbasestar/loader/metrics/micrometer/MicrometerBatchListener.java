package org.scriptonbasestar.loader.metrics.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.scriptonbasestar.loader.engine.metrics.LoaderMetrics;
import org.scriptonbasestar.loader.engine.report.BatchListener;
import org.scriptonbasestar.loader.engine.report.BatchReport;

/**
 * 배치 결과를 Micrometer 메트릭으로 기록하는 {@link BatchListener}
 *
 * <ul>
 *   <li>{@code loader.batches} - 배치 수 (loader, type, operation, result)</li>
 *   <li>{@code loader.records} - 완료된 레코드 수 (loader, type, operation)</li>
 *   <li>{@code loader.batch.duration} - 배치 처리 시간 (loader, type, operation, result)</li>
 *   <li>{@code loader.batch.failures} - 실패 배치 수 (loader, type, operation, state)</li>
 * </ul>
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * Loader loader = Loader.builder()
 *     ...
 *     .listener(new MicrometerBatchListener(registry))
 *     .build();
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
public class MicrometerBatchListener implements BatchListener {

	public static final String BATCHES = "loader.batches";
	public static final String RECORDS = "loader.records";
	public static final String BATCH_DURATION = "loader.batch.duration";
	public static final String BATCH_FAILURES = "loader.batch.failures";

	public static final String RESULT_SUCCESS = "success";
	public static final String RESULT_FAILURE = "failure";

	private final MeterRegistry meterRegistry;

	/**
	 * @param meterRegistry Micrometer 레지스트리
	 */
	public MicrometerBatchListener(MeterRegistry meterRegistry) {
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		this.meterRegistry = meterRegistry;
	}

	@Override
	public void onBatchCompleted(BatchReport report) {
		Tags batchTags = Tags.of(
			"loader", report.getLoaderId(),
			"type", report.getProfileType().getTag(),
			"operation", report.getOperation().getTag());
		Tags resultTags = batchTags.and("result", report.isSuccess() ? RESULT_SUCCESS : RESULT_FAILURE);

		Counter.builder(BATCHES)
			.tags(resultTags)
			.description("Loader batch count")
			.register(meterRegistry)
			.increment();

		Counter.builder(RECORDS)
			.tags(batchTags)
			.description("Records stored and propagated to the cache tier")
			.register(meterRegistry)
			.increment(report.getRecords());

		Timer.builder(BATCH_DURATION)
			.tags(resultTags)
			.description("Loader batch duration")
			.register(meterRegistry)
			.record(report.getDuration());

		if (!report.isSuccess()) {
			Counter.builder(BATCH_FAILURES)
				.tags(batchTags.and("state", report.getFailedState().name()))
				.description("Failed loader batches by the step that failed")
				.register(meterRegistry)
				.increment();
		}
	}

	/**
	 * {@link LoaderMetrics} 의 누적 값을 Gauge 로 노출합니다.
	 *
	 * @param loaderMetrics 로더 메트릭
	 * @param loaderId 태그로 사용할 로더 ID
	 */
	public void bindGauges(LoaderMetrics loaderMetrics, String loaderId) {
		if (loaderMetrics == null) {
			throw new IllegalArgumentException("LoaderMetrics must not be null");
		}
		Tags tags = Tags.of("loader", loaderId);
		meterRegistry.gauge("loader.failure.rate", tags, loaderMetrics, LoaderMetrics::failureRate);
		meterRegistry.gauge("loader.cache.out_of_sync", tags, loaderMetrics, m -> (double) m.cacheOutOfSyncCount());
		meterRegistry.gauge("loader.unsupported.methods", tags, loaderMetrics, m -> (double) m.unsupportedMethodCount());
	}

	public MeterRegistry getMeterRegistry() {
		return meterRegistry;
	}
}
