package org.scriptonbasestar.loader.engine.metrics;

import org.scriptonbasestar.loader.engine.processor.BatchState;
import org.scriptonbasestar.loader.engine.report.BatchListener;
import org.scriptonbasestar.loader.engine.report.BatchReport;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 로더 배치 통계
 *
 * 스레드 안전하며 오버헤드가 거의 없도록 AtomicLong을 사용합니다.
 * {@link BatchListener} 로 로더에 등록하면 배치마다 갱신됩니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class LoaderMetrics implements BatchListener {

	private final AtomicLong batchSuccessCount = new AtomicLong(0);
	private final AtomicLong batchFailureCount = new AtomicLong(0);
	private final AtomicLong recordCount = new AtomicLong(0);
	private final AtomicLong unsupportedMethodCount = new AtomicLong(0);
	private final AtomicLong cacheOutOfSyncCount = new AtomicLong(0);
	private final AtomicLong totalBatchTime = new AtomicLong(0);  // 나노초
	private final Map<BatchState, AtomicLong> failuresByState = new EnumMap<>(BatchState.class);

	public LoaderMetrics() {
		for (BatchState state : BatchState.values()) {
			failuresByState.put(state, new AtomicLong(0));
		}
	}

	@Override
	public void onBatchCompleted(BatchReport report) {
		recordCount.addAndGet(report.getRecords());
		totalBatchTime.addAndGet(report.getDuration().toNanos());
		if (report.isSuccess()) {
			batchSuccessCount.incrementAndGet();
			return;
		}
		batchFailureCount.incrementAndGet();
		failuresByState.get(report.getFailedState()).incrementAndGet();
		if (report.isUnsupportedServiceMethod()) {
			unsupportedMethodCount.incrementAndGet();
		}
		if (report.isCacheOutOfSync()) {
			cacheOutOfSyncCount.incrementAndGet();
		}
	}

	/**
	 * 총 배치 수 (성공 + 실패)
	 */
	public long batchCount() {
		return batchSuccessCount.get() + batchFailureCount.get();
	}

	public long batchSuccessCount() {
		return batchSuccessCount.get();
	}

	public long batchFailureCount() {
		return batchFailureCount.get();
	}

	/**
	 * 완료된 레코드 수 (실패한 배치에서 완료된 레코드 포함)
	 */
	public long recordCount() {
		return recordCount.get();
	}

	public long failureCount(BatchState state) {
		return failuresByState.get(state).get();
	}

	public long unsupportedMethodCount() {
		return unsupportedMethodCount.get();
	}

	/**
	 * 저장소에는 반영되었지만 캐시 통지에 실패한 배치 수
	 */
	public long cacheOutOfSyncCount() {
		return cacheOutOfSyncCount.get();
	}

	/**
	 * 배치 실패율
	 *
	 * @return 실패율 (0.0 ~ 1.0), 배치가 없으면 0.0
	 */
	public double failureRate() {
		long batches = batchCount();
		return batches == 0 ? 0.0 : (double) batchFailureCount.get() / batches;
	}

	/**
	 * 평균 배치 처리 시간 (나노초), 배치가 없으면 0.0
	 */
	public double averageBatchTime() {
		long batches = batchCount();
		return batches == 0 ? 0.0 : (double) totalBatchTime.get() / batches;
	}

	public void reset() {
		batchSuccessCount.set(0);
		batchFailureCount.set(0);
		recordCount.set(0);
		unsupportedMethodCount.set(0);
		cacheOutOfSyncCount.set(0);
		totalBatchTime.set(0);
		for (AtomicLong counter : failuresByState.values()) {
			counter.set(0);
		}
	}

	@Override
	public String toString() {
		return String.format(
			"LoaderMetrics{batches=%d, success=%d, failure=%d, failureRate=%.2f%%, records=%d, " +
			"unsupported=%d, cacheOutOfSync=%d, avgBatchTime=%.2fms}",
			batchCount(),
			batchSuccessCount(),
			batchFailureCount(),
			failureRate() * 100,
			recordCount(),
			unsupportedMethodCount(),
			cacheOutOfSyncCount(),
			averageBatchTime() / 1_000_000  // 나노초 → 밀리초
		);
	}
}
