package org.scriptonbasestar.loader.engine.report;

/**
 * 배치 종료(성공/실패) 통지를 받습니다.
 *
 * 리스너 예외는 배치 결과에 영향을 주지 않고 로그만 남깁니다.
 *
 * @author archmagece
 * @since 2025-03
 */
@FunctionalInterface
public interface BatchListener {

	void onBatchCompleted(BatchReport report);
}
