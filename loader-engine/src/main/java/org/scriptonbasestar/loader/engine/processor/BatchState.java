package org.scriptonbasestar.loader.engine.processor;

/**
 * Step a batch is in; a failure reports the step it failed in.
 * <p>
 * {@code IDLE → BUILDING → PERSISTED → CACHE_NOTIFIED → IDLE}, once per record.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public enum BatchState {
	/** 배치 시작 전 / 종료 후 */
	IDLE,
	/** 레코드 읽기와 프로파일 생성 */
	BUILDING,
	/** 저장소 반영 */
	PERSISTED,
	/** 캐시 액션 전송 */
	CACHE_NOTIFIED
}
