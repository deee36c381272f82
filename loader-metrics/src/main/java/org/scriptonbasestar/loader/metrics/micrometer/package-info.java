/**
 * Micrometer 연동
 *
 * <p>{@link org.scriptonbasestar.loader.metrics.micrometer.MicrometerBatchListener} 를 로더에
 * 리스너로 등록하면 배치마다 카운터와 타이머가 갱신됩니다.</p>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.metrics.micrometer;
