/**
 * 배치 프로세서
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.loader.engine.processor.ContentProcessor} - 생성 후 저장, 캐시 액션 전송</li>
 *   <li>{@link org.scriptonbasestar.loader.engine.processor.RemovalProcessor} - 삭제 후 캐시 액션 전송</li>
 *   <li>{@link org.scriptonbasestar.loader.engine.processor.BatchState} - 실패한 단계 식별</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.engine.processor;
