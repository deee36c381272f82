/**
 * 레코드 소스 계약
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.loader.core.source.RecordSource} - 배치 단위 단일 패스 레코드 스트림</li>
 *   <li>{@link org.scriptonbasestar.loader.core.source.RecordSourceProvider} - 프로파일 타입별 소스 생성</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.core.source;
