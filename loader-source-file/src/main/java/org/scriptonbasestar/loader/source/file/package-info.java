/**
 * 파일 기반 레코드 소스
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.loader.source.file.JsonRecordSource} - JSON 배열 파일을 레코드 단위로 스트리밍</li>
 *   <li>{@link org.scriptonbasestar.loader.source.file.JsonDirectoryRecordSourceProvider} - 타입별 {@code <SourceName>.json} 매핑</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.source.file;
