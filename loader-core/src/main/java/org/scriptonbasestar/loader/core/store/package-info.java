/**
 * 저장소 계약과 기본 구현
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.loader.core.store.DataStore} - 로더가 사용하는 저장소 계약</li>
 *   <li>{@link org.scriptonbasestar.loader.core.store.DataManager} - 필터 인덱스를 관리하는 기본 저장소</li>
 *   <li>{@link org.scriptonbasestar.loader.core.store.DataDriver} - 실제 저장 SPI</li>
 *   <li>{@link org.scriptonbasestar.loader.core.store.InternalDataDriver} - 메모리 기반 드라이버</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.core.store;
