/**
 * 커넥터 풀
 *
 * <p>이름 있는 커넥터 그룹을 지연 생성하고, 서비스 메서드 단위로 그룹 간 failover 합니다.</p>
 *
 * <h3>주요 클래스</h3>
 * <ul>
 *   <li>{@link org.scriptonbasestar.loader.connector.ConnectorPool} - 그룹 등록, 지연 생성, 순차 failover 호출</li>
 *   <li>{@link org.scriptonbasestar.loader.connector.Connector} - 단일 원격 호출 계약</li>
 *   <li>{@link org.scriptonbasestar.loader.connector.TransportKind} - {@code *json}, {@code *gob}, {@code *internal}</li>
 *   <li>{@link org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException} - 메서드 미지원 신호</li>
 * </ul>
 *
 * <h3>사용 예시</h3>
 * <pre>{@code
 * ConnectorPool pool = ConnectorPool.builder()
 *     .registerInternal(ConnectorGroups.INTERNAL_CACHES, CacheServiceEndpoint.of(cacheService))
 *     .registerRemote("*remote:*caches", TransportKind.JSON, List.of("10.0.0.10:2012"))
 *     .build();
 *
 * String reply = pool.call(List.of("*internal:*caches", "*remote:*caches"),
 *     "CacheSv1.ReloadCache", args, String.class);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.connector;
