/**
 * Spring Boot Actuator 연동
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.loader.spring.actuator.LoaderHealthIndicator} - 배치 실패율 기반 UP/DOWN, 커넥터 그룹 상세</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.spring.actuator;
