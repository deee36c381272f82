/**
 * Spring Boot 자동 설정
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.loader.spring.boot.LoaderProperties} - {@code sb-loader.*} 설정</li>
 *   <li>{@link org.scriptonbasestar.loader.spring.boot.LoaderAutoConfiguration} - 커넥터 풀, 저장소, 로더 빈 생성</li>
 *   <li>{@link org.scriptonbasestar.loader.spring.boot.EnableConfigLoader} - 자동 설정 없이 명시적으로 활성화</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
package org.scriptonbasestar.loader.spring.boot;
