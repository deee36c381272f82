package org.scriptonbasestar.loader.spring.boot;

import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables the config loader without Spring Boot auto-configuration.
 *
 * <h3>Basic Usage:</h3>
 * <pre>{@code
 * @Configuration
 * @EnableConfigLoader
 * public class LoaderConfig {
 *     @Bean
 *     public CacheService cacheService() {
 *         return new MyCacheService();
 *     }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 * @see LoaderAutoConfiguration
 * @see LoaderProperties
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(LoaderAutoConfiguration.class)
public @interface EnableConfigLoader {
}
