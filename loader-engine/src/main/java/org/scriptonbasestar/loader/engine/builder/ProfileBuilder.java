package org.scriptonbasestar.loader.engine.builder;

import org.scriptonbasestar.loader.core.exception.BuildException;
import org.scriptonbasestar.loader.core.model.Profile;
import org.scriptonbasestar.loader.core.record.Record;

import java.time.ZoneId;

/**
 * 레코드 하나를 프로파일로 변환합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
@FunctionalInterface
public interface ProfileBuilder {

	/**
	 * @param record source row
	 * @param zone timezone for date fields without offset
	 * @throws BuildException missing mandatory field or unconvertible value
	 */
	Profile build(Record record, ZoneId zone) throws BuildException;
}
