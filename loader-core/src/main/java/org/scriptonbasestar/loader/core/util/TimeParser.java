package org.scriptonbasestar.loader.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 레코드 값의 날짜/시간, 기간 변환 유틸리티
 *
 * 오프셋이 없는 날짜/시간 값은 설정된 타임존으로 해석합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
@Slf4j
@UtilityClass
public class TimeParser {

	public static final String LOCAL = "Local";
	public static final String NOW = "*now";
	public static final String UNLIMITED = "*unlimited";

	private static final DateTimeFormatter SPACED_LOCAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
	private static final Pattern EPOCH = Pattern.compile("^\\d+$");
	private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

	/**
	 * 타임존 설정 값을 해석합니다. 비어있거나 {@code Local} 이면 시스템 기본값을 사용합니다.
	 *
	 * @param timezone 설정 값 (예: "UTC", "Europe/Berlin", "Local")
	 * @return ZoneId
	 */
	public static ZoneId zone(String timezone) {
		if (timezone == null || timezone.isEmpty() || LOCAL.equalsIgnoreCase(timezone)) {
			return ZoneId.systemDefault();
		}
		return ZoneId.of(timezone);
	}

	/**
	 * 날짜/시간 문자열을 Instant로 변환합니다.
	 *
	 * 지원 형식: epoch 초, ISO-8601 오프셋 포함, {@code yyyy-MM-ddTHH:mm:ss},
	 * {@code yyyy-MM-dd HH:mm:ss}, {@code yyyy-MM-dd}, {@code *now}
	 *
	 * @param value 변환할 값
	 * @param zone 오프셋 없는 값에 적용할 타임존
	 * @return 변환된 Instant, 빈 값이면 null
	 * @throws DateTimeParseException 지원하지 않는 형식
	 */
	public static Instant parseTime(String value, ZoneId zone) {
		if (value == null || value.isEmpty()) {
			return null;
		}
		if (NOW.equals(value)) {
			return Instant.now();
		}
		if (EPOCH.matcher(value).matches()) {
			return Instant.ofEpochSecond(Long.parseLong(value));
		}
		try {
			return OffsetDateTime.parse(value).toInstant();
		} catch (DateTimeParseException e) {
			log.trace("not an offset date-time: {}", value);
		}
		try {
			return LocalDateTime.parse(value).atZone(zone).toInstant();
		} catch (DateTimeParseException e) {
			log.trace("not an ISO local date-time: {}", value);
		}
		try {
			return LocalDateTime.parse(value, SPACED_LOCAL).atZone(zone).toInstant();
		} catch (DateTimeParseException e) {
			log.trace("not a spaced local date-time: {}", value);
		}
		return LocalDate.parse(value).atStartOfDay(zone).toInstant();
	}

	/**
	 * 기간 문자열을 변환합니다.
	 *
	 * {@code 1h30m}, {@code 10s}, {@code 250ms} 형식과 나노초 단위 정수를 지원합니다.
	 * {@code *unlimited} 는 -1 나노초로 표현합니다.
	 *
	 * @param value 변환할 값
	 * @return Duration, 빈 값이면 null
	 * @throws IllegalArgumentException 지원하지 않는 형식
	 */
	public static Duration parseDuration(String value) {
		if (value == null || value.isEmpty()) {
			return null;
		}
		if (UNLIMITED.equals(value)) {
			return Duration.ofNanos(-1);
		}
		if (EPOCH.matcher(value).matches()) {
			return Duration.ofNanos(Long.parseLong(value));
		}
		Matcher matcher = DURATION_PART.matcher(value);
		Duration total = Duration.ZERO;
		int consumed = 0;
		while (matcher.find()) {
			if (matcher.start() != consumed) {
				break;
			}
			total = total.plus(toDuration(Double.parseDouble(matcher.group(1)), matcher.group(2)));
			consumed = matcher.end();
		}
		if (consumed != value.length() || consumed == 0) {
			throw new IllegalArgumentException("Invalid duration: " + value);
		}
		return total;
	}

	private static Duration toDuration(double amount, String unit) {
		switch (unit) {
			case "ns":
				return Duration.ofNanos((long) amount);
			case "us":
			case "µs":
				return Duration.ofNanos((long) (amount * 1_000L));
			case "ms":
				return Duration.ofNanos((long) (amount * 1_000_000L));
			case "s":
				return Duration.ofNanos((long) (amount * 1_000_000_000L));
			case "m":
				return Duration.ofNanos((long) (amount * 60_000_000_000L));
			default:
				return Duration.ofNanos((long) (amount * 3_600_000_000_000L));
		}
	}
}
