package org.scriptonbasestar.loader.core.record;

import org.junit.Test;
import org.scriptonbasestar.loader.core.exception.BuildException;
import org.scriptonbasestar.loader.core.model.TenantID;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-03
 */
public class RecordTest {

	@Test
	public void typedAccessorsConvertStringCells() {
		Record record = Record.builder()
			.put(Record.TENANT, "cgrates.org")
			.put(Record.ID, "P1")
			.put("Weight", "20")
			.put("MaxHits", "12")
			.put("Blocker", "true")
			.put("MinCost", "0.1")
			.put("MinSleep", "1s")
			.build();

		assertEquals(TenantID.of("cgrates.org", "P1"), record.tenantID());
		assertEquals(20.0, record.getDouble("Weight", 0), 0.0);
		assertEquals(12, record.getInt("MaxHits", 0));
		assertTrue(record.getBoolean("Blocker", false));
		assertEquals(new BigDecimal("0.1"), record.getDecimal("MinCost"));
		assertEquals(Duration.ofSeconds(1), record.getDuration("MinSleep"));
	}

	@Test
	public void nativeValuesPassThrough() {
		Record record = Record.builder()
			.put("Weight", 20)
			.put("Blocker", Boolean.TRUE)
			.put("FilterIDs", Arrays.asList("FLTR_1", " FLTR_2 "))
			.build();

		assertEquals(20.0, record.getDouble("Weight", 0), 0.0);
		assertTrue(record.getBoolean("Blocker", false));
		assertEquals(Arrays.asList("FLTR_1", "FLTR_2"), record.getList("FilterIDs"));
	}

	@Test
	public void missingValuesFallBackToDefaults() {
		Record record = Record.builder().put("Weight", "  ").build();

		assertFalse(record.has("Weight"));
		assertEquals(10.0, record.getDouble("Weight", 10), 0.0);
		assertEquals(Collections.emptyList(), record.getList("FilterIDs"));
		assertNull(record.getDuration("MinSleep"));
		assertNull(record.getTimeRange("ActivationInterval", ZoneOffset.UTC));
	}

	@Test
	public void listSplitsOnSeparator() {
		Record record = Record.builder().put("FilterIDs", "FLTR_1;;FLTR_2;").build();
		List<String> filters = record.getList("FilterIDs");
		assertEquals(Arrays.asList("FLTR_1", "FLTR_2"), filters);
	}

	@Test
	public void timeRangeReadsStartAndExpiry() {
		Record record = Record.builder()
			.put("ActivationInterval", "2014-07-14T14:25:00Z;2014-07-15T14:25:00Z")
			.build();

		Instant[] range = record.getTimeRange("ActivationInterval", ZoneOffset.UTC);
		assertEquals(Instant.parse("2014-07-14T14:25:00Z"), range[0]);
		assertEquals(Instant.parse("2014-07-15T14:25:00Z"), range[1]);
	}

	@Test
	public void missingMandatoryFieldNamesTheField() {
		Record record = Record.builder().put(Record.TENANT, "cgrates.org").build();
		try {
			record.tenantID();
			fail("ID is mandatory");
		} catch (BuildException e) {
			assertEquals(Record.ID, e.getField());
			assertEquals("MANDATORY_IE_MISSING: [ID]", e.getMessage());
		}
	}

	@Test
	public void badNumberIsBuildError() {
		Record record = Record.builder().put("Weight", "heavy").build();
		try {
			record.getDouble("Weight", 0);
			fail("not a number");
		} catch (BuildException e) {
			assertEquals("Weight", e.getField());
			assertTrue(e.getCause() instanceof NumberFormatException);
		}
	}

	@Test
	public void integralNumbersConvertToInt() {
		Record record = Record.builder()
			.put("MaxHits", 12L)
			.put("MinHits", 3.0)
			.build();

		assertEquals(12, record.getInt("MaxHits", 0));
		assertEquals(3, record.getInt("MinHits", 0));
	}

	@Test
	public void fractionalNumberIsNotTruncated() {
		Record record = Record.builder().put("MaxHits", 2.5).build();
		try {
			record.getInt("MaxHits", 0);
			fail("2.5 is not an integer");
		} catch (BuildException e) {
			assertEquals("MaxHits", e.getField());
			assertTrue(e.getCause() instanceof ArithmeticException);
		}
	}

	@Test
	public void outOfRangeNumberDoesNotWrap() {
		Record record = Record.builder().put("QueueLength", 3_000_000_000L).build();
		try {
			record.getInt("QueueLength", 0);
			fail("does not fit in an int");
		} catch (BuildException e) {
			assertEquals("QueueLength", e.getField());
		}
	}

	@Test(expected = BuildException.class)
	public void nonFiniteNumberIsBuildError() {
		Record.builder().put("MaxHits", Double.NaN).build().getInt("MaxHits", 0);
	}

	@Test(expected = BuildException.class)
	public void badTimeIsBuildError() {
		Record.builder().put("ActivationInterval", "soon").build()
			.getTimeRange("ActivationInterval", ZoneOffset.UTC);
	}

	@Test(expected = UnsupportedOperationException.class)
	public void recordIsImmutable() {
		Record.builder().put("Weight", 1).build().asMap().put("Weight", 2);
	}
}
