package org.scriptonbasestar.loader.core.source;

import org.scriptonbasestar.loader.core.record.Record;

import java.util.Arrays;
import java.util.Iterator;

/**
 * In-memory record source over an already materialised list of records.
 *
 * @author archmagece
 * @since 2025-03
 */
public class IterableRecordSource implements RecordSource {

	private final Iterator<Record> iterator;

	public IterableRecordSource(Iterable<Record> records) {
		if (records == null) {
			throw new IllegalArgumentException("records must not be null");
		}
		this.iterator = records.iterator();
	}

	public static IterableRecordSource of(Record... records) {
		return new IterableRecordSource(Arrays.asList(records));
	}

	@Override
	public Record next() {
		return iterator.hasNext() ? iterator.next() : null;
	}
}
