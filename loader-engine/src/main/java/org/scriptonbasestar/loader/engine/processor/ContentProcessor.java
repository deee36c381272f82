package org.scriptonbasestar.loader.engine.processor;

import org.scriptonbasestar.loader.core.model.Profile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.core.record.Record;
import org.scriptonbasestar.loader.core.store.DataStore;
import org.scriptonbasestar.loader.engine.builder.ProfileBuilders;
import org.scriptonbasestar.loader.engine.dispatch.CacheDispatcher;
import org.scriptonbasestar.loader.engine.report.BatchListener;
import org.scriptonbasestar.loader.engine.report.BatchOperation;

import java.time.ZoneId;
import java.util.List;

/**
 * 레코드로 프로파일을 생성해 저장하고 캐시 액션을 전송합니다.
 *
 * 상태를 가지는 타입은 프로파일 저장 후 새 런타임 항목도 저장합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class ContentProcessor extends AbstractBatchProcessor<Profile> {

	public ContentProcessor(String loaderId, DataStore store, CacheDispatcher dispatcher,
							ZoneId zone, List<BatchListener> listeners) {
		super(loaderId, store, dispatcher, zone, listeners);
	}

	@Override
	protected BatchOperation operation() {
		return BatchOperation.CONTENT;
	}

	@Override
	protected Profile prepare(ProfileType type, Record record) {
		return ProfileBuilders.forType(type).build(record, zone);
	}

	@Override
	protected TenantID keyOf(Profile profile) {
		return profile.getTenantID();
	}

	@Override
	protected void persist(ProfileType type, Profile profile) {
		store.setProfile(profile);
		profile.newRuntimeItem().ifPresent(store::setItem);
	}
}
