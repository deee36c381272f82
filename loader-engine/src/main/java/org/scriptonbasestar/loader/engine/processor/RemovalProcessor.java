package org.scriptonbasestar.loader.engine.processor;

import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.core.record.Record;
import org.scriptonbasestar.loader.core.store.DataStore;
import org.scriptonbasestar.loader.engine.dispatch.CacheDispatcher;
import org.scriptonbasestar.loader.engine.report.BatchListener;
import org.scriptonbasestar.loader.engine.report.BatchOperation;

import java.time.ZoneId;
import java.util.List;

/**
 * 레코드의 Tenant/ID 로 프로파일(과 런타임 항목)을 삭제하고 캐시 액션을 전송합니다.
 *
 * 없는 키 삭제는 성공으로 처리되며 캐시 액션도 그대로 전송됩니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class RemovalProcessor extends AbstractBatchProcessor<TenantID> {

	public RemovalProcessor(String loaderId, DataStore store, CacheDispatcher dispatcher,
							ZoneId zone, List<BatchListener> listeners) {
		super(loaderId, store, dispatcher, zone, listeners);
	}

	@Override
	protected BatchOperation operation() {
		return BatchOperation.REMOVAL;
	}

	@Override
	protected TenantID prepare(ProfileType type, Record record) {
		return record.tenantID();
	}

	@Override
	protected TenantID keyOf(TenantID tenantID) {
		return tenantID;
	}

	@Override
	protected void persist(ProfileType type, TenantID tenantID) {
		store.removeProfile(type, tenantID);
		if (type.isStateful()) {
			store.removeItem(type, tenantID);
		}
	}
}
