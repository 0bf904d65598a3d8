package com.work.healthcheck.core.collective;

import com.work.healthcheck.core.store.BootstrapStore;

/**
 * 基于（已带命名空间的）store 建立通信组。该调用是组内所有成员的阻塞 rendezvous，
 * 有成员缺席时抛出 {@link com.work.healthcheck.core.exception.HealthcheckException}。
 */
public interface CommunicationGroupFactory {

    CommunicationGroup connect(BootstrapStore store, int groupRank, int groupSize);
}
