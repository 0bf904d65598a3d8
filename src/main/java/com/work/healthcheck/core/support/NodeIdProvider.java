package com.work.healthcheck.core.support;

/**
 * 提供节点稳定标识，用于 rendezvous 成员登记与日志标记。
 */
public interface NodeIdProvider {
    String getNodeId();
}
