package com.work.healthcheck.core.support;

import java.net.InetAddress;
import java.util.UUID;

/**
 * 默认 nodeId 生成方式：hostname + pid + 随机后缀。
 * 生产可替换为调度系统下发的 podName / instanceId 等稳定标识。
 */
public class SimpleNodeIdProvider implements NodeIdProvider {

    private final String nodeId;

    public SimpleNodeIdProvider() {
        this.nodeId = buildNodeId();
    }

    @Override
    public String getNodeId() {
        return nodeId;
    }

    private String buildNodeId() {
        String suffix = ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            return hostname + "-" + suffix;
        } catch (Exception e) {
            return "unknown-" + suffix;
        }
    }
}
