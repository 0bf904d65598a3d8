package com.work.healthcheck.demo.config;

import com.work.healthcheck.core.collective.ExecutionContextFactory;
import com.work.healthcheck.core.collective.StoreCommunicationGroupFactory;
import com.work.healthcheck.core.config.HealthcheckConfig;
import com.work.healthcheck.core.engine.HaltProcessTerminator;
import com.work.healthcheck.core.engine.HealthLoop;
import com.work.healthcheck.core.engine.ProcessTerminator;
import com.work.healthcheck.core.probe.CollectiveProbeStrategy;
import com.work.healthcheck.core.probe.ProbeChannelFactory;
import com.work.healthcheck.core.probe.ProbeRunner;
import com.work.healthcheck.core.store.BootstrapStore;
import com.work.healthcheck.core.store.impl.RedisBootstrapStore;
import com.work.healthcheck.core.support.InMemoryBootstrapStore;
import com.work.healthcheck.core.support.NodeIdProvider;
import com.work.healthcheck.core.support.SimpleNodeIdProvider;
import com.work.healthcheck.core.support.metrics.HealthcheckMetrics;
import com.work.healthcheck.core.support.metrics.NoopHealthcheckMetrics;
import com.work.healthcheck.core.topology.PairingScheme;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 将核心组件装配为 Spring Bean。
 * 构造/启动阶段的拓扑与 setup 错误会直接让应用上下文启动失败。
 */
@Configuration
@EnableConfigurationProperties(HealthcheckProperties.class)
public class HealthcheckConfiguration {

    @Bean
    @ConditionalOnMissingBean(NodeIdProvider.class)
    public NodeIdProvider nodeIdProvider() {
        return new SimpleNodeIdProvider();
    }

    @Bean
    @ConditionalOnMissingBean(HealthcheckMetrics.class)
    public HealthcheckMetrics healthcheckMetrics() {
        return new NoopHealthcheckMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(ProcessTerminator.class)
    public ProcessTerminator processTerminator() {
        return new HaltProcessTerminator();
    }

    @Bean
    public HealthcheckConfig healthcheckConfig(HealthcheckProperties properties) {
        return new HealthcheckConfig(
                properties.isAbortOnError(),
                properties.getInterval(),
                properties.getTimeout(),
                properties.getSetupTimeout(),
                properties.getProbeMode(),
                properties.isCancelTimedOutProbes()
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "healthcheck.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public BootstrapStore redisBootstrapStore(StringRedisTemplate redisTemplate, HealthcheckProperties properties) {
        return new RedisBootstrapStore(redisTemplate,
                properties.getStore().getNamespace(),
                properties.getStore().getPollInterval());
    }

    @Bean
    @ConditionalOnProperty(prefix = "healthcheck.store", name = "type", havingValue = "memory")
    public BootstrapStore inMemoryBootstrapStore() {
        return new InMemoryBootstrapStore();
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "healthcheck", name = "enabled", havingValue = "true")
    public HealthLoop healthLoop(HealthcheckProperties properties,
                                 HealthcheckConfig config,
                                 BootstrapStore bootstrapStore,
                                 NodeIdProvider nodeIdProvider,
                                 ProcessTerminator processTerminator,
                                 HealthcheckMetrics metrics) {
        PairingScheme pairingScheme = new PairingScheme(
                properties.getRank(), properties.getWorldSize(), properties.getLocalWorldSize());
        ProbeChannelFactory channelFactory = new ProbeChannelFactory(
                pairingScheme,
                bootstrapStore,
                ExecutionContextFactory.dedicated(),
                new StoreCommunicationGroupFactory(nodeIdProvider, config.getSetupTimeout(), config.getTimeout()));
        ProbeRunner runner = new ProbeRunner(config.getTimeout(), pairingScheme.getLocalWorldSize());
        return new HealthLoop(config, new CollectiveProbeStrategy(channelFactory, runner), processTerminator, metrics);
    }
}
