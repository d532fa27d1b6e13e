package xyz.firestige.hotswap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.hotswap.application.approval.ApprovalGate;
import xyz.firestige.hotswap.application.approval.ApprovalTimeoutSweeper;
import xyz.firestige.hotswap.application.orchestration.LoggingRollbackAlertNotifier;
import xyz.firestige.hotswap.application.orchestration.PipelineOrchestrator;
import xyz.firestige.hotswap.application.orchestration.PostDeploymentHealthMonitor;
import xyz.firestige.hotswap.application.orchestration.RollbackAlertNotifier;
import xyz.firestige.hotswap.application.orchestration.RollbackCoordinator;
import xyz.firestige.hotswap.application.orchestration.StageExecutor;
import xyz.firestige.hotswap.config.properties.HotSwapClusterProperties;
import xyz.firestige.hotswap.config.properties.HotSwapPersistenceProperties;
import xyz.firestige.hotswap.config.properties.HotSwapPipelineProperties;
import xyz.firestige.hotswap.domain.approval.ApprovalRequestRepository;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;
import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;
import xyz.firestige.hotswap.facade.DeploymentFacade;
import xyz.firestige.hotswap.health.PipelineOrchestratorHealthIndicator;
import xyz.firestige.hotswap.infrastructure.audit.CompositeAuditRecorder;
import xyz.firestige.hotswap.infrastructure.audit.LoggingAuditRecorder;
import xyz.firestige.hotswap.infrastructure.audit.SpringAuditEventPublisher;
import xyz.firestige.hotswap.infrastructure.cluster.InMemoryClusterSimulator;
import xyz.firestige.hotswap.infrastructure.cluster.RestClusterHealthProbe;
import xyz.firestige.hotswap.infrastructure.execution.rollout.RolloutStrategyFactory;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.LockRenewalScheduler;
import xyz.firestige.hotswap.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.hotswap.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.hotswap.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.hotswap.infrastructure.persistence.PipelineResultStore;

import java.util.List;

/**
 * 流水线编排器自动配置
 * <p>
 * 装配顺序：基础设施（指标、审计、集群接入）→ 发布策略 → 审批/回滚 → 阶段执行器 → 编排器 → Facade。
 * 持久化相关 Bean 由 {@link HotSwapPersistenceAutoConfiguration} 提供。
 */
@AutoConfiguration(after = HotSwapPersistenceAutoConfiguration.class)
@EnableConfigurationProperties({HotSwapPipelineProperties.class, HotSwapClusterProperties.class,
        HotSwapPersistenceProperties.class})
public class HotSwapOrchestratorAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(HotSwapOrchestratorAutoConfiguration.class);

    // ========== Metrics & Audit ==========

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry hotswapMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null) {
            logger.info("[AutoConfig] 装配 Micrometer 指标注册表");
            return new MicrometerMetricsRegistry(registry);
        }
        logger.warn("[AutoConfig] 未发现 MeterRegistry, 装配 Noop 指标注册表（Fallback）");
        return new NoopMetricsRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(AuditRecorder.class)
    public AuditRecorder hotswapAuditRecorder(ObjectProvider<ObjectMapper> objectMapper,
                                              ApplicationEventPublisher eventPublisher) {
        logger.info("[AutoConfig] 装配审计记录器（日志 + Spring 事件）");
        return new CompositeAuditRecorder(List.of(
                new LoggingAuditRecorder(objectMapper.getIfAvailable(HotSwapPersistenceAutoConfiguration::defaultObjectMapper)),
                new SpringAuditEventPublisher(eventPublisher)));
    }

    // ========== Cluster ==========

    /**
     * HTTP 健康探测（配置了 probe-base-url 时优先）
     */
    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "hotswap.cluster", name = "probe-base-url")
    public ClusterHealthProbe restClusterHealthProbe(HotSwapClusterProperties cluster,
                                                     ObjectProvider<ObjectMapper> objectMapper) {
        logger.info("[AutoConfig] 装配 HTTP 集群健康探测: {}", cluster.getProbeBaseUrl());
        return new RestClusterHealthProbe(cluster.getProbeBaseUrl(), new RestTemplate(),
                objectMapper.getIfAvailable(HotSwapPersistenceAutoConfiguration::defaultObjectMapper));
    }

    /**
     * 进程内模拟集群（Fallback，宿主应用未提供部署器时同时充当部署器和健康探测）
     */
    @Bean
    @ConditionalOnMissingBean(ModuleDeployer.class)
    public InMemoryClusterSimulator inMemoryClusterSimulator(HotSwapClusterProperties cluster) {
        logger.warn("[AutoConfig] 装配进程内模拟集群（Fallback）: {}", cluster.getNodes());
        return new InMemoryClusterSimulator(cluster.getNodes());
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthEvaluator healthEvaluator() {
        return new HealthEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public RolloutStrategyFactory rolloutStrategyFactory(ModuleDeployer deployer,
                                                         ClusterHealthProbe probe,
                                                         HealthEvaluator evaluator) {
        return new RolloutStrategyFactory(deployer, probe, evaluator);
    }

    // ========== Approval ==========

    @Bean
    @ConditionalOnMissingBean
    public ApprovalGate approvalGate(ApprovalRequestRepository repository,
                                     AuditRecorder auditRecorder,
                                     MetricsRegistry metrics) {
        return new ApprovalGate(repository, auditRecorder, metrics);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean
    public ApprovalTimeoutSweeper approvalTimeoutSweeper(ApprovalGate approvalGate,
                                                         HotSwapPipelineProperties pipeline,
                                                         HotSwapPersistenceProperties persistence) {
        return new ApprovalTimeoutSweeper(approvalGate, pipeline.getApprovalSweepInterval(),
                persistence.getResultTtl());
    }

    // ========== Rollback ==========

    @Bean
    @ConditionalOnMissingBean
    public RollbackAlertNotifier rollbackAlertNotifier() {
        logger.warn("[AutoConfig] 装配日志告警通知器（Fallback）");
        return new LoggingRollbackAlertNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RollbackCoordinator rollbackCoordinator(RolloutStrategyFactory strategyFactory,
                                                   ModuleDeployer deployer,
                                                   ClusterHealthProbe probe,
                                                   EnvironmentVersionRegistry versionRegistry,
                                                   AuditRecorder auditRecorder,
                                                   MetricsRegistry metrics,
                                                   RollbackAlertNotifier alertNotifier) {
        return new RollbackCoordinator(strategyFactory, deployer, probe, versionRegistry,
                auditRecorder, metrics, alertNotifier);
    }

    // ========== Execution ==========

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public LockRenewalScheduler lockRenewalScheduler() {
        return new LockRenewalScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public StageExecutor stageExecutor(DistributedLock distributedLock,
                                       LockRenewalScheduler renewalScheduler,
                                       ApprovalGate approvalGate,
                                       RolloutStrategyFactory strategyFactory,
                                       RollbackCoordinator rollbackCoordinator,
                                       EnvironmentVersionRegistry versionRegistry,
                                       AuditRecorder auditRecorder,
                                       MetricsRegistry metrics) {
        return new StageExecutor(distributedLock, renewalScheduler, approvalGate, strategyFactory,
                rollbackCoordinator, versionRegistry, auditRecorder, metrics);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public PipelineOrchestrator pipelineOrchestrator(StageExecutor stageExecutor,
                                                     RollbackCoordinator rollbackCoordinator,
                                                     DistributedLock distributedLock,
                                                     EnvironmentVersionRegistry versionRegistry,
                                                     PipelineResultStore resultStore,
                                                     AuditRecorder auditRecorder,
                                                     MetricsRegistry metrics,
                                                     HotSwapPipelineProperties pipeline,
                                                     ClusterHealthProbe probe,
                                                     HealthEvaluator evaluator) {
        logger.info("[AutoConfig] 装配流水线编排器, 最大并发: {}", pipeline.getMaxConcurrentPipelines());
        return new PipelineOrchestrator(stageExecutor, rollbackCoordinator, distributedLock, versionRegistry,
                resultStore, auditRecorder, metrics, pipeline::toSettings,
                new PostDeploymentHealthMonitor(probe, evaluator));
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentFacade deploymentFacade(PipelineOrchestrator orchestrator,
                                             ApprovalGate approvalGate,
                                             ObjectProvider<Validator> validator) {
        return new DeploymentFacade(orchestrator, approvalGate,
                validator.getIfAvailable(() -> Validation.buildDefaultValidatorFactory().getValidator()));
    }

    // ========== Health ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthIndicatorConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "pipelineOrchestratorHealthIndicator")
        public PipelineOrchestratorHealthIndicator pipelineOrchestratorHealthIndicator(
                PipelineOrchestrator orchestrator,
                ApprovalGate approvalGate,
                EnvironmentVersionRegistry versionRegistry) {
            return new PipelineOrchestratorHealthIndicator(orchestrator, approvalGate, versionRegistry);
        }
    }
}
