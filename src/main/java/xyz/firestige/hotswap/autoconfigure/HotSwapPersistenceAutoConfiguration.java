package xyz.firestige.hotswap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.hotswap.config.properties.HotSwapPersistenceProperties;
import xyz.firestige.hotswap.config.properties.HotSwapPipelineProperties;
import xyz.firestige.hotswap.domain.approval.ApprovalRequestRepository;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.memory.InMemoryDistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.redis.RedisDistributedLock;
import xyz.firestige.hotswap.infrastructure.persistence.PipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.approval.InMemoryApprovalRequestRepository;
import xyz.firestige.hotswap.infrastructure.persistence.memory.InMemoryPipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.redis.RedisPipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.version.InMemoryEnvironmentVersionRegistry;

/**
 * 持久化自动配置
 * <p>
 * 职责：
 * - 根据 hotswap.persistence.store-type 装配 Redis 或 InMemory 实现
 * - 提供部署锁、流水线结果投影存储、审批请求仓储和环境版本登记簿
 * - 所有 Bean 都允许宿主应用自定义覆盖
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * hotswap:
 *   persistence:
 *     store-type: redis  # redis 或 memory，默认 memory
 *     namespace: hotswap
 *     result-ttl: 7d
 * </pre>
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties({HotSwapPersistenceProperties.class, HotSwapPipelineProperties.class})
public class HotSwapPersistenceAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(HotSwapPersistenceAutoConfiguration.class);

    // ========== Redis Infrastructure ==========

    @Bean(name = "hotswapRedisTemplate")
    @ConditionalOnClass(RedisConnectionFactory.class)
    @ConditionalOnMissingBean(name = "hotswapRedisTemplate")
    @ConditionalOnProperty(prefix = "hotswap.persistence", name = "store-type", havingValue = "redis")
    public StringRedisTemplate hotswapRedisTemplate(RedisConnectionFactory factory) {
        logger.info("[AutoConfig] 创建 HotSwap Redis Template");
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(factory);
        template.afterPropertiesSet();
        return template;
    }

    // ========== Deploy Lock ==========

    /**
     * Redis 部署锁（跨实例互斥）
     */
    @Bean
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnMissingBean(DistributedLock.class)
    @ConditionalOnProperty(prefix = "hotswap.persistence", name = "store-type", havingValue = "redis")
    public DistributedLock redisDistributedLock(StringRedisTemplate hotswapRedisTemplate,
                                                HotSwapPersistenceProperties persistence,
                                                HotSwapPipelineProperties pipeline) {
        logger.info("[AutoConfig] 装配 Redis 部署锁（分布式锁）");
        return new RedisDistributedLock(hotswapRedisTemplate, persistence.getNamespace(), pipeline.getLockTtl());
    }

    /**
     * 内存部署锁（Fallback，仅支持单实例）
     */
    @Bean
    @ConditionalOnMissingBean(DistributedLock.class)
    public DistributedLock inMemoryDistributedLock() {
        logger.warn("[AutoConfig] 装配 InMemory 部署锁（Fallback，仅支持单实例）");
        return new InMemoryDistributedLock();
    }

    // ========== Pipeline Result Store ==========

    @Bean
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnMissingBean(PipelineResultStore.class)
    @ConditionalOnProperty(prefix = "hotswap.persistence", name = "store-type", havingValue = "redis")
    public PipelineResultStore redisPipelineResultStore(StringRedisTemplate hotswapRedisTemplate,
                                                        ObjectProvider<ObjectMapper> objectMapper,
                                                        HotSwapPersistenceProperties persistence) {
        logger.info("[AutoConfig] 装配 Redis 流水线结果存储");
        return new RedisPipelineResultStore(hotswapRedisTemplate,
                objectMapper.getIfAvailable(HotSwapPersistenceAutoConfiguration::defaultObjectMapper),
                persistence.getNamespace(), persistence.getResultTtl());
    }

    /**
     * 内存流水线结果存储（Fallback）
     */
    @Bean
    @ConditionalOnMissingBean(PipelineResultStore.class)
    public PipelineResultStore inMemoryPipelineResultStore(HotSwapPersistenceProperties persistence) {
        logger.warn("[AutoConfig] 装配 InMemory 流水线结果存储（Fallback）, 终态保留: {}", persistence.getResultTtl());
        return new InMemoryPipelineResultStore(persistence.getResultTtl());
    }

    // ========== Approval & Version ==========

    @Bean
    @ConditionalOnMissingBean(ApprovalRequestRepository.class)
    public ApprovalRequestRepository inMemoryApprovalRequestRepository() {
        logger.warn("[AutoConfig] 装配 InMemory 审批请求仓储（Fallback）");
        return new InMemoryApprovalRequestRepository();
    }

    @Bean
    @ConditionalOnMissingBean(EnvironmentVersionRegistry.class)
    public EnvironmentVersionRegistry inMemoryEnvironmentVersionRegistry() {
        logger.warn("[AutoConfig] 装配 InMemory 环境版本登记簿（Fallback）");
        return new InMemoryEnvironmentVersionRegistry();
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
