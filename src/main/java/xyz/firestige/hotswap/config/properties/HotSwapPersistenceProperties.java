package xyz.firestige.hotswap.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 持久化配置属性
 * <p>
 * 支持配置：
 * - 存储类型（redis/memory）
 * - Redis Key 前缀
 * - 结果投影 TTL
 */
@ConfigurationProperties(prefix = "hotswap.persistence")
public class HotSwapPersistenceProperties {

    /**
     * 存储类型
     */
    private StoreType storeType = StoreType.memory;

    /**
     * Redis Key 命名空间前缀
     */
    private String namespace = "hotswap";

    /**
     * 流水线结果投影 TTL（默认 7 天）
     */
    private Duration resultTtl = Duration.ofDays(7);

    public enum StoreType {
        /**
         * Redis 存储（多实例部署，锁和结果跨实例可见）
         */
        redis,

        /**
         * 内存存储（测试或单实例，重启后丢失）
         */
        memory
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Duration getResultTtl() {
        return resultTtl;
    }

    public void setResultTtl(Duration resultTtl) {
        this.resultTtl = resultTtl;
    }
}
