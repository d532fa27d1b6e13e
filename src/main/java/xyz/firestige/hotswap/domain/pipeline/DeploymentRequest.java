package xyz.firestige.hotswap.domain.pipeline;

import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 部署请求（不可变）
 * <p>
 * 每次 API 调用创建一次。环境链未显式给出时由目标环境推导。
 */
public final class DeploymentRequest {

    private final ExecutionId executionId;
    private final ModuleDescriptor module;
    private final List<EnvironmentType> environmentChain;
    private final String requesterEmail;
    private final boolean requireApproval;
    private final Map<String, String> metadata;
    private final LocalDateTime createdAt;

    private DeploymentRequest(Builder builder) {
        this.executionId = builder.executionId != null ? builder.executionId : ExecutionId.generate();
        this.module = builder.module;
        this.environmentChain = List.copyOf(builder.environmentChain);
        this.requesterEmail = builder.requesterEmail;
        this.requireApproval = builder.requireApproval;
        this.metadata = Map.copyOf(builder.metadata);
        this.createdAt = builder.createdAt != null ? builder.createdAt : LocalDateTime.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public ModuleDescriptor getModule() {
        return module;
    }

    public List<EnvironmentType> getEnvironmentChain() {
        return environmentChain;
    }

    /**
     * 目标环境 = 环境链最后一个
     */
    public EnvironmentType getTargetEnvironment() {
        return environmentChain.get(environmentChain.size() - 1);
    }

    public String getRequesterEmail() {
        return requesterEmail;
    }

    public boolean isRequireApproval() {
        return requireApproval;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "DeploymentRequest{" +
                "executionId=" + executionId +
                ", module=" + module +
                ", environmentChain=" + environmentChain +
                ", requesterEmail='" + requesterEmail + '\'' +
                ", requireApproval=" + requireApproval +
                '}';
    }

    public static class Builder {
        private ExecutionId executionId;
        private ModuleDescriptor module;
        private EnvironmentType targetEnvironment;
        private List<EnvironmentType> environmentChain = new ArrayList<>();
        private String requesterEmail;
        private boolean requireApproval;
        private Map<String, String> metadata = new LinkedHashMap<>();
        private LocalDateTime createdAt;

        public Builder executionId(ExecutionId executionId) { this.executionId = executionId; return this; }
        public Builder module(ModuleDescriptor module) { this.module = module; return this; }
        public Builder targetEnvironment(EnvironmentType targetEnvironment) { this.targetEnvironment = targetEnvironment; return this; }
        public Builder environmentChain(List<EnvironmentType> chain) {
            this.environmentChain = chain != null ? new ArrayList<>(chain) : new ArrayList<>();
            return this;
        }
        public Builder requesterEmail(String requesterEmail) { this.requesterEmail = requesterEmail; return this; }
        public Builder requireApproval(boolean requireApproval) { this.requireApproval = requireApproval; return this; }
        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }
        public Builder createdAt(LocalDateTime createdAt) { this.createdAt = createdAt; return this; }

        /**
         * @throws IllegalArgumentException 模块缺失、请求人缺失或环境链非法
         */
        public DeploymentRequest build() {
            Objects.requireNonNull(module, "module 不能为空");
            if (requesterEmail == null || requesterEmail.isBlank()) {
                throw new IllegalArgumentException("requesterEmail 不能为空");
            }
            if (environmentChain.isEmpty()) {
                if (targetEnvironment == null) {
                    throw new IllegalArgumentException("目标环境和环境链不能同时为空");
                }
                environmentChain = new ArrayList<>(targetEnvironment.chainTo());
            } else {
                validateChain(environmentChain);
                if (targetEnvironment != null && environmentChain.get(environmentChain.size() - 1) != targetEnvironment) {
                    throw new IllegalArgumentException(String.format(
                            "环境链末尾 %s 与目标环境 %s 不一致",
                            environmentChain.get(environmentChain.size() - 1), targetEnvironment));
                }
            }
            return new DeploymentRequest(this);
        }

        private static void validateChain(List<EnvironmentType> chain) {
            Set<EnvironmentType> seen = EnumSet.noneOf(EnvironmentType.class);
            EnvironmentType previous = null;
            for (EnvironmentType env : chain) {
                if (env == null) {
                    throw new IllegalArgumentException("环境链中不能包含空环境");
                }
                if (!seen.add(env)) {
                    throw new IllegalArgumentException("环境链中存在重复环境: " + env);
                }
                if (previous != null && env.ordinal() < previous.ordinal()) {
                    throw new IllegalArgumentException(String.format("环境链顺序非法: %s 不能位于 %s 之后", env, previous));
                }
                previous = env;
            }
        }
    }
}
