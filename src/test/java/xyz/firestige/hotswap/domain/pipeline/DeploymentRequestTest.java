package xyz.firestige.hotswap.domain.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.firestige.hotswap.domain.shared.vo.EnvironmentType.DEVELOPMENT;
import static xyz.firestige.hotswap.domain.shared.vo.EnvironmentType.PRODUCTION;
import static xyz.firestige.hotswap.domain.shared.vo.EnvironmentType.QA;
import static xyz.firestige.hotswap.domain.shared.vo.EnvironmentType.STAGING;

@Tag("unit")
@Tag("fast")
@DisplayName("DeploymentRequest 构建测试")
class DeploymentRequestTest {

    private DeploymentRequest.Builder base() {
        return DeploymentRequest.builder()
                .module(ModuleDescriptor.of("inventory", "4.0.1"))
                .requesterEmail("dev@example.com");
    }

    @Test
    @DisplayName("场景: 只给目标环境时推导出完整前序链")
    void targetOnly_derivesChain() {
        DeploymentRequest request = base().targetEnvironment(PRODUCTION).build();

        assertThat(request.getEnvironmentChain()).containsExactly(DEVELOPMENT, QA, STAGING, PRODUCTION);
        assertThat(request.getTargetEnvironment()).isEqualTo(PRODUCTION);
        assertThat(request.getExecutionId()).isNotNull();
        assertThat(request.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("场景: 目标为 Development 时链只有一个环境")
    void developmentTarget_singleStage() {
        assertThat(base().targetEnvironment(DEVELOPMENT).build().getEnvironmentChain()).containsExactly(DEVELOPMENT);
    }

    @Test
    @DisplayName("场景: 显式链允许跳过环境，目标取链尾")
    void explicitChain_maySkipEnvironments() {
        DeploymentRequest request = base().environmentChain(List.of(QA, PRODUCTION)).build();

        assertThat(request.getEnvironmentChain()).containsExactly(QA, PRODUCTION);
        assertThat(request.getTargetEnvironment()).isEqualTo(PRODUCTION);
    }

    @Test
    @DisplayName("场景: 重复或倒序的环境链被拒绝")
    void invalidChains_rejected() {
        assertThatThrownBy(() -> base().environmentChain(List.of(QA, QA)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("重复");
        assertThatThrownBy(() -> base().environmentChain(List.of(STAGING, QA)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("顺序");
    }

    @Test
    @DisplayName("场景: 链尾与目标环境不一致")
    void chainTargetMismatch_rejected() {
        assertThatThrownBy(() -> base().targetEnvironment(PRODUCTION).environmentChain(List.of(DEVELOPMENT, QA)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("场景: 缺少请求人或目标")
    void missingFields_rejected() {
        assertThatThrownBy(() -> DeploymentRequest.builder()
                .module(ModuleDescriptor.of("inventory", "4.0.1"))
                .targetEnvironment(QA)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base().build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("场景: 环境解析大小写不敏感")
    void environmentParse_isCaseInsensitive() {
        assertThat(EnvironmentType.parse("Staging")).contains(STAGING);
        assertThat(EnvironmentType.parse("PRODUCTION")).contains(PRODUCTION);
        assertThat(EnvironmentType.parse("moon")).isEmpty();
        assertThat(EnvironmentType.parse(null)).isEmpty();
    }
}
