package xyz.firestige.hotswap.facade;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 创建部署命令（对应 POST /deployments 请求体）
 */
public class CreateDeploymentCommand {

    static final String ENVIRONMENT_PATTERN = "(?i)^(development|qa|staging|production)$";

    @NotBlank(message = "模块名称不能为空")
    @Pattern(regexp = "^[a-z0-9][a-z0-9-]{1,62}[a-z0-9]$",
            message = "模块名称只能包含小写字母、数字和连字符, 长度 3-64, 且不能以连字符开头或结尾")
    private String moduleName;

    @NotBlank(message = "版本号不能为空")
    @Pattern(regexp = "^\\d+\\.\\d+\\.\\d+(-[a-zA-Z0-9]+)?$", message = "版本号必须符合语义化版本格式, 例如 1.2.3 或 1.2.3-beta")
    private String version;

    @NotBlank(message = "目标环境不能为空")
    @Pattern(regexp = ENVIRONMENT_PATTERN, message = "目标环境必须是 Development/QA/Staging/Production 之一")
    private String targetEnvironment;

    @NotBlank(message = "请求人邮箱不能为空")
    @Email(message = "请求人邮箱格式不正确")
    private String requesterEmail;

    @Size(max = 1000, message = "描述不能超过 1000 个字符")
    private String description;

    private boolean requireApproval;

    /**
     * 显式环境链，为空时按目标环境推导
     */
    private List<@Pattern(regexp = ENVIRONMENT_PATTERN, message = "环境链包含未知环境") String> environmentChain = new ArrayList<>();

    @Size(max = 50, message = "元数据最多 50 项")
    private Map<@Size(max = 100, message = "元数据键不能超过 100 个字符") String,
            @Size(max = 500, message = "元数据值不能超过 500 个字符") String> metadata = new LinkedHashMap<>();

    public String getModuleName() { return moduleName; }
    public void setModuleName(String moduleName) { this.moduleName = moduleName; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getTargetEnvironment() { return targetEnvironment; }
    public void setTargetEnvironment(String targetEnvironment) { this.targetEnvironment = targetEnvironment; }

    public String getRequesterEmail() { return requesterEmail; }
    public void setRequesterEmail(String requesterEmail) { this.requesterEmail = requesterEmail; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isRequireApproval() { return requireApproval; }
    public void setRequireApproval(boolean requireApproval) { this.requireApproval = requireApproval; }

    public List<String> getEnvironmentChain() { return environmentChain; }
    public void setEnvironmentChain(List<String> environmentChain) { this.environmentChain = environmentChain; }

    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
}
