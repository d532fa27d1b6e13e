package xyz.firestige.hotswap.domain.identity;

/**
 * 用户角色
 */
public enum UserRole {

    /**
     * 管理员：唯一可以批准/拒绝部署的角色
     */
    ADMIN,

    DEPLOYER,

    VIEWER
}
