package xyz.firestige.hotswap.domain.identity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 调用主体（邮箱 + 角色），由外部认证层提供
 */
public record UserIdentity(String email, Set<UserRole> roles) {

    public UserIdentity {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("主体邮箱不能为空");
        }
        roles = roles == null || roles.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(roles));
    }

    public static UserIdentity admin(String email) {
        return new UserIdentity(email, Set.of(UserRole.ADMIN));
    }

    public static UserIdentity of(String email, UserRole... roles) {
        return new UserIdentity(email, roles.length == 0 ? Set.of() : Set.of(roles));
    }

    public boolean hasRole(UserRole role) {
        return roles.contains(role);
    }

    public boolean isAdmin() {
        return hasRole(UserRole.ADMIN);
    }
}
