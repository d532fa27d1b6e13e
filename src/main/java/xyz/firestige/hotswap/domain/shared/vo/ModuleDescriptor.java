package xyz.firestige.hotswap.domain.shared.vo;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * ModuleDescriptor 值对象
 * <p>
 * 标识被部署的模块及其语义化版本。流水线启动后不可变。
 */
public final class ModuleDescriptor {

    private static final Pattern VERSION_PATTERN = Pattern.compile("^\\d+\\.\\d+\\.\\d+(-[a-zA-Z0-9]+)?$");

    private final String name;
    private final String version;
    private final String description;
    private final String author;

    private ModuleDescriptor(String name, String version, String description, String author) {
        this.name = name;
        this.version = version;
        this.description = description != null ? description : "";
        this.author = author != null ? author : "";
    }

    /**
     * 创建 ModuleDescriptor（带验证）
     *
     * @throws IllegalArgumentException 名称为空或版本号不符合 semver
     */
    public static ModuleDescriptor of(String name, String version, String description, String author) {
        if (name == null || name.isBlank() || name.length() > 100) {
            throw new IllegalArgumentException(String.format("模块名称长度必须在 1-100 之间: %s", name));
        }
        if (!isValidVersion(version)) {
            throw new IllegalArgumentException(String.format("版本号不符合语义化版本格式: %s", version));
        }
        return new ModuleDescriptor(name, version, description, author);
    }

    public static ModuleDescriptor of(String name, String version) {
        return of(name, version, null, null);
    }

    /**
     * 创建 ModuleDescriptor（不验证，用于已知合法的场景）
     */
    public static ModuleDescriptor ofTrusted(String name, String version) {
        return new ModuleDescriptor(name, version, null, null);
    }

    public static boolean isValidVersion(String version) {
        return version != null && VERSION_PATTERN.matcher(version).matches();
    }

    /**
     * 同一模块的另一个版本（回滚时使用上一个已知良好版本）
     */
    public ModuleDescriptor withVersion(String otherVersion) {
        return new ModuleDescriptor(name, otherVersion, description, author);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public String getAuthor() {
        return author;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleDescriptor that = (ModuleDescriptor) o;
        return Objects.equals(name, that.name) && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version);
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
