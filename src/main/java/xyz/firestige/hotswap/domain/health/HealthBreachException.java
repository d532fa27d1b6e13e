package xyz.firestige.hotswap.domain.health;

/**
 * 发布步骤后的健康采样越过阈值
 * <p>
 * 只在发布策略内部抛出，由策略模板转换为失败的 StageOutcome。
 */
public class HealthBreachException extends RuntimeException {

    private final HealthVerdict verdict;
    private final int step;
    private final int percentage;

    public HealthBreachException(HealthVerdict verdict, int step, int percentage) {
        super(String.format("第 %d 步 (%d%%) 健康检查失败: %s", step, percentage, verdict.describe()));
        this.verdict = verdict;
        this.step = step;
        this.percentage = percentage;
    }

    public HealthBreachException(String message, HealthVerdict verdict) {
        super(message);
        this.verdict = verdict;
        this.step = -1;
        this.percentage = -1;
    }

    public HealthVerdict getVerdict() {
        return verdict;
    }

    public int getStep() {
        return step;
    }

    public int getPercentage() {
        return percentage;
    }
}
