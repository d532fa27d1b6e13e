package xyz.firestige.hotswap.application.orchestration;

/**
 * 回滚失败告警通道（应当能叫醒值班人员）
 */
public interface RollbackAlertNotifier {

    void alert(RollbackFailureException failure);
}
