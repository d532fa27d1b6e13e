package xyz.firestige.hotswap.application.orchestration;

import org.slf4j.MDC;
import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;

/**
 * 流水线运行时上下文：MDC、取消令牌、配置快照与投影保存
 */
public class PipelineRuntimeContext {
    private final PipelineExecutionResult result;
    private final PipelineSettings settings;
    private final CancellationToken token;
    private final Runnable persister;

    public PipelineRuntimeContext(PipelineExecutionResult result,
                                  PipelineSettings settings,
                                  CancellationToken token,
                                  Runnable persister) {
        this.result = result;
        this.settings = settings;
        this.token = token != null ? token : CancellationToken.none();
        this.persister = persister != null ? persister : () -> { };
    }

    public void injectMdc(String stageName) {
        MDC.put("executionId", result.getExecutionId().getValue());
        MDC.put("moduleName", result.getModule().getName());
        if (stageName != null) {
            MDC.put("stage", stageName);
        } else {
            MDC.remove("stage");
        }
    }

    public void clearMdc() { MDC.clear(); }

    /**
     * 保存一次投影快照（每次变更后调用）
     */
    public void persist() { persister.run(); }

    public ExecutionId getExecutionId() { return result.getExecutionId(); }
    public PipelineExecutionResult getResult() { return result; }
    public PipelineSettings getSettings() { return settings; }
    public CancellationToken getToken() { return token; }
}
