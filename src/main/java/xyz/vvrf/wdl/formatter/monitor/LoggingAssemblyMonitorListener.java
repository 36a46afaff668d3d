package xyz.vvrf.wdl.formatter.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.wdl.formatter.plan.RenderPlan;

import java.time.Duration;

/**
 * 以日志形式输出作用域装配结果的监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingAssemblyMonitorListener implements AssemblyMonitorListener {

    @Override
    public void onScopeAssembled(String scopeName, int elementCount, Duration duration, RenderPlan plan) {
        log.info("[MONITOR] 作用域:[{}] 装配成功。 元素:[{}], 指令:[{}], 耗时:[{}ms]",
                scopeName, elementCount, plan.size(), duration.toMillis());
    }

    @Override
    public void onScopeFailed(String scopeName, Duration duration, Throwable error) {
        log.error("[MONITOR] 作用域:[{}] 装配失败。 耗时:[{}ms], 错误:[{}]",
                scopeName, duration.toMillis(), error.getMessage(), error);
    }
}
