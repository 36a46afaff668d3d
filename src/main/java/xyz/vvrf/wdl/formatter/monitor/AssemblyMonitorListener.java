package xyz.vvrf.wdl.formatter.monitor;

import xyz.vvrf.wdl.formatter.plan.RenderPlan;

import java.time.Duration;

/**
 * 用于监控作用域装配事件的监听器接口。
 * 每个作用域（包括嵌套块的主体）各触发一次事件。
 * 实现不得抛出异常，也不得修改收到的计划。
 *
 * @author ruifeng.wen
 */
public interface AssemblyMonitorListener {

    /**
     * 作用域装配成功时调用。
     *
     * @param scopeName    作用域名称
     * @param elementCount 作用域直接包含的元素数量（不含嵌套主体）
     * @param duration     装配耗时（包含嵌套作用域）
     * @param plan         生成的渲染计划
     */
    void onScopeAssembled(String scopeName, int elementCount, Duration duration, RenderPlan plan);

    /**
     * 在检测到错误的作用域上调用一次；外层作用域不会重复收到同一错误。
     *
     * @param scopeName 检测到错误的作用域名称
     * @param duration  失败前的耗时
     * @param error     排序错误
     */
    void onScopeFailed(String scopeName, Duration duration, Throwable error);
}
