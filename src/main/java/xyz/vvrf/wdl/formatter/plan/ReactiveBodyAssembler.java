package xyz.vvrf.wdl.formatter.plan;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.wdl.formatter.core.BodyOrderingException;
import xyz.vvrf.wdl.formatter.core.NodeDescriptor;
import xyz.vvrf.wdl.formatter.graph.BodyGraph;
import xyz.vvrf.wdl.formatter.util.RenderPlanPrinter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link BodyAssembler} 的响应式版本。
 * <p>
 * 作用域本身仍同步排序；同一作用域内的各个块的嵌套主体彼此独立，
 * 在给定的 {@link Scheduler} 上并发装配，再按规范顺序重新组合。
 * 对同一输入，结果与 {@link BodyAssembler#assemble(String, List)} 完全相同。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ReactiveBodyAssembler {

    private final BodyAssembler bodyAssembler;
    private final Scheduler scheduler;

    public ReactiveBodyAssembler(BodyAssembler bodyAssembler, Scheduler scheduler) {
        this.bodyAssembler = Objects.requireNonNull(bodyAssembler, "BodyAssembler 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
        log.info("ReactiveBodyAssembler 已创建, 使用调度器: {}", scheduler);
    }

    public Mono<RenderPlan> assemble(List<NodeDescriptor> elements) {
        return assemble(bodyAssembler.getRootScopeName(), elements);
    }

    /**
     * 装配指定名称的作用域。排序错误以 {@code Mono.error} 发出，异常类型与同步版本一致。
     */
    public Mono<RenderPlan> assemble(String scopeName, List<NodeDescriptor> elements) {
        Objects.requireNonNull(scopeName, "作用域名称不能为空");
        Objects.requireNonNull(elements, "元素列表不能为空");
        return assembleScope(scopeName, elements)
                .doOnNext(plan -> {
                    if (bodyAssembler.isLogRenderPlan() && log.isDebugEnabled()) {
                        log.debug("Scope '{}' 渲染计划:\n{}", scopeName, RenderPlanPrinter.print(plan));
                    }
                });
    }

    private Mono<RenderPlan> assembleScope(String scopeName, List<NodeDescriptor> elements) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return Mono.defer(() -> orderScope(scopeName, elements))
                    .doOnSuccess(plan -> {
                        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                        log.debug("Scope '{}': 响应式装配完成。{} 个元素 -> {} 条指令, 耗时 {}ms",
                                scopeName, elements.size(), plan.size(), duration.toMillis());
                        BodyAssembler.notifyAssembled(bodyAssembler.getMonitorListeners(), scopeName, elements.size(), duration, plan);
                    })
                    .doOnError(BodyOrderingException.class, e -> {
                        if (scopeName.equals(e.getScopeName())) {
                            log.error("Scope '{}' 排序失败: {}", scopeName, e.getMessage());
                            BodyAssembler.notifyFailed(bodyAssembler.getMonitorListeners(), scopeName,
                                    Duration.ofNanos(System.nanoTime() - startNanos), e);
                        }
                    });
        });
    }

    private Mono<RenderPlan> orderScope(String scopeName, List<NodeDescriptor> elements) {
        BodyGraph graph = bodyAssembler.buildGraph(scopeName, elements);
        List<Mono<RenderInstruction>> items = BodyAssembler.walk(
                bodyAssembler.getOrderProducer().orderedList(graph).iterator(),
                new BodyAssembler.ItemFactory<Mono<RenderInstruction>>() {
                    @Override
                    public Mono<RenderInstruction> batch(List<NodeDescriptor> declarations) {
                        return Mono.just(new DeclarationBatch(declarations));
                    }

                    @Override
                    public Mono<RenderInstruction> invocation(NodeDescriptor invocation) {
                        return Mono.just(new InvocationItem(invocation));
                    }

                    @Override
                    public Mono<RenderInstruction> section(NodeDescriptor section) {
                        return assembleScope(BodyAssembler.nestedScopeName(scopeName, section), section.getBody())
                                .subscribeOn(scheduler)
                                .map(body -> new SectionItem(section, body));
                    }
                });

        return Flux.fromIterable(items)
                .flatMapSequential(item -> item)
                .collectList()
                .map(RenderPlan::new);
    }
}
