package xyz.vvrf.wdl.formatter.document;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.wdl.formatter.plan.BodyAssembler;
import xyz.vvrf.wdl.formatter.plan.RenderPlan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 为一个文档及其全部（传递）导入生成渲染计划。
 * 结果按首次访问顺序以 URI 为键；同一 URI 无论被导入多少次都只装配一次。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DocumentPlanner {

    private final BodyAssembler bodyAssembler;

    public DocumentPlanner(BodyAssembler bodyAssembler) {
        this.bodyAssembler = Objects.requireNonNull(bodyAssembler, "BodyAssembler 不能为空");
    }

    public Map<String, DocumentPlan> plan(WorkflowDocument document) {
        Objects.requireNonNull(document, "文档不能为空");
        Map<String, DocumentPlan> plans = new LinkedHashMap<>();
        plan(document, plans);
        log.info("文档 '{}' 装配完成, 共 {} 个文档 (含导入)", document.getUri(), plans.size());
        return Collections.unmodifiableMap(plans);
    }

    private void plan(WorkflowDocument document, Map<String, DocumentPlan> plans) {
        if (plans.containsKey(document.getUri())) {
            log.debug("文档 '{}' 已装配, 跳过", document.getUri());
            return;
        }

        DocumentPlan documentPlan = document.getWorkflow()
                .map(workflow -> {
                    RenderPlan body = bodyAssembler.assemble(workflow.getName(), workflow.getBody());
                    return new DocumentPlan(document.getUri(), workflow.getName(), body);
                })
                .orElseGet(() -> new DocumentPlan(document.getUri(), null, null));
        plans.put(document.getUri(), documentPlan);

        for (WorkflowDocument imported : document.getImports()) {
            plan(imported, plans);
        }
    }
}
