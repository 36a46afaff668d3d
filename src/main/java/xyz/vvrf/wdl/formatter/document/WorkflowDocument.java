package xyz.vvrf.wdl.formatter.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 已解析的 WDL 文档：URI、可选的工作流，以及其导入的文档。
 * 只有工作流主体参与排序；任务、结构体等由渲染阶段自行处理。
 *
 * @author ruifeng.wen
 */
public final class WorkflowDocument {

    private final String uri;
    private final WorkflowDefinition workflow;
    private final List<WorkflowDocument> imports;

    public WorkflowDocument(String uri, WorkflowDefinition workflow, List<WorkflowDocument> imports) {
        this.uri = Objects.requireNonNull(uri, "文档 URI 不能为空");
        this.workflow = workflow;
        this.imports = (imports == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(imports));
    }

    public String getUri() {
        return uri;
    }

    public Optional<WorkflowDefinition> getWorkflow() {
        return Optional.ofNullable(workflow);
    }

    public List<WorkflowDocument> getImports() {
        return imports;
    }

    @Override
    public String toString() {
        return String.format("Document[uri=%s, workflow=%s, imports=%d]",
                uri, workflow != null ? workflow.getName() : "-", imports.size());
    }
}
