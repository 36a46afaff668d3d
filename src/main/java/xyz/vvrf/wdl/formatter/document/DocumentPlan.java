package xyz.vvrf.wdl.formatter.document;

import xyz.vvrf.wdl.formatter.plan.RenderPlan;

import java.util.Objects;
import java.util.Optional;

/**
 * 单个文档的装配结果。没有工作流的文档（纯任务库）不携带渲染计划。
 *
 * @author ruifeng.wen
 */
public final class DocumentPlan {

    private final String uri;
    private final String workflowName;
    private final RenderPlan workflowBody;

    DocumentPlan(String uri, String workflowName, RenderPlan workflowBody) {
        this.uri = Objects.requireNonNull(uri, "文档 URI 不能为空");
        this.workflowName = workflowName;
        this.workflowBody = workflowBody;
    }

    public String getUri() {
        return uri;
    }

    public Optional<String> getWorkflowName() {
        return Optional.ofNullable(workflowName);
    }

    public Optional<RenderPlan> getWorkflowBody() {
        return Optional.ofNullable(workflowBody);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentPlan that = (DocumentPlan) o;
        return uri.equals(that.uri) &&
                Objects.equals(workflowName, that.workflowName) &&
                Objects.equals(workflowBody, that.workflowBody);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri, workflowName, workflowBody);
    }

    @Override
    public String toString() {
        return String.format("DocumentPlan[uri=%s, workflow=%s]", uri, workflowName);
    }
}
