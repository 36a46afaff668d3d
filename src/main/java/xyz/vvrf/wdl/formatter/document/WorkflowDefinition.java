package xyz.vvrf.wdl.formatter.document;

import xyz.vvrf.wdl.formatter.core.NodeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 文档中的工作流：名称与其顶层主体元素。
 *
 * @author ruifeng.wen
 */
public final class WorkflowDefinition {

    private final String name;
    private final List<NodeDescriptor> body;

    public WorkflowDefinition(String name, List<NodeDescriptor> body) {
        this.name = Objects.requireNonNull(name, "工作流名称不能为空");
        this.body = (body == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getName() {
        return name;
    }

    public List<NodeDescriptor> getBody() {
        return body;
    }

    @Override
    public String toString() {
        return String.format("Workflow[name=%s, body=%d]", name, body.size());
    }
}
