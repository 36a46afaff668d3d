package xyz.vvrf.wdl.formatter.core;

/**
 * 同一作用域内对同一标识注册了第二个完整定义。
 *
 * @author ruifeng.wen
 */
public class DuplicateNodeException extends BodyOrderingException {

    private final String nodeId;

    public DuplicateNodeException(String scopeName, String nodeId) {
        super(scopeName, String.format("Graph has cycle or duplicate node '%s'.", nodeId));
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
