package xyz.vvrf.wdl.formatter.core;

/**
 * 排序算法内部一致性检查失败（例如排序结果的第一个节点不是 HEAD）。
 * 对于正确构建的图不应出现，出现即表示实现存在缺陷。
 *
 * @author ruifeng.wen
 */
public class OrderingInvariantException extends BodyOrderingException {

    public OrderingInvariantException(String scopeName, String message) {
        super(scopeName, message);
    }
}
