package xyz.vvrf.wdl.formatter.core;

import java.util.Collections;
import java.util.List;

/**
 * 作用域内的依赖边构成循环，不存在合法的线性顺序。
 *
 * @author ruifeng.wen
 */
public class CycleDetectedException extends BodyOrderingException {

    private final List<String> unresolvedIds;

    /**
     * @param scopeName     作用域名称
     * @param unresolvedIds 排序停止时仍有未满足依赖的元素标识（按排序键顺序）
     */
    public CycleDetectedException(String scopeName, List<String> unresolvedIds) {
        super(scopeName, String.format("Cycle detected! Unsorted nodes: %s", unresolvedIds));
        this.unresolvedIds = Collections.unmodifiableList(unresolvedIds);
    }

    public List<String> getUnresolvedIds() {
        return unresolvedIds;
    }
}
