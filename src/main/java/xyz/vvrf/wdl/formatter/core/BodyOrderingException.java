package xyz.vvrf.wdl.formatter.core;

/**
 * 作用域排序失败的基类异常。
 * 所有子类都是致命错误：出错的作用域不会产生任何部分结果，
 * 异常沿递归的 assemble 调用原样向上传播。
 *
 * @author ruifeng.wen
 */
public abstract class BodyOrderingException extends IllegalStateException {

    private final String scopeName;

    protected BodyOrderingException(String scopeName, String message) {
        super(String.format("Scope '%s': %s", scopeName, message));
        this.scopeName = scopeName;
    }

    /**
     * 检测到错误的作用域名称。
     */
    public String getScopeName() {
        return scopeName;
    }
}
