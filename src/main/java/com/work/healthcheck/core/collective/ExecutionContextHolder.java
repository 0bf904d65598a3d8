package com.work.healthcheck.core.collective;

/**
 * 保存当前线程绑定的 {@link ExecutionContext}。
 */
public final class ExecutionContextHolder {

    private static final ThreadLocal<ExecutionContext> CURRENT = new ThreadLocal<>();

    private ExecutionContextHolder() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * @return 当前线程绑定的上下文，未绑定时返回 null
     */
    public static ExecutionContext current() {
        return CURRENT.get();
    }

    static ExecutionContext.Binding bind(ExecutionContext context) {
        final ExecutionContext previous = CURRENT.get();
        CURRENT.set(context);
        return () -> {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        };
    }
}
