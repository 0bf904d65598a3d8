package com.work.healthcheck.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 立即、无条件终止 JVM：不执行 shutdown hook，退出码与 SIGABRT 一致（134）。
 */
public class HaltProcessTerminator implements ProcessTerminator {

    private static final Logger LOGGER = LoggerFactory.getLogger(HaltProcessTerminator.class);

    public static final int ABORT_EXIT_CODE = 134;

    @Override
    public void terminate(String reason) {
        LOGGER.error("[healthcheck] aborting process: {}", reason);
        Runtime.getRuntime().halt(ABORT_EXIT_CODE);
    }
}
