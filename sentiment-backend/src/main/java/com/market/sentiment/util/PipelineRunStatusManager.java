package com.market.sentiment.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 流水线运行状态管理器：单写者锁与“运行中”标记的中央管理点。
 * 同一时刻只允许一次运行，查询接口据此返回 423。
 */
@Component
public class PipelineRunStatusManager {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunStatusManager.class);

    private final ReentrantLock runLock = new ReentrantLock();

    // 使用volatile确保多线程可见性
    private volatile boolean runInProgress = false;

    /**
     * 尝试获取写锁，已被占用时立即返回 false。
     */
    public boolean tryBeginRun() {
        if (!runLock.tryLock()) {
            return false;
        }
        // 同一线程内重入同样视为冲突
        if (runLock.getHoldCount() > 1) {
            runLock.unlock();
            return false;
        }
        runInProgress = true;
        log.info("流水线运行状态已更新为: 进行中");
        return true;
    }

    public void endRun() {
        if (!runLock.isHeldByCurrentThread()) {
            log.warn("当前线程未持有运行锁，忽略 endRun 调用");
            return;
        }
        runInProgress = false;
        runLock.unlock();
        log.info("流水线运行状态已更新为: 已完成");
    }

    public boolean isRunInProgress() {
        return runInProgress;
    }
}
