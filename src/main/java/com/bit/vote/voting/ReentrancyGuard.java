package com.bit.vote.voting;

import com.bit.vote.exception.ErrorType;
import com.bit.vote.exception.VotingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 引擎级互斥 + 调用中标志
 * 所有写操作串行执行；同一线程在写操作进行中再次进入（例如账本回调）直接失败
 */
@Slf4j
@Component
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * 当前线程是否有写操作在进行中
     */
    private final ThreadLocal<Boolean> entered = ThreadLocal.withInitial(() -> Boolean.FALSE);

    public <T> T call(String operation, Supplier<T> action) {
        if (entered.get()) {
            log.warn("拒绝重入调用: {}", operation);
            throw new VotingException(ErrorType.REENTRANT_CALL, operation);
        }
        entered.set(Boolean.TRUE);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            entered.remove();
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public boolean isEntered() {
        return entered.get();
    }
}
