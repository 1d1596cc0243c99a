package com.ordoAetheris.oncegate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 Once gate: run an action exactly once, everyone waits for it

 Класс: OnceGate
 Разрешено: AtomicBoolean (acquire/release), ReentrantLock.

 void execute(Runnable action)
 action == null -> IllegalArgumentException
 если gate done -> сразу return (fast path, без lock)
 иначе lock -> повторная проверка (double-checked locking) -> action.run() -> done
 done ставится в finally: и после нормального return, и после исключения

 Ошибки
 исключение action получает только тот, кто action запустил
 остальные (ждали на lock или пришли позже) просто возвращаются
 retry нет: once-only даже при падении

 Инварианты
 completed: false -> true ровно один раз, обратно никогда
 completed = true только ПОСЛЕ action (release-write), fast path читает acquire-read
 одновременно выполняется не больше одного action
 никто не возвращается из execute(), пока action не закончился

 Прод-аналоги
 Go sync.Once
 holder idiom / lazy init через double-checked locking
 */
public final class OnceGate {

    private static final Logger log = LoggerFactory.getLogger(OnceGate.class);

    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final ReentrantLock lock = new ReentrantLock();

    public void execute(Runnable action) {
        if (action == null) throw new IllegalArgumentException("action must not be null");
        if (completed.getAcquire()) return;
        executeSlow(action);
    }

    /**
     * Returns {@code true} once the action has returned or thrown. A {@code true} result
     * carries the same visibility guarantee as returning from {@link #execute(Runnable)}.
     */
    public boolean isDone() {
        return completed.getAcquire();
    }

    private void executeSlow(Runnable action) {
        // the action called back into its own gate; lock() would just re-enter
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("execute() called from inside the gate's own action");
        }
        lock.lock();
        try {
            // lock orders this read, plain is enough
            if (completed.getPlain()) return;
            boolean failed = true;
            try {
                action.run();
                failed = false;
            } finally {
                completed.setRelease(true);
                if (failed) {
                    log.debug("gate action failed on thread {}, gate is done and will not retry",
                            Thread.currentThread().getName());
                } else {
                    log.debug("gate action completed on thread {}", Thread.currentThread().getName());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "OnceGate[" + (isDone() ? "done" : "pending") + "]";
    }
}
