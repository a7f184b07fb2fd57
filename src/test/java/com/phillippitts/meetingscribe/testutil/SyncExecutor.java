package com.phillippitts.meetingscribe.testutil;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs backend tasks on the submitting thread, so a window's result is applied before the
 * dispatcher loop reads the next chunk.
 */
public class SyncExecutor implements Executor {

    private final AtomicInteger executed = new AtomicInteger();

    @Override
    public void execute(Runnable task) {
        executed.incrementAndGet();
        task.run();
    }

    public int executedCount() {
        return executed.get();
    }
}
