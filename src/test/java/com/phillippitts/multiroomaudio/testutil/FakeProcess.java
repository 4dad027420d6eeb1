package com.phillippitts.multiroomaudio.testutil;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link Process} whose lifetime is driven by the test.
 *
 * <p>A running fake stays alive until {@link #exit(int)}, {@link #destroy()} or
 * {@link #destroyForcibly()}. A fake created with {@link #ignoringTerminate()} survives
 * {@code destroy()} to simulate a player that ignores SIGTERM.
 */
public class FakeProcess extends Process {

    public static final int EXIT_TERMINATED = 143;
    public static final int EXIT_KILLED = 137;

    private final CountDownLatch exited = new CountDownLatch(1);
    private final boolean ignoreTerminate;
    private final AtomicInteger destroyCalls = new AtomicInteger();
    private final AtomicInteger destroyForciblyCalls = new AtomicInteger();
    private volatile int exitCode;

    protected FakeProcess(boolean ignoreTerminate) {
        this.ignoreTerminate = ignoreTerminate;
    }

    public static FakeProcess running() {
        return new FakeProcess(false);
    }

    public static FakeProcess ignoringTerminate() {
        return new FakeProcess(true);
    }

    public static FakeProcess exitedWith(int code) {
        FakeProcess p = new FakeProcess(false);
        p.exit(code);
        return p;
    }

    public void exit(int code) {
        if (exited.getCount() > 0) {
            exitCode = code;
            exited.countDown();
        }
    }

    public int destroyCalls() {
        return destroyCalls.get();
    }

    public int destroyForciblyCalls() {
        return destroyForciblyCalls.get();
    }

    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (exited.getCount() > 0) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }

    @Override
    public void destroy() {
        destroyCalls.incrementAndGet();
        if (!ignoreTerminate) {
            exit(EXIT_TERMINATED);
        }
    }

    @Override
    public Process destroyForcibly() {
        destroyForciblyCalls.incrementAndGet();
        exit(EXIT_KILLED);
        return this;
    }
}
