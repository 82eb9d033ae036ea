package net.dbbeat.integration.spring.sched;

import net.dbbeat.core.service.BeatScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * 스케줄러 루프를 전용 스레드 하나에서 돌린다.
 * 컨텍스트 종료 시 stop 신호 후 마지막 sync 가 끝날 때까지 기다린다.
 */
public class BeatLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(BeatLifecycle.class);
    static final String THREAD_NAME = "dbbeat-scheduler";

    private final BeatScheduler scheduler;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean autoStartup = true;

    private volatile Thread worker;

    public BeatLifecycle(BeatScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public synchronized void start() {
        if (worker != null) return;
        Thread t = new Thread(scheduler, THREAD_NAME);
        t.setDaemon(false);
        t.setUncaughtExceptionHandler((th, e) -> log.error("scheduler thread died", e));
        worker = t;
        t.start();
    }

    @Override
    public synchronized void stop() {
        Thread t = worker;
        if (t == null) return;
        scheduler.stop();
        try {
            t.join(shutdownTimeout.toMillis());
            if (t.isAlive()) {
                log.warn("scheduler thread did not stop within {}, interrupting", shutdownTimeout);
                t.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            worker = null;
        }
    }

    @Override
    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    // 데이터소스/트랜잭션 매니저보다 늦게 시작, 먼저 종료
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }
}
