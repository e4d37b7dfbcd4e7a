package com.nori.tc.throughput.suite;

import com.nori.tc.throughput.logging.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SuiteCompletionCoordinator
 *
 * 역할:
 * - suite 완료 후 프로세스 종료를 스케줄한다. exit code는 SuiteSummary가 정한다.
 *
 * 종료 절차:
 * - 별도 비-데몬 스레드("throughput-exit")에서 수행한다.
 *   suite 스레드나 Netty EventLoop 스레드에서 context를 닫으면
 *   NettyTrafficTool.stop()이 자기 자신을 기다릴 수 있다.
 * - EXIT_GRACE_MS 대기 → SpringApplication.exit(appContext) → System.exit(code)
 */
public class SuiteCompletionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SuiteCompletionCoordinator.class);

    /** 로그 flush 대기 */
    private static final long EXIT_GRACE_MS = 500;

    private final ConfigurableApplicationContext appContext;

    /** 중복 종료 시도 방지 */
    private final AtomicBoolean exitTriggered = new AtomicBoolean(false);

    public SuiteCompletionCoordinator(ConfigurableApplicationContext appContext) {
        this.appContext = Objects.requireNonNull(appContext, "appContext must not be null");
    }

    public void suiteCompleted(SuiteSummary summary, boolean exitOnCompletion) {
        Objects.requireNonNull(summary, "summary must not be null");
        requestExit(summary.exitCode(), exitOnCompletion);
    }

    /**
     * suite 실행 자체가 예외로 끝난 경우. 집계가 없으므로 실패 exit code로 종료한다.
     */
    public void suiteFailed(Throwable cause, boolean exitOnCompletion) {
        Objects.requireNonNull(cause, "cause must not be null");
        requestExit(SuiteSummary.EXIT_FAILED, exitOnCompletion);
    }

    private void requestExit(int exitCode, boolean exitOnCompletion) {
        if (!exitOnCompletion) {
            log.info(StructuredLog.event("process_exit_skipped",
                    "reason", "exit_on_completion_disabled",
                    "exitCode", exitCode));
            return;
        }
        if (exitTriggered.compareAndSet(false, true)) {
            scheduleProcessExit(exitCode);
        }
    }

    private void scheduleProcessExit(int exitCode) {
        log.info(StructuredLog.event("process_exit_scheduled",
                "exitCode", exitCode,
                "delayMs", EXIT_GRACE_MS));

        Thread exitThread = new Thread(() -> {
            try {
                Thread.sleep(EXIT_GRACE_MS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }

            log.info(StructuredLog.event("process_exit_executing", "exitCode", exitCode));

            int code = SpringApplication.exit(appContext, () -> exitCode);
            System.exit(code);
        }, "throughput-exit");

        exitThread.setDaemon(false);
        exitThread.start();
    }
}
