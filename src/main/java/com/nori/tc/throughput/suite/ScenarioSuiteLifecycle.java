package com.nori.tc.throughput.suite;

import com.nori.tc.throughput.config.TcThroughputProperties;
import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.scenario.ScenarioCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ScenarioSuiteLifecycle
 *
 * 역할:
 * - tc.throughput.suite.enabled=true면 애플리케이션 기동 직후 suite를 비-데몬 스레드에서 실행한다.
 * - 완료 시 SuiteCompletionCoordinator에 종료 판단을 넘긴다.
 *
 * 실패 처리:
 * - id-pattern이 정규식으로 컴파일되지 않으면 start()에서 IllegalStateException (기동 실패).
 * - suite 실행 중 예외가 나도 coordinator에는 반드시 알린다(exit code 1).
 *
 * Phase:
 * - NettyTrafficTool(phase 0)보다 늦게 시작하고 먼저 멈추도록 phase 1.
 */
public class ScenarioSuiteLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ScenarioSuiteLifecycle.class);

    private final TcThroughputProperties.Suite suiteProps;
    private final ScenarioSuiteRunner runner;
    private final SuiteCompletionCoordinator coordinator;

    private volatile Thread suiteThread;
    private volatile boolean running = false;

    public ScenarioSuiteLifecycle(TcThroughputProperties.Suite suiteProps,
                                  ScenarioSuiteRunner runner,
                                  SuiteCompletionCoordinator coordinator) {
        this.suiteProps = Objects.requireNonNull(suiteProps, "suiteProps must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
    }

    @Override
    public synchronized void start() {
        if (running) return;

        if (!suiteProps.isEnabled()) {
            running = true;
            log.info(StructuredLog.event("suite_disabled"));
            return;
        }

        Set<ScenarioCategory> categories = suiteProps.getCategories() == null || suiteProps.getCategories().isEmpty()
                ? EnumSet.noneOf(ScenarioCategory.class)
                : EnumSet.copyOf(suiteProps.getCategories());
        String idPattern = suiteProps.getIdPattern();
        validateIdPattern(idPattern);
        running = true;

        Thread t = new Thread(() -> runSuite(categories, idPattern), "throughput-suite");
        t.setDaemon(false);
        suiteThread = t;
        t.start();
    }

    void runSuite(Set<ScenarioCategory> categories, String idPattern) {
        boolean exitOnCompletion = suiteProps.isExitOnCompletion();
        SuiteSummary summary;
        try {
            summary = runner.run(categories, idPattern);
        } catch (RuntimeException ex) {
            log.error(StructuredLog.event("suite_failed",
                    "error", ex.getClass().getSimpleName(),
                    "detail", ex.getMessage(),
                    "exitCode", SuiteSummary.EXIT_FAILED), ex);
            coordinator.suiteFailed(ex, exitOnCompletion);
            return;
        }
        coordinator.suiteCompleted(summary, exitOnCompletion);
    }

    private static void validateIdPattern(String idPattern) {
        if (idPattern == null || idPattern.isBlank()) return;
        try {
            Pattern.compile(idPattern.trim());
        } catch (PatternSyntaxException ex) {
            throw new IllegalStateException(
                    "tc.throughput.suite.id-pattern is not a valid regular expression: " + idPattern, ex);
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;

        Thread t = suiteThread;
        if (t != null && t.isAlive() && t != Thread.currentThread()) {
            log.info(StructuredLog.event("suite_stopping", "thread", t.getName()));
            t.interrupt();
        }
        suiteThread = null;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 1;
    }
}
