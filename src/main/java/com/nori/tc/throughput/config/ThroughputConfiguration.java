package com.nori.tc.throughput.config;

import com.nori.tc.throughput.measurement.TrafficMeasurementPhase;
import com.nori.tc.throughput.netty.NettyTrafficTool;
import com.nori.tc.throughput.orchestration.OrchestrationSequencer;
import com.nori.tc.throughput.scenario.SampleRateTable;
import com.nori.tc.throughput.scenario.ScenarioCatalog;
import com.nori.tc.throughput.sim.LoggingArtifactReporter;
import com.nori.tc.throughput.sim.SimulatedConfigurator;
import com.nori.tc.throughput.sim.SimulatedTestBedFactory;
import com.nori.tc.throughput.suite.ScenarioSuiteLifecycle;
import com.nori.tc.throughput.suite.ScenarioSuiteRunner;
import com.nori.tc.throughput.suite.SuiteCompletionCoordinator;
import com.nori.tc.throughput.testbed.Reporter;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ThroughputConfiguration {

    @Bean
    public SampleRateTable sampleRateTable(TcThroughputProperties props) {
        return new SampleRateTable(props.getSampleRates());
    }

    @Bean
    public ScenarioCatalog scenarioCatalog(SampleRateTable sampleRates, TcThroughputProperties props) {
        return new ScenarioCatalog(sampleRates, props.getDefaults().getToleranceFraction());
    }

    /**
     * attach/detach 시도, 측정 세션 실행용.
     * BIDIRECTIONAL 세션과 detach 동시 실행을 위해 고정 크기가 아닌 cached pool을 쓴다.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor() {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "throughput-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public NettyTrafficTool nettyTrafficTool(TcThroughputProperties props) {
        TcThroughputProperties.Testbed tb = props.getTestbed();
        return new NettyTrafficTool(tb.getSinkHost(), tb.getIoThreads(), Duration.ofMillis(tb.getDrainMs()));
    }

    @Bean
    public TrafficMeasurementPhase trafficMeasurementPhase(NettyTrafficTool trafficTool,
                                                           ExecutorService orchestrationExecutor,
                                                           TcThroughputProperties props) {
        return new TrafficMeasurementPhase(trafficTool, orchestrationExecutor,
                Duration.ofSeconds(props.getDefaults().getMeasurementGraceSec()));
    }

    @Bean
    public SimulatedConfigurator simulatedConfigurator(SampleRateTable sampleRates, TcThroughputProperties props) {
        return new SimulatedConfigurator(sampleRates, new HashSet<>(props.getTestbed().getSupportedBands()));
    }

    @Bean
    public Reporter artifactReporter() {
        return new LoggingArtifactReporter();
    }

    @Bean
    public OrchestrationSequencer orchestrationSequencer(SimulatedConfigurator configurator,
                                                         TrafficMeasurementPhase measurementPhase,
                                                         Reporter artifactReporter,
                                                         ExecutorService orchestrationExecutor,
                                                         TcThroughputProperties props) {
        TcThroughputProperties.Defaults d = props.getDefaults();
        return new OrchestrationSequencer(configurator, measurementPhase, artifactReporter, orchestrationExecutor,
                Duration.ofSeconds(d.getAttachTimeoutSec()),
                Duration.ofSeconds(d.getDetachTimeoutSec()));
    }

    @Bean
    public SimulatedTestBedFactory simulatedTestBedFactory(SimulatedConfigurator configurator,
                                                           TcThroughputProperties props) {
        TcThroughputProperties.Testbed tb = props.getTestbed();
        return new SimulatedTestBedFactory(configurator, tb.getUeAddressPrefix(), Duration.ofMillis(tb.getAttachDelayMs()));
    }

    @Bean
    public ScenarioSuiteRunner scenarioSuiteRunner(ScenarioCatalog catalog,
                                                   OrchestrationSequencer sequencer,
                                                   SimulatedTestBedFactory testBedFactory) {
        return new ScenarioSuiteRunner(catalog, sequencer, testBedFactory::create);
    }

    @Bean
    public SuiteCompletionCoordinator suiteCompletionCoordinator(ConfigurableApplicationContext appContext) {
        return new SuiteCompletionCoordinator(appContext);
    }

    @Bean
    public ScenarioSuiteLifecycle scenarioSuiteLifecycle(TcThroughputProperties props,
                                                         ScenarioSuiteRunner runner,
                                                         SuiteCompletionCoordinator coordinator) {
        return new ScenarioSuiteLifecycle(props.getSuite(), runner, coordinator);
    }
}
