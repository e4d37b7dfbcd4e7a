package com.nori.tc.throughput.sim;

import com.nori.tc.throughput.logging.StructuredLog;
import com.nori.tc.throughput.scenario.SampleRateTable;
import com.nori.tc.throughput.scenario.ScenarioParameters;
import com.nori.tc.throughput.testbed.ConfigurationException;
import com.nori.tc.throughput.testbed.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SimulatedConfigurator
 *
 * 역할:
 * - 시나리오 파라미터를 검증하고 RadioConfiguration으로 확정한다.
 * - 확정된 설정은 덮어쓰기만 한다(누적 상태 없음). 같은 파라미터를 두 번 적용해도 결과가 같다.
 *
 * 거부 조건(ConfigurationException):
 * - 지원하지 않는 band
 * - SCS가 15/30kHz가 아님
 * - 대역폭이 SCS별 최대값 초과 (15kHz: 50MHz, 30kHz: 100MHz)
 * - sample rate 미지정이고 테이블에도 없는 대역폭
 */
public class SimulatedConfigurator implements Configurator {

    private static final Logger log = LoggerFactory.getLogger(SimulatedConfigurator.class);

    private static final Map<Integer, Integer> MAX_BANDWIDTH_MHZ_BY_SCS = Map.of(
            15, 50,
            30, 100
    );

    private final SampleRateTable sampleRates;
    private final Set<Integer> supportedBands;
    private final AtomicReference<RadioConfiguration> current = new AtomicReference<>();

    public SimulatedConfigurator(SampleRateTable sampleRates, Set<Integer> supportedBands) {
        this.sampleRates = Objects.requireNonNull(sampleRates, "sampleRates must not be null");
        Objects.requireNonNull(supportedBands, "supportedBands must not be null");
        if (supportedBands.isEmpty()) {
            throw new IllegalArgumentException("supportedBands must not be empty");
        }
        this.supportedBands = Set.copyOf(supportedBands);
    }

    @Override
    public void apply(ScenarioParameters parameters) {
        Objects.requireNonNull(parameters, "parameters must not be null");

        if (!supportedBands.contains(parameters.getBand())) {
            throw new ConfigurationException("band " + parameters.getBand() + " is not supported (supported="
                    + new TreeSet<>(supportedBands) + ")");
        }

        Integer maxBandwidth = MAX_BANDWIDTH_MHZ_BY_SCS.get(parameters.getSubcarrierSpacingKHz());
        if (maxBandwidth == null) {
            throw new ConfigurationException("unsupported subcarrier spacing: " + parameters.getSubcarrierSpacingKHz() + "kHz");
        }
        if (parameters.getBandwidthMHz() > maxBandwidth) {
            throw new ConfigurationException("bandwidth " + parameters.getBandwidthMHz() + "MHz exceeds "
                    + maxBandwidth + "MHz for scs " + parameters.getSubcarrierSpacingKHz() + "kHz");
        }

        int sampleRateHz;
        if (parameters.getSampleRateHz().isPresent()) {
            sampleRateHz = parameters.getSampleRateHz().getAsInt();
        } else {
            try {
                sampleRateHz = sampleRates.minimumForBandwidth(parameters.getBandwidthMHz());
            } catch (IllegalStateException ex) {
                throw new ConfigurationException(ex.getMessage(), ex);
            }
        }

        RadioConfiguration config = new RadioConfiguration(
                parameters.getBand(),
                parameters.getSubcarrierSpacingKHz(),
                parameters.getBandwidthMHz(),
                sampleRateHz,
                parameters.getTimingAdvance(),
                parameters.getTimeAlignmentCalibration(),
                parameters.isPcap());

        RadioConfiguration previous = current.getAndSet(config);

        log.info(StructuredLog.event("radio_configured",
                "band", config.band(),
                "scsKHz", config.subcarrierSpacingKHz(),
                "bandwidthMHz", config.bandwidthMHz(),
                "sampleRateHz", config.sampleRateHz(),
                "timingAdvance", config.timingAdvance(),
                "tac", config.timeAlignmentCalibration(),
                "pcap", config.pcap(),
                "changed", !config.equals(previous)));
    }

    public Optional<RadioConfiguration> getCurrent() {
        return Optional.ofNullable(current.get());
    }
}
