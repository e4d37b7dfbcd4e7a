package com.nori.tc.throughput.scenario;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * ScenarioParameters
 *
 * 목적:
 * - 테스트 1회 실행을 완전히 결정하는 불변 값.
 * - 어떤 네트워크 요소도 건드리기 전에 생성/검증이 끝나야 하며,
 *   configure → attach → measure → teardown 전 단계에 읽기 전용으로 전달된다.
 *
 * 검증 규칙(생성 시점):
 * - band / subcarrierSpacingKHz / bandwidthMHz > 0
 * - sampleRateHz: 없으면 test bed 기본값, 있으면 > 0
 * - durationSeconds > 0
 * - targetBitrateBps > 0
 * - bitrateToleranceFraction ∈ [0, 1] (0 = bitrate 검증 생략)
 * - timingAdvance >= -1 (-1 = 자동)
 */
public final class ScenarioParameters {

    /** timingAdvance 자동 결정 sentinel */
    public static final int TIMING_ADVANCE_AUTO = -1;

    private final int band;
    private final int subcarrierSpacingKHz;
    private final int bandwidthMHz;
    private final Integer sampleRateHz;
    private final TrafficProtocol protocol;
    private final TrafficDirection direction;
    private final int durationSeconds;
    private final long targetBitrateBps;
    private final double bitrateToleranceFraction;
    private final int timingAdvance;
    private final TimeAlignmentCalibration timeAlignmentCalibration;
    private final ArtifactPolicy artifactPolicy;
    private final boolean pcap;

    private ScenarioParameters(Builder b) {
        this.band = requirePositive(b.band, "band");
        this.subcarrierSpacingKHz = requirePositive(b.subcarrierSpacingKHz, "subcarrierSpacingKHz");
        this.bandwidthMHz = requirePositive(b.bandwidthMHz, "bandwidthMHz");
        if (b.sampleRateHz != null && b.sampleRateHz <= 0) {
            throw new IllegalArgumentException("sampleRateHz must be > 0, but was: " + b.sampleRateHz);
        }
        this.sampleRateHz = b.sampleRateHz;
        this.protocol = Objects.requireNonNull(b.protocol, "protocol must not be null");
        this.direction = Objects.requireNonNull(b.direction, "direction must not be null");
        this.durationSeconds = requirePositive(b.durationSeconds, "durationSeconds");
        if (b.targetBitrateBps <= 0) {
            throw new IllegalArgumentException("targetBitrateBps must be > 0, but was: " + b.targetBitrateBps);
        }
        this.targetBitrateBps = b.targetBitrateBps;
        if (Double.isNaN(b.bitrateToleranceFraction)
                || b.bitrateToleranceFraction < 0.0
                || b.bitrateToleranceFraction > 1.0) {
            throw new IllegalArgumentException("bitrateToleranceFraction must be in [0,1], but was: " + b.bitrateToleranceFraction);
        }
        this.bitrateToleranceFraction = b.bitrateToleranceFraction;
        if (b.timingAdvance < TIMING_ADVANCE_AUTO) {
            throw new IllegalArgumentException("timingAdvance must be >= -1, but was: " + b.timingAdvance);
        }
        this.timingAdvance = b.timingAdvance;
        this.timeAlignmentCalibration = Objects.requireNonNull(b.timeAlignmentCalibration, "timeAlignmentCalibration must not be null");
        this.artifactPolicy = Objects.requireNonNull(b.artifactPolicy, "artifactPolicy must not be null");
        this.pcap = b.pcap;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .band(band)
                .subcarrierSpacingKHz(subcarrierSpacingKHz)
                .bandwidthMHz(bandwidthMHz)
                .sampleRateHz(sampleRateHz)
                .protocol(protocol)
                .direction(direction)
                .durationSeconds(durationSeconds)
                .targetBitrateBps(targetBitrateBps)
                .bitrateToleranceFraction(bitrateToleranceFraction)
                .timingAdvance(timingAdvance)
                .timeAlignmentCalibration(timeAlignmentCalibration)
                .artifactPolicy(artifactPolicy)
                .pcap(pcap);
    }

    public int getBand() {
        return band;
    }

    public int getSubcarrierSpacingKHz() {
        return subcarrierSpacingKHz;
    }

    public int getBandwidthMHz() {
        return bandwidthMHz;
    }

    /**
     * @return 비어 있으면 test bed가 기본값을 고른다.
     */
    public OptionalInt getSampleRateHz() {
        return sampleRateHz == null ? OptionalInt.empty() : OptionalInt.of(sampleRateHz);
    }

    public TrafficProtocol getProtocol() {
        return protocol;
    }

    public TrafficDirection getDirection() {
        return direction;
    }

    public int getDurationSeconds() {
        return durationSeconds;
    }

    public Duration getDuration() {
        return Duration.ofSeconds(durationSeconds);
    }

    public long getTargetBitrateBps() {
        return targetBitrateBps;
    }

    public double getBitrateToleranceFraction() {
        return bitrateToleranceFraction;
    }

    /** tolerance가 0이면 측정 bitrate와 무관하게 전송 성공 여부만 본다. */
    public boolean isBitrateCheckEnabled() {
        return bitrateToleranceFraction > 0.0;
    }

    public int getTimingAdvance() {
        return timingAdvance;
    }

    public TimeAlignmentCalibration getTimeAlignmentCalibration() {
        return timeAlignmentCalibration;
    }

    public ArtifactPolicy getArtifactPolicy() {
        return artifactPolicy;
    }

    public boolean isPcap() {
        return pcap;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScenarioParameters that)) return false;
        return band == that.band
                && subcarrierSpacingKHz == that.subcarrierSpacingKHz
                && bandwidthMHz == that.bandwidthMHz
                && durationSeconds == that.durationSeconds
                && targetBitrateBps == that.targetBitrateBps
                && Double.compare(bitrateToleranceFraction, that.bitrateToleranceFraction) == 0
                && timingAdvance == that.timingAdvance
                && pcap == that.pcap
                && Objects.equals(sampleRateHz, that.sampleRateHz)
                && protocol == that.protocol
                && direction == that.direction
                && timeAlignmentCalibration.equals(that.timeAlignmentCalibration)
                && artifactPolicy.equals(that.artifactPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(band, subcarrierSpacingKHz, bandwidthMHz, sampleRateHz, protocol, direction,
                durationSeconds, targetBitrateBps, bitrateToleranceFraction, timingAdvance,
                timeAlignmentCalibration, artifactPolicy, pcap);
    }

    @Override
    public String toString() {
        return "ScenarioParameters{band=" + band
                + ", scs=" + subcarrierSpacingKHz
                + ", bandwidth=" + bandwidthMHz
                + ", sampleRate=" + (sampleRateHz == null ? "default" : sampleRateHz)
                + ", protocol=" + protocol
                + ", direction=" + direction
                + ", duration=" + durationSeconds + "s"
                + ", bitrate=" + targetBitrateBps
                + ", tolerance=" + bitrateToleranceFraction
                + ", ta=" + timingAdvance
                + ", tac=" + timeAlignmentCalibration
                + ", artifacts=" + artifactPolicy
                + "}";
    }

    private static int requirePositive(int v, String name) {
        if (v <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, but was: " + v);
        }
        return v;
    }

    /**
     * 기본값:
     * - sampleRate: test bed 기본
     * - timingAdvance: 자동(-1), timeAlignmentCalibration: auto
     * - artifactPolicy: 수집 안 함
     * - tolerance: 0.1
     */
    public static final class Builder {

        private int band;
        private int subcarrierSpacingKHz;
        private int bandwidthMHz;
        private Integer sampleRateHz;
        private TrafficProtocol protocol;
        private TrafficDirection direction;
        private int durationSeconds = DurationTier.SHORT.seconds();
        private long targetBitrateBps;
        private double bitrateToleranceFraction = 0.1;
        private int timingAdvance = TIMING_ADVANCE_AUTO;
        private TimeAlignmentCalibration timeAlignmentCalibration = TimeAlignmentCalibration.AUTO;
        private ArtifactPolicy artifactPolicy = new ArtifactPolicy(false, false);
        private boolean pcap = false;

        private Builder() {
        }

        public Builder band(int band) {
            this.band = band;
            return this;
        }

        public Builder subcarrierSpacingKHz(int subcarrierSpacingKHz) {
            this.subcarrierSpacingKHz = subcarrierSpacingKHz;
            return this;
        }

        public Builder bandwidthMHz(int bandwidthMHz) {
            this.bandwidthMHz = bandwidthMHz;
            return this;
        }

        /** null이면 test bed 기본값 사용 */
        public Builder sampleRateHz(Integer sampleRateHz) {
            this.sampleRateHz = sampleRateHz;
            return this;
        }

        public Builder protocol(TrafficProtocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder direction(TrafficDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder durationSeconds(int durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder duration(DurationTier tier) {
            this.durationSeconds = tier.seconds();
            return this;
        }

        public Builder targetBitrateBps(long targetBitrateBps) {
            this.targetBitrateBps = targetBitrateBps;
            return this;
        }

        public Builder bitrateToleranceFraction(double bitrateToleranceFraction) {
            this.bitrateToleranceFraction = bitrateToleranceFraction;
            return this;
        }

        public Builder timingAdvance(int timingAdvance) {
            this.timingAdvance = timingAdvance;
            return this;
        }

        public Builder timeAlignmentCalibration(TimeAlignmentCalibration timeAlignmentCalibration) {
            this.timeAlignmentCalibration = timeAlignmentCalibration;
            return this;
        }

        public Builder artifactPolicy(ArtifactPolicy artifactPolicy) {
            this.artifactPolicy = artifactPolicy;
            return this;
        }

        public Builder pcap(boolean pcap) {
            this.pcap = pcap;
            return this;
        }

        public ScenarioParameters build() {
            return new ScenarioParameters(this);
        }
    }
}
