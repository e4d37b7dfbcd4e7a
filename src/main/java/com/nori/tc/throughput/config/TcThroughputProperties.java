package com.nori.tc.throughput.config;

import com.nori.tc.throughput.scenario.ScenarioCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * tc.throughput.*
 *
 * 목적:
 * - throughput e2e 실행 설정을 하나의 루트로 바인딩한다.
 * - 타임아웃/tolerance 기본값, 최소 sample rate 테이블, 시뮬레이션 test bed, suite 선택을 포함한다.
 *
 * 주의:
 * - 설정 키 구조는 이 클래스의 필드 구조를 그대로 따른다.
 * - 참조 무결성(ANDROID 대역폭의 sample rate 누락 등)은 ScenarioCatalog 생성 시 검증한다.
 */
@ConfigurationProperties(prefix = "tc.throughput")
public class TcThroughputProperties {

    private Defaults defaults = new Defaults();

    /**
     * 채널 대역폭(MHz) → 최소 sample rate(Hz)
     * - key: bandwidthMHz (예: 10)
     */
    private Map<Integer, Integer> sampleRates = new LinkedHashMap<>();

    private Testbed testbed = new Testbed();

    private Suite suite = new Suite();

    // getters/setters

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Map<Integer, Integer> getSampleRates() {
        return sampleRates;
    }

    public void setSampleRates(Map<Integer, Integer> sampleRates) {
        this.sampleRates = sampleRates;
    }

    public Testbed getTestbed() {
        return testbed;
    }

    public void setTestbed(Testbed testbed) {
        this.testbed = testbed;
    }

    public Suite getSuite() {
        return suite;
    }

    public void setSuite(Suite suite) {
        this.suite = suite;
    }

    /**
     * 공통 기본값 그룹
     *
     * - measurementGraceSec: 측정 제한 시간 = duration + grace
     * - attachTimeoutSec: UE 1대당 attach 허용 시간
     * - detachTimeoutSec: teardown에서 detach 전체를 기다리는 시간
     * - toleranceFraction: family에서 따로 정하지 않은 bitrate tolerance
     */
    public static class Defaults {

        private long measurementGraceSec = 30;

        private long attachTimeoutSec = 60;

        private long detachTimeoutSec = 30;

        private double toleranceFraction = 0.1;

        public long getMeasurementGraceSec() {
            return measurementGraceSec;
        }

        public void setMeasurementGraceSec(long measurementGraceSec) {
            this.measurementGraceSec = measurementGraceSec;
        }

        public long getAttachTimeoutSec() {
            return attachTimeoutSec;
        }

        public void setAttachTimeoutSec(long attachTimeoutSec) {
            this.attachTimeoutSec = attachTimeoutSec;
        }

        public long getDetachTimeoutSec() {
            return detachTimeoutSec;
        }

        public void setDetachTimeoutSec(long detachTimeoutSec) {
            this.detachTimeoutSec = detachTimeoutSec;
        }

        public double getToleranceFraction() {
            return toleranceFraction;
        }

        public void setToleranceFraction(double toleranceFraction) {
            this.toleranceFraction = toleranceFraction;
        }
    }

    /**
     * 시뮬레이션(loopback) test bed
     */
    public static class Testbed {

        /** 코어가 UE에 할당하는 주소 prefix */
        private String ueAddressPrefix = "10.45.1.";

        private long attachDelayMs = 50;

        private List<Integer> supportedBands = new ArrayList<>(List.of(3, 7, 41, 78));

        /** 트래픽 sink bind 주소 */
        private String sinkHost = "127.0.0.1";

        /** 0이면 Netty 기본값 */
        private int ioThreads = 0;

        private long drainMs = 200;

        public String getUeAddressPrefix() {
            return ueAddressPrefix;
        }

        public void setUeAddressPrefix(String ueAddressPrefix) {
            this.ueAddressPrefix = ueAddressPrefix;
        }

        public long getAttachDelayMs() {
            return attachDelayMs;
        }

        public void setAttachDelayMs(long attachDelayMs) {
            this.attachDelayMs = attachDelayMs;
        }

        public List<Integer> getSupportedBands() {
            return supportedBands;
        }

        public void setSupportedBands(List<Integer> supportedBands) {
            this.supportedBands = supportedBands;
        }

        public String getSinkHost() {
            return sinkHost;
        }

        public void setSinkHost(String sinkHost) {
            this.sinkHost = sinkHost;
        }

        public int getIoThreads() {
            return ioThreads;
        }

        public void setIoThreads(int ioThreads) {
            this.ioThreads = ioThreads;
        }

        public long getDrainMs() {
            return drainMs;
        }

        public void setDrainMs(long drainMs) {
            this.drainMs = drainMs;
        }
    }

    /**
     * 기동 시 suite 실행
     */
    public static class Suite {

        private boolean enabled = false;

        /** 비어 있으면 전체 분류 */
        private List<ScenarioCategory> categories = new ArrayList<>(List.of(ScenarioCategory.SMOKE));

        /** 시나리오 id 부분 일치 정규식. 비어 있으면 필터 없음 */
        private String idPattern;

        /** 완료 후 프로세스 종료 (실패/에러가 있으면 exit code 1) */
        private boolean exitOnCompletion = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ScenarioCategory> getCategories() {
            return categories;
        }

        public void setCategories(List<ScenarioCategory> categories) {
            this.categories = categories;
        }

        public String getIdPattern() {
            return idPattern;
        }

        public void setIdPattern(String idPattern) {
            this.idPattern = idPattern;
        }

        public boolean isExitOnCompletion() {
            return exitOnCompletion;
        }

        public void setExitOnCompletion(boolean exitOnCompletion) {
            this.exitOnCompletion = exitOnCompletion;
        }
    }
}
