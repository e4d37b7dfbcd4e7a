package com.nori.tc.throughput.testbed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * EndpointSet
 *
 * - 순서 있는 UE 목록(1..N) + base station 1개 + core network 1개.
 * - 외부(fixture / test bed factory)가 만들어 넘겨주며, 코어는 attach/detach/stop 호출만 한다.
 * - UE id는 중복될 수 없다(detach 집계, 진단 로그의 키로 사용).
 */
public final class EndpointSet {

    private final List<UserEndpoint> userEndpoints;
    private final BaseStation baseStation;
    private final CoreNetwork coreNetwork;

    public EndpointSet(List<? extends UserEndpoint> userEndpoints, BaseStation baseStation, CoreNetwork coreNetwork) {
        Objects.requireNonNull(userEndpoints, "userEndpoints must not be null");
        if (userEndpoints.isEmpty()) {
            throw new IllegalArgumentException("userEndpoints must not be empty");
        }
        Set<String> ids = new HashSet<>();
        List<UserEndpoint> tmp = new ArrayList<>(userEndpoints.size());
        for (UserEndpoint ue : userEndpoints) {
            Objects.requireNonNull(ue, "userEndpoint must not be null");
            if (!ids.add(ue.getId())) {
                throw new IllegalArgumentException("duplicate user endpoint id: " + ue.getId());
            }
            tmp.add(ue);
        }
        this.userEndpoints = Collections.unmodifiableList(tmp);
        this.baseStation = Objects.requireNonNull(baseStation, "baseStation must not be null");
        this.coreNetwork = Objects.requireNonNull(coreNetwork, "coreNetwork must not be null");
    }

    public List<UserEndpoint> getUserEndpoints() {
        return userEndpoints;
    }

    public BaseStation getBaseStation() {
        return baseStation;
    }

    public CoreNetwork getCoreNetwork() {
        return coreNetwork;
    }

    public int size() {
        return userEndpoints.size();
    }
}
