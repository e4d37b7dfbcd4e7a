package com.nori.tc.throughput.testbed;

/**
 * UE 핸들.
 *
 * - attach: base station / core network에 등록하고 할당 정보를 돌려준다.
 *   호출 스레드가 interrupt되면 시도를 포기해야 한다(타임아웃 취소).
 * - detach: best-effort. 실패 시 DetachException.
 */
public interface UserEndpoint {

    String getId();

    AttachInfo attach(BaseStation baseStation, CoreNetwork coreNetwork);

    void detach();
}
