package com.ryuqq.taskqueue.core.executor;

/**
 * drain 시 슬롯이 가득 찼을 때의 대기 방식.
 *
 * <p>두 방식 모두 동시 실행 수 상한과 공급 순서를 보장합니다. 차이는 제출 루프가 어떻게 멈추는가입니다.</p>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public enum DrainMode {

    /**
     * 자기 보충(self-feeding) 방식.
     *
     * <p>제출 루프는 슬롯이 가득 차면 즉시 빠져나오고, 작업이 종료될 때마다
     * 종료 콜백이 다음 요소를 admit합니다. 종료 후 추가된 큐 요소도 다음 보충에서 처리됩니다.</p>
     */
    DEFAULT,

    /**
     * race 방식.
     *
     * <p>슬롯이 가득 차면 in-flight 작업 중 하나가 종료될 때까지 제출 루프가 대기한 뒤 계속합니다.
     * 공급자가 처음 empty를 반환하면 제출을 끝냅니다.</p>
     */
    RACE
}
