package com.ryuqq.taskbridge.core.executor;

/**
 * 워커에서 실행되는 작업 단위.
 *
 * <p>작업 단위는 외부 프로토콜 호출마다, 그리고 대량 작업의 항목마다
 * {@link JobContext}를 통해 취소 여부를 확인해야 합니다.
 * 던진 예외는 워커가 잡아 Job의 실패로 기록하며 런타임 밖으로 전파되지 않습니다.</p>
 *
 * @param <T> 결과 타입
 * @author TaskBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkUnit<T> {

    /**
     * 작업 실행.
     *
     * @param context 실행 중인 Job의 컨텍스트
     * @return 작업 결과 (null 가능)
     * @throws Exception 작업 실패. 종류별 처리는 워커가 결정
     */
    T execute(JobContext context) throws Exception;
}
