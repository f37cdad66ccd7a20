/**
 * Worker runtime port.
 *
 * <p>이 패키지는 네트워크 작업을 실행하는 전용 실행 컨텍스트의 인터페이스를 제공합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code DedicatedWorkerRuntime}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.taskbridge.application.runtime;
