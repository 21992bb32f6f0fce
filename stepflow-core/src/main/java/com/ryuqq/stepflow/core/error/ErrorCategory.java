package com.ryuqq.stepflow.core.error;

/**
 * 오류 분류.
 *
 * <ul>
 *   <li>VALIDATION: 잘못된 입력. 재시도/복구 불가, 호출자가 요청을 수정해야 함</li>
 *   <li>EXECUTION: 세션/스텝 수명주기 실패. 대부분 복구 및 재시도 가능</li>
 *   <li>SYSTEM: 용량/의존성 실패. 운영자 개입 또는 대기 후 재시도 필요</li>
 *   <li>INTEGRATION: 스트리밍/이벤트 전송 실패. 복구 및 재시도 가능</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCategory {
    VALIDATION,
    EXECUTION,
    SYSTEM,
    INTEGRATION
}
