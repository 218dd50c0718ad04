package workhub.workhubbackend.common;

public interface ResponseCode {

    // 유효성 검사 실패를 나타내는 코드
    String VALIDATION_FAIL = "VF";

    // 대상 레코드가 없음
    String NOT_FOUND = "NF";

    // 인증 실패 (토큰 없음/만료/위조)
    String AUTHENTICATION_FAIL = "AF";

    // 데이터베이스 오류를 나타내는 코드
    String DATABASE_ERROR = "DBE";

    // 역할 할당의 권한 범위 포인터가 비어 있음 (데이터 무결성 오류)
    String SCOPE_RESOLUTION_ERROR = "SRE";

    // 모듈 권한 없음
    String MODULE_ACCESS_DENIED = "MAD";

    // 결재 범위 밖의 요청
    String SCOPE_ACCESS_DENIED = "SAD";

    // 신청자 본인만 가능한 작업
    String NOT_REQUESTER = "NR";

    // 허용되지 않는 상태 전이 (순서 위반 등)
    String INVALID_TRANSITION = "IT";

    // 이미 결정된 단계
    String DUPLICATE_DECISION = "DD";

    // 이미 종료된 요청
    String REQUEST_ALREADY_TERMINAL = "RT";

    // 해당 단계 결재자가 없음
    String NO_APPROVER_CONFIGURED = "NAC";
}
