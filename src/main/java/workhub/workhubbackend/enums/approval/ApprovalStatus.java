package workhub.workhubbackend.enums.approval;

public enum ApprovalStatus {
    DRAFT,              // 임시 저장
    SUBMITTED,          // 제출됨 (아직 1단계로 라우팅 전)
    IN_REVIEW,          // level_k_pending (currentLevel 참고)
    FULLY_APPROVED,     // 최종 승인
    REJECTED,           // 반려
    CANCELLED;          // 신청자 취소

    public boolean isTerminal() {
        return this == FULLY_APPROVED || this == REJECTED || this == CANCELLED;
    }

    /**
     * 신청자가 취소할 수 있는 상태인지 확인
     */
    public boolean isCancellable() {
        return this == DRAFT || this == SUBMITTED;
    }
}
