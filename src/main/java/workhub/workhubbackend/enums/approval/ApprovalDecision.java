package workhub.workhubbackend.enums.approval;

public enum ApprovalDecision {
    PENDING,    // 대기 중 (단계 생성 시 초기값)
    APPROVED,   // 승인
    REJECTED;   // 반려

    /**
     * 결재자가 보낸 결정 값 변환. approve/approved, reject/rejected 를 모두 받는다.
     */
    public static ApprovalDecision fromValue(String value) {
        if (value != null) {
            switch (value.trim().toLowerCase()) {
                case "approve":
                case "approved":
                    return APPROVED;
                case "reject":
                case "rejected":
                    return REJECTED;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("결정은 approve(d) 또는 reject(ed) 여야 합니다: " + value);
    }
}
