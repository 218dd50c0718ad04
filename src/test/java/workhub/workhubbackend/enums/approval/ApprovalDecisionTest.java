package workhub.workhubbackend.enums.approval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApprovalDecisionTest {

    @Test
    @DisplayName("approve/reject 동사와 approved/rejected 상태명을 모두 받는다")
    void acceptsVerbAndStateSpellings() {
        assertThat(ApprovalDecision.fromValue("approve")).isEqualTo(ApprovalDecision.APPROVED);
        assertThat(ApprovalDecision.fromValue("approved")).isEqualTo(ApprovalDecision.APPROVED);
        assertThat(ApprovalDecision.fromValue(" Reject ")).isEqualTo(ApprovalDecision.REJECTED);
        assertThat(ApprovalDecision.fromValue("REJECTED")).isEqualTo(ApprovalDecision.REJECTED);
    }

    @Test
    @DisplayName("pending 이나 알 수 없는 값은 거부한다")
    void rejectsOtherValues() {
        assertThatThrownBy(() -> ApprovalDecision.fromValue("pending"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ApprovalDecision.fromValue(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
