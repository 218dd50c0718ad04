package workhub.workhubbackend.repository.mysql.approval;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.approval.ApprovalRequest;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.enums.approval.ApprovalStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, Long> {

    List<ApprovalRequest> findByRequesterIdOrderByCreatedAtDesc(String requesterId);

    /**
     * 같은 범위에서 기간이 겹치는 다른 요청. 반개구간 [start, end) 기준.
     */
    @Query("SELECT r FROM ApprovalRequest r " +
            "WHERE r.scopeType = :scopeType AND r.scopeId = :scopeId " +
            "AND r.status IN :statuses " +
            "AND r.id <> :excludeId " +
            "AND r.startDate < :endDate AND :startDate < r.endDate " +
            "ORDER BY r.startDate ASC, r.id ASC")
    List<ApprovalRequest> findOverlapping(@Param("scopeType") ScopeType scopeType,
                                          @Param("scopeId") String scopeId,
                                          @Param("statuses") Collection<ApprovalStatus> statuses,
                                          @Param("excludeId") Long excludeId,
                                          @Param("startDate") LocalDate startDate,
                                          @Param("endDate") LocalDate endDate);

    @Query("SELECT r FROM ApprovalRequest r WHERE r.status = :status ORDER BY r.submittedAt ASC")
    List<ApprovalRequest> findByStatusOrderBySubmittedAt(@Param("status") ApprovalStatus status);
}
