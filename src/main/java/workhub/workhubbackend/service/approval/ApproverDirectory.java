package workhub.workhubbackend.service.approval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.exception.ScopeResolutionException;
import workhub.workhubbackend.repository.mysql.UserRoleRepository;
import workhub.workhubbackend.service.ScopeResolver;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 조직 단위와 역할로 결재 가능한 사용자 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApproverDirectory {

    private final UserRoleRepository userRoleRepository;
    private final ScopeResolver scopeResolver;

    @Transactional(readOnly = true)
    public List<String> findEligibleApprovers(AppRole role, ScopeType scopeType, String scopeId) {
        Set<String> approvers = new LinkedHashSet<>();
        for (UserRoleEntity assignment : userRoleRepository.findByRoleOrderByIdAsc(role)) {
            try {
                if (scopeResolver.covers(scopeResolver.toScope(assignment), scopeType, scopeId)) {
                    approvers.add(assignment.getUserId());
                }
            } catch (ScopeResolutionException e) {
                // 다른 사용자의 잘못된 할당 때문에 결재선 전체가 막히지 않도록 제외
                log.warn("결재자 후보에서 제외: {}", e.getMessage());
            }
        }
        return List.copyOf(approvers);
    }
}
