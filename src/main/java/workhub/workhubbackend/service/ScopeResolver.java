package workhub.workhubbackend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import workhub.workhubbackend.dto.response.ResolvedScope;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.exception.ScopeResolutionException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 역할 할당에서 유효 범위를 계산한다. 권한 판단에는 역할별 권한 포인터만 사용한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScopeResolver {

    private final RoleAssignmentService roleAssignmentService;
    private final OrganizationService organizationService;

    /**
     * 대시보드 기본 범위. 같은 역할이 여러 개면 할당 ID가 가장 작은 것.
     */
    public Optional<ResolvedScope> resolveScope(String userId, AppRole role) {
        return resolveAllScopes(userId, role).stream().findFirst();
    }

    /**
     * 해당 역할로 관리하는 모든 범위 (할당 ID 순)
     */
    public List<ResolvedScope> resolveAllScopes(String userId, AppRole role) {
        return roleAssignmentService.getAssignments(userId).stream()
                .filter(assignment -> assignment.getRole() == role)
                .map(this::toScope)
                .toList();
    }

    /**
     * 관리 역할 전체에 대한 범위 합집합
     */
    public List<ResolvedScope> managedScopes(String userId) {
        return roleAssignmentService.getAssignments(userId).stream()
                .filter(assignment -> assignment.getRole().isManagerial())
                .map(this::toScope)
                .toList();
    }

    /**
     * 관리자 범위가 대상 조직 단위를 포함하는지 확인 (대상의 상위 단위 비교)
     */
    public boolean covers(ResolvedScope managerScope, ScopeType targetType, String targetId) {
        if (managerScope.isGlobal()) {
            return true;
        }
        ScopeType managerType = managerScope.getScopeType();
        if (!managerType.isOrgUnit() || managerType.getDepth() > targetType.getDepth()) {
            return false;
        }
        return organizationService.ancestorOf(targetType, targetId, managerType)
                .map(ancestorId -> Objects.equals(ancestorId, managerScope.getScopeId()))
                .orElse(false);
    }

    /**
     * 사용자가 해당 역할로 대상 조직 단위를 관리하는지 (할당 중 하나라도 포함하면 true)
     */
    public boolean canActOn(String userId, AppRole role, ScopeType targetType, String targetId) {
        return resolveAllScopes(userId, role).stream()
                .anyMatch(scope -> covers(scope, targetType, targetId));
    }

    public ResolvedScope toScope(UserRoleEntity assignment) {
        AppRole role = assignment.getRole();
        ScopeType scopeType = role.getAuthoritativeScope();
        if (scopeType == ScopeType.GLOBAL) {
            return new ResolvedScope(ScopeType.GLOBAL, null, role, assignment.getId());
        }
        if (scopeType == ScopeType.SELF) {
            return new ResolvedScope(ScopeType.SELF, assignment.getUserId(), role, assignment.getId());
        }
        String scopeId = assignment.getAuthoritativeScopeId();
        if (scopeId == null || scopeId.isBlank()) {
            log.warn("권한 포인터가 비어 있는 역할 할당: id={}, userId={}, role={}",
                    assignment.getId(), assignment.getUserId(), role.getValue());
            throw new ScopeResolutionException(assignment.getUserId(), role, assignment.getId());
        }
        return new ResolvedScope(scopeType, scopeId, role, assignment.getId());
    }
}
