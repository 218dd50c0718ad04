package workhub.workhubbackend.service;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.config.CacheConfig;
import workhub.workhubbackend.dto.request.AssignRoleRequestDto;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;
import workhub.workhubbackend.exception.ModuleAccessDeniedException;
import workhub.workhubbackend.repository.mysql.UserRoleRepository;
import workhub.workhubbackend.service.access.ModuleAccessGuard;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 사용자 역할 할당 저장소. 한 사용자가 여러 역할을 동시에 가질 수 있다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleAssignmentService {

    private final UserRoleRepository userRoleRepository;
    private final OrganizationService organizationService;
    private final ModuleAccessGuard moduleAccessGuard;

    /**
     * 할당 ID 오름차순
     */
    @Cacheable(value = CacheConfig.USER_ROLE_CACHE, key = "#userId")
    @Transactional(readOnly = true)
    public List<UserRoleEntity> getAssignments(String userId) {
        log.debug("역할 할당 DB 조회: {}", userId);
        return userRoleRepository.findByUserIdOrderByIdAsc(userId);
    }

    @Transactional(readOnly = true)
    public boolean hasRole(String userId, AppRole role) {
        return userRoleRepository.findByUserIdOrderByIdAsc(userId).stream()
                .anyMatch(assignment -> assignment.getRole() == role);
    }

    /**
     * 역할 부여. 같은 사용자/역할/권한 단위가 이미 있으면 기존 행을 그대로 반환한다.
     */
    @Transactional
    @CacheEvict(value = CacheConfig.USER_ROLE_CACHE, key = "#request.userId")
    public UserRoleEntity assignRole(String adminId, AssignRoleRequestDto request) {
        validateAdminPermission(adminId);

        AppRole role = AppRole.fromValue(request.getRole());
        UserRoleEntity candidate = new UserRoleEntity(request.getUserId(), role,
                request.getWorkspaceId(), request.getFacilityId(), request.getDepartmentId());

        String authoritativeId = candidate.getAuthoritativeScopeId();
        if (role.requiresScopePointer()) {
            if (authoritativeId == null || authoritativeId.isBlank()) {
                throw new IllegalArgumentException(
                        role.getValue() + " 역할에는 " + role.getAuthoritativeScope().getValue() + " ID가 필요합니다.");
            }
            organizationService.requireExists(role.getAuthoritativeScope(), authoritativeId);
        }

        Optional<UserRoleEntity> existing = userRoleRepository.findByUserIdOrderByIdAsc(request.getUserId()).stream()
                .filter(assignment -> assignment.getRole() == role)
                .filter(assignment -> Objects.equals(assignment.getAuthoritativeScopeId(), authoritativeId))
                .findFirst();
        if (existing.isPresent()) {
            log.info("이미 존재하는 역할 할당: userId={}, role={}, scopeId={}", request.getUserId(), role.getValue(), authoritativeId);
            return existing.get();
        }

        candidate.setCreatedBy(adminId);
        UserRoleEntity saved = userRoleRepository.save(candidate);
        log.info("역할 부여 완료: userId={}, role={}, scopeId={}, by={}",
                saved.getUserId(), role.getValue(), authoritativeId, adminId);
        return saved;
    }

    @Transactional
    @CacheEvict(value = CacheConfig.USER_ROLE_CACHE, allEntries = true)
    public void revokeRole(String adminId, Long assignmentId) {
        validateAdminPermission(adminId);

        UserRoleEntity assignment = userRoleRepository.findById(assignmentId)
                .orElseThrow(() -> new EntityNotFoundException("역할 할당을 찾을 수 없습니다: " + assignmentId));
        userRoleRepository.delete(assignment);
        log.info("역할 회수 완료: userId={}, role={}, by={}",
                assignment.getUserId(), assignment.getRole().getValue(), adminId);
    }

    /**
     * super_admin 이거나 user_management 모듈 admin 권한이 있어야 한다.
     */
    private void validateAdminPermission(String adminId) {
        if (hasRole(adminId, AppRole.SUPER_ADMIN)) {
            return;
        }
        if (!moduleAccessGuard.check(adminId, ModuleKey.USER_MANAGEMENT, Capability.ADMIN)) {
            throw new ModuleAccessDeniedException(adminId, ModuleKey.USER_MANAGEMENT, Capability.ADMIN);
        }
    }
}
