package workhub.workhubbackend.service.access;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.dto.response.UserModuleDto;
import workhub.workhubbackend.entity.mysql.ModuleDefinition;
import workhub.workhubbackend.entity.mysql.RoleModuleAccess;
import workhub.workhubbackend.entity.mysql.UserModuleAccess;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.entity.mysql.WorkspaceModuleAccess;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.repository.mysql.ModuleDefinitionRepository;
import workhub.workhubbackend.repository.mysql.RoleModuleAccessRepository;
import workhub.workhubbackend.repository.mysql.UserModuleAccessRepository;
import workhub.workhubbackend.repository.mysql.UserRoleRepository;
import workhub.workhubbackend.repository.mysql.WorkspaceModuleAccessRepository;
import workhub.workhubbackend.service.OrganizationService;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 모듈 카탈로그 테이블로 get_user_modules 를 계산한다.
 * 활성 모듈만, 개인 override 우선, 그 외에는 보유 역할 권한의 OR (워크스페이스에서 비활성화된 모듈 제외).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepositoryUserModuleGateway implements UserModuleGateway {

    private final ModuleDefinitionRepository moduleDefinitionRepository;
    private final RoleModuleAccessRepository roleModuleAccessRepository;
    private final WorkspaceModuleAccessRepository workspaceModuleAccessRepository;
    private final UserModuleAccessRepository userModuleAccessRepository;
    private final UserRoleRepository userRoleRepository;
    private final OrganizationService organizationService;

    @Override
    @Transactional(readOnly = true)
    public List<UserModuleDto> fetchUserModules(String userId) {
        List<ModuleDefinition> modules = moduleDefinitionRepository.findByIsActiveTrue();
        List<UserRoleEntity> assignments = userRoleRepository.findByUserIdOrderByIdAsc(userId);

        Map<String, UserModuleAccess> overrides = userModuleAccessRepository.findByUserIdAndOverrideTrue(userId).stream()
                .collect(Collectors.toMap(UserModuleAccess::getModuleId, Function.identity(), (first, second) -> first));

        Set<AppRole> roles = assignments.stream().map(UserRoleEntity::getRole).collect(Collectors.toSet());
        List<RoleModuleAccess> roleGrants = roles.isEmpty() ? List.of() : roleModuleAccessRepository.findByRoleIn(roles);

        // 할당별 소속 워크스페이스
        Map<Long, String> workspaceByAssignment = new HashMap<>();
        for (UserRoleEntity assignment : assignments) {
            workspaceOf(assignment).ifPresent(workspaceId -> workspaceByAssignment.put(assignment.getId(), workspaceId));
        }
        Map<String, Set<String>> disabledByWorkspace = new HashMap<>();
        if (!workspaceByAssignment.isEmpty()) {
            for (WorkspaceModuleAccess row : workspaceModuleAccessRepository.findByWorkspaceIdIn(new HashSet<>(workspaceByAssignment.values()))) {
                if (!row.isEnabled()) {
                    disabledByWorkspace.computeIfAbsent(row.getWorkspaceId(), key -> new HashSet<>()).add(row.getModuleId());
                }
            }
        }

        List<UserModuleDto> result = new ArrayList<>();
        for (ModuleDefinition module : modules) {
            UserModuleAccess override = overrides.get(module.getId());
            if (override != null) {
                result.add(toDto(module, override.isCanView(), override.isCanEdit(), override.isCanDelete(), override.isCanAdmin()));
                continue;
            }

            boolean granted = false;
            boolean view = false, edit = false, delete = false, admin = false;
            for (UserRoleEntity assignment : assignments) {
                String workspaceId = workspaceByAssignment.get(assignment.getId());
                if (workspaceId != null && disabledByWorkspace.getOrDefault(workspaceId, Set.of()).contains(module.getId())) {
                    continue;
                }
                for (RoleModuleAccess grant : roleGrants) {
                    if (grant.getRole() != assignment.getRole() || !grant.getModuleId().equals(module.getId())) {
                        continue;
                    }
                    granted = true;
                    view |= grant.isCanView();
                    edit |= grant.isCanEdit();
                    delete |= grant.isCanDelete();
                    admin |= grant.isCanAdmin();
                }
            }
            if (granted) {
                result.add(toDto(module, view, edit, delete, admin));
            }
        }
        log.debug("get_user_modules: userId={}, modules={}", userId, result.size());
        return result;
    }

    private Optional<String> workspaceOf(UserRoleEntity assignment) {
        AppRole role = assignment.getRole();
        if (role.requiresScopePointer()) {
            String scopeId = assignment.getAuthoritativeScopeId();
            if (scopeId == null) {
                log.warn("권한 포인터가 없는 역할 할당은 워크스페이스 판단에서 제외: id={}", assignment.getId());
                return Optional.empty();
            }
            return organizationService.ancestorOf(role.getAuthoritativeScope(), scopeId, ScopeType.WORKSPACE);
        }
        if (assignment.getWorkspaceId() != null) {
            return Optional.of(assignment.getWorkspaceId());
        }
        if (assignment.getDepartmentId() != null) {
            return organizationService.ancestorOf(ScopeType.DEPARTMENT, assignment.getDepartmentId(), ScopeType.WORKSPACE);
        }
        return Optional.empty();
    }

    private UserModuleDto toDto(ModuleDefinition module, boolean view, boolean edit, boolean delete, boolean admin) {
        return UserModuleDto.builder()
                .moduleId(module.getId())
                .moduleKey(module.getModuleKey())
                .moduleName(module.getName())
                .canView(view)
                .canEdit(edit)
                .canDelete(delete)
                .canAdmin(admin)
                .build();
    }
}
