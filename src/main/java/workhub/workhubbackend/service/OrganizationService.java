package workhub.workhubbackend.service;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workhub.workhubbackend.config.ApprovalProperties;
import workhub.workhubbackend.config.CacheConfig;
import workhub.workhubbackend.entity.mysql.Department;
import workhub.workhubbackend.entity.mysql.Facility;
import workhub.workhubbackend.entity.mysql.Workspace;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.repository.mysql.DepartmentRepository;
import workhub.workhubbackend.repository.mysql.FacilityRepository;
import workhub.workhubbackend.repository.mysql.UserRoleRepository;
import workhub.workhubbackend.repository.mysql.WorkspaceRepository;

import java.util.List;
import java.util.Optional;

/**
 * 조직 계층 (Workspace ⊃ Facility ⊃ Department) 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrganizationService {

    private final WorkspaceRepository workspaceRepository;
    private final FacilityRepository facilityRepository;
    private final DepartmentRepository departmentRepository;
    private final UserRoleRepository userRoleRepository;
    private final ApprovalProperties approvalProperties;

    /**
     * scopeType/scopeId 조직 단위의 targetType 상위 단위 ID.
     * 같은 종류면 자기 자신, targetType이 더 하위이거나 조직 단위가 아니면 empty.
     */
    @Cacheable(value = CacheConfig.ORG_UNIT_CACHE,
            key = "'ancestor:' + #scopeType + ':' + #scopeId + ':' + #targetType")
    public Optional<String> ancestorOf(ScopeType scopeType, String scopeId, ScopeType targetType) {
        if (!scopeType.isOrgUnit() || !targetType.isOrgUnit() || targetType.getDepth() > scopeType.getDepth()) {
            return Optional.empty();
        }
        return switch (scopeType) {
            case DEPARTMENT -> departmentAncestor(findDepartment(scopeId), targetType);
            case FACILITY -> {
                Facility facility = findFacility(scopeId);
                yield Optional.of(targetType == ScopeType.FACILITY ? facility.getId() : facility.getWorkspaceId());
            }
            default -> Optional.of(findWorkspace(scopeId).getId());
        };
    }

    private Optional<String> departmentAncestor(Department department, ScopeType targetType) {
        return switch (targetType) {
            case DEPARTMENT -> Optional.of(department.getId());
            case FACILITY -> Optional.of(department.getFacilityId());
            default -> Optional.of(findFacility(department.getFacilityId()).getWorkspaceId());
        };
    }

    /**
     * 조직 단위가 존재하는지 확인 (없으면 EntityNotFoundException)
     */
    public void requireExists(ScopeType scopeType, String scopeId) {
        switch (scopeType) {
            case WORKSPACE -> findWorkspace(scopeId);
            case FACILITY -> findFacility(scopeId);
            case DEPARTMENT -> findDepartment(scopeId);
            default -> throw new IllegalArgumentException("조직 단위가 아닌 범위입니다: " + scopeType.getValue());
        }
    }

    public List<String> departmentIdsWithin(ScopeType scopeType, String scopeId) {
        return switch (scopeType) {
            case DEPARTMENT -> List.of(findDepartment(scopeId).getId());
            case FACILITY -> departmentRepository.findByFacilityId(findFacility(scopeId).getId()).stream()
                    .map(Department::getId)
                    .toList();
            case WORKSPACE -> departmentRepository.findIdsByWorkspaceId(findWorkspace(scopeId).getId());
            default -> throw new IllegalArgumentException("조직 단위가 아닌 범위입니다: " + scopeType.getValue());
        };
    }

    /**
     * 범위 내 직원 수 (staff 역할 할당의 부서가 범위 안에 있는 사용자)
     */
    public long staffCount(ScopeType scopeType, String scopeId) {
        List<String> departmentIds = departmentIdsWithin(scopeType, scopeId);
        if (departmentIds.isEmpty()) {
            return 0;
        }
        return userRoleRepository.countDistinctStaffByDepartmentIdIn(departmentIds);
    }

    public int minimumCoverage(ScopeType scopeType, String scopeId) {
        Integer configured = switch (scopeType) {
            case DEPARTMENT -> findDepartment(scopeId).getMinStaffing();
            case FACILITY -> findFacility(scopeId).getMinStaffing();
            case WORKSPACE -> findWorkspace(scopeId).getMinStaffing();
            default -> null;
        };
        return configured != null ? configured : approvalProperties.getDefaultMinCoverage();
    }

    private Workspace findWorkspace(String workspaceId) {
        return workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new EntityNotFoundException("워크스페이스를 찾을 수 없습니다: " + workspaceId));
    }

    private Facility findFacility(String facilityId) {
        return facilityRepository.findById(facilityId)
                .orElseThrow(() -> new EntityNotFoundException("시설을 찾을 수 없습니다: " + facilityId));
    }

    private Department findDepartment(String departmentId) {
        return departmentRepository.findById(departmentId)
                .orElseThrow(() -> new EntityNotFoundException("부서를 찾을 수 없습니다: " + departmentId));
    }
}
