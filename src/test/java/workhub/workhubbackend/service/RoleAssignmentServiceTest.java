package workhub.workhubbackend.service;

import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import workhub.workhubbackend.dto.request.AssignRoleRequestDto;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;
import workhub.workhubbackend.enums.ScopeType;
import workhub.workhubbackend.exception.ModuleAccessDeniedException;
import workhub.workhubbackend.repository.mysql.UserRoleRepository;
import workhub.workhubbackend.service.access.ModuleAccessGuard;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoleAssignmentServiceTest {

    @Mock
    private UserRoleRepository userRoleRepository;
    @Mock
    private OrganizationService organizationService;
    @Mock
    private ModuleAccessGuard moduleAccessGuard;

    @InjectMocks
    private RoleAssignmentService roleAssignmentService;

    private void givenSuperAdmin(String adminId) {
        when(userRoleRepository.findByUserIdOrderByIdAsc(adminId))
                .thenReturn(List.of(new UserRoleEntity(adminId, AppRole.SUPER_ADMIN, null, null, null)));
    }

    @Test
    @DisplayName("super_admin은 부서장 역할을 부여할 수 있다")
    void superAdminAssignsDepartmentHead() {
        givenSuperAdmin("root");
        when(userRoleRepository.findByUserIdOrderByIdAsc("u1")).thenReturn(List.of());
        when(userRoleRepository.save(any(UserRoleEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserRoleEntity saved = roleAssignmentService.assignRole("root",
                new AssignRoleRequestDto("u1", "department_head", "W1", "F1", "D42"));

        assertThat(saved.getRole()).isEqualTo(AppRole.DEPARTMENT_HEAD);
        assertThat(saved.getAuthoritativeScopeId()).isEqualTo("D42");
        assertThat(saved.getCreatedBy()).isEqualTo("root");
        verify(organizationService).requireExists(ScopeType.DEPARTMENT, "D42");
    }

    @Test
    @DisplayName("권한 포인터 없이 관리 역할을 부여하면 거부된다")
    void rejectsMissingAuthoritativePointer() {
        givenSuperAdmin("root");

        assertThatThrownBy(() -> roleAssignmentService.assignRole("root",
                new AssignRoleRequestDto("u1", "facility_supervisor", "W1", null, "D42")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("facility");
        verify(userRoleRepository, never()).save(any());
    }

    @Test
    @DisplayName("존재하지 않는 조직 단위를 가리키면 저장하지 않는다")
    void rejectsUnknownUnit() {
        givenSuperAdmin("root");
        doThrow(new EntityNotFoundException("부서를 찾을 수 없습니다: D99"))
                .when(organizationService).requireExists(ScopeType.DEPARTMENT, "D99");

        assertThatThrownBy(() -> roleAssignmentService.assignRole("root",
                new AssignRoleRequestDto("u1", "department_head", null, null, "D99")))
                .isInstanceOf(EntityNotFoundException.class);
        verify(userRoleRepository, never()).save(any());
    }

    @Test
    @DisplayName("같은 역할과 포인터가 이미 있으면 기존 할당을 반환한다")
    void duplicateAssignmentReturnsExisting() {
        givenSuperAdmin("root");
        UserRoleEntity existing = new UserRoleEntity("u1", AppRole.DEPARTMENT_HEAD, null, null, "D42");
        existing.setId(11L);
        when(userRoleRepository.findByUserIdOrderByIdAsc("u1")).thenReturn(List.of(existing));

        UserRoleEntity result = roleAssignmentService.assignRole("root",
                new AssignRoleRequestDto("u1", "department_head", null, null, "D42"));

        assertThat(result.getId()).isEqualTo(11L);
        verify(userRoleRepository, never()).save(any());
    }

    @Test
    @DisplayName("관리 권한이 없는 사용자는 역할을 부여할 수 없다")
    void nonAdminIsDenied() {
        when(userRoleRepository.findByUserIdOrderByIdAsc("u2")).thenReturn(List.of());
        when(moduleAccessGuard.check("u2", ModuleKey.USER_MANAGEMENT, Capability.ADMIN)).thenReturn(false);

        assertThatThrownBy(() -> roleAssignmentService.assignRole("u2",
                new AssignRoleRequestDto("u1", "staff", null, null, "D42")))
                .isInstanceOf(ModuleAccessDeniedException.class);
    }

    @Test
    @DisplayName("user_management 관리 권한이 있으면 역할을 회수할 수 있다")
    void moduleAdminRevokes() {
        when(userRoleRepository.findByUserIdOrderByIdAsc("hr")).thenReturn(List.of());
        when(moduleAccessGuard.check("hr", ModuleKey.USER_MANAGEMENT, Capability.ADMIN)).thenReturn(true);
        UserRoleEntity assignment = new UserRoleEntity("u1", AppRole.STAFF, null, null, "D42");
        when(userRoleRepository.findById(5L)).thenReturn(Optional.of(assignment));

        roleAssignmentService.revokeRole("hr", 5L);

        verify(userRoleRepository).delete(assignment);
    }
}
