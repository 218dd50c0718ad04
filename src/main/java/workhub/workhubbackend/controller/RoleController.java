package workhub.workhubbackend.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import workhub.workhubbackend.common.ResponseCode;
import workhub.workhubbackend.dto.request.AssignRoleRequestDto;
import workhub.workhubbackend.dto.response.ErrorResponseDto;
import workhub.workhubbackend.dto.response.ResolvedScope;
import workhub.workhubbackend.dto.response.RoleAssignmentResponseDto;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.service.RoleAssignmentService;
import workhub.workhubbackend.service.ScopeResolver;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/roles")
@RequiredArgsConstructor
public class RoleController {

    private final RoleAssignmentService roleAssignmentService;
    private final ScopeResolver scopeResolver;

    @GetMapping("/me")
    public ResponseEntity<List<RoleAssignmentResponseDto>> getMyRoles(Authentication authentication) {
        String userId = (String) authentication.getPrincipal();
        return ResponseEntity.ok(roleAssignmentService.getAssignments(userId).stream()
                .map(RoleAssignmentResponseDto::from)
                .toList());
    }

    /**
     * 대시보드 기본 범위 (같은 역할이 여러 개면 첫 번째)
     */
    @GetMapping("/me/scope")
    public ResponseEntity<?> getMyScope(@RequestParam String role, Authentication authentication) {
        String userId = (String) authentication.getPrincipal();
        Optional<ResolvedScope> scope = scopeResolver.resolveScope(userId, AppRole.fromValue(role));
        if (scope.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponseDto(ResponseCode.NOT_FOUND, role + " 역할이 없습니다."));
        }
        return ResponseEntity.ok(scope.get());
    }

    @GetMapping("/me/scopes")
    public ResponseEntity<List<ResolvedScope>> getMyScopes(@RequestParam String role, Authentication authentication) {
        String userId = (String) authentication.getPrincipal();
        return ResponseEntity.ok(scopeResolver.resolveAllScopes(userId, AppRole.fromValue(role)));
    }

    @PostMapping
    public ResponseEntity<RoleAssignmentResponseDto> assignRole(@Valid @RequestBody AssignRoleRequestDto request,
                                                                Authentication authentication) {
        String adminId = (String) authentication.getPrincipal();
        UserRoleEntity saved = roleAssignmentService.assignRole(adminId, request);
        return ResponseEntity.ok(RoleAssignmentResponseDto.from(saved));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> revokeRole(@PathVariable Long id, Authentication authentication) {
        String adminId = (String) authentication.getPrincipal();
        roleAssignmentService.revokeRole(adminId, id);
        return ResponseEntity.ok(Map.of("message", "역할 회수 완료", "id", id));
    }
}
