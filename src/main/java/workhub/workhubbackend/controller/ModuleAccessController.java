package workhub.workhubbackend.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import workhub.workhubbackend.dto.response.ModuleAccessResponseDto;
import workhub.workhubbackend.enums.ModuleKey;
import workhub.workhubbackend.service.access.CapabilityFlags;
import workhub.workhubbackend.service.access.CapabilityMatrix;
import workhub.workhubbackend.service.access.ModuleAccessRegistry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/modules")
@RequiredArgsConstructor
public class ModuleAccessController {

    private final ModuleAccessRegistry moduleAccessRegistry;

    /**
     * 내 모듈 권한 전체
     */
    @GetMapping("/me")
    public ResponseEntity<?> getMyModules(Authentication authentication) {
        String userId = (String) authentication.getPrincipal();
        CapabilityMatrix matrix = moduleAccessRegistry.sessionFor(userId).ensureLoaded();
        return ResponseEntity.ok(toResponse(matrix));
    }

    /**
     * 모듈 하나의 권한. 카탈로그에 없는 키는 전부 false
     */
    @GetMapping("/me/{moduleKey}")
    public ResponseEntity<ModuleAccessResponseDto> getMyModule(@PathVariable String moduleKey, Authentication authentication) {
        String userId = (String) authentication.getPrincipal();
        CapabilityMatrix matrix = moduleAccessRegistry.sessionFor(userId).ensureLoaded();
        CapabilityFlags flags = ModuleKey.fromKey(moduleKey)
                .map(matrix::flags)
                .orElse(CapabilityFlags.NONE);
        return ResponseEntity.ok(toDto(moduleKey, flags));
    }

    @PostMapping("/me/reload")
    public ResponseEntity<?> reload(Authentication authentication) {
        String userId = (String) authentication.getPrincipal();
        CapabilityMatrix matrix = moduleAccessRegistry.reload(userId).join();
        return ResponseEntity.ok(toResponse(matrix));
    }

    /**
     * 로그아웃 시 세션 해제 (구독 정리)
     */
    @DeleteMapping("/me/session")
    public ResponseEntity<Void> releaseSession(Authentication authentication) {
        moduleAccessRegistry.release((String) authentication.getPrincipal());
        return ResponseEntity.noContent().build();
    }

    private Map<String, Object> toResponse(CapabilityMatrix matrix) {
        List<ModuleAccessResponseDto> modules = matrix.getGrants().entrySet().stream()
                .map(entry -> toDto(entry.getKey().getKey(), entry.getValue()))
                .toList();
        Map<String, Object> response = new HashMap<>();
        response.put("modules", modules);
        response.put("violations", matrix.getViolations());
        return response;
    }

    private ModuleAccessResponseDto toDto(String moduleKey, CapabilityFlags flags) {
        return ModuleAccessResponseDto.builder()
                .moduleKey(moduleKey)
                .canView(flags.isView())
                .canEdit(flags.isEdit())
                .canDelete(flags.isDelete())
                .canAdmin(flags.isAdmin())
                .build();
    }
}
