package workhub.workhubbackend.realtime;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * 변경 알림을 구독할 수 있는 레코드 종류와 해당 테이블
 */
@Getter
public enum EntityKind {
    ROLE_ASSIGNMENT(List.of("user_roles")),
    MODULE_GRANT(List.of("module_definitions", "role_module_access", "workspace_module_access", "user_module_access")),
    APPROVAL_REQUEST(List.of("approval_requests")),
    APPROVAL_STEP(List.of("approval_steps"));

    private final List<String> tables;

    EntityKind(List<String> tables) {
        this.tables = tables;
    }

    public static Optional<EntityKind> fromTable(String table) {
        for (EntityKind kind : EntityKind.values()) {
            if (kind.tables.contains(table)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
