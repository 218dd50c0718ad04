package workhub.workhubbackend.enums;

import lombok.Getter;

import java.util.Optional;

/**
 * 관리자가 운영하는 기능 모듈 카탈로그 (module_definitions.key)
 */
@Getter
public enum ModuleKey {
    CORE("core"),
    USER_MANAGEMENT("user_management"),
    ORGANIZATION("organization"),
    STAFF_MANAGEMENT("staff_management"),
    VACATION_PLANNING("vacation_planning"),
    TASK_MANAGEMENT("task_management"),
    MESSAGING("messaging"),
    NOTIFICATIONS("notifications"),
    SCHEDULING("scheduling"),
    TRAINING("training");

    private final String key;

    ModuleKey(String key) {
        this.key = key;
    }

    /**
     * 카탈로그에 없는 키는 empty (호출 측에서 전부 false로 처리)
     */
    public static Optional<ModuleKey> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (ModuleKey moduleKey : ModuleKey.values()) {
            if (moduleKey.key.equals(key)) {
                return Optional.of(moduleKey);
            }
        }
        return Optional.empty();
    }
}
