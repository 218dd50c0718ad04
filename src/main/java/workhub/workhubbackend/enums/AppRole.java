package workhub.workhubbackend.enums;

import lombok.Getter;

@Getter
public enum AppRole {
    SUPER_ADMIN("super_admin", ScopeType.GLOBAL),
    GENERAL_ADMIN("general_admin", ScopeType.WORKSPACE),
    WORKPLACE_SUPERVISOR("workplace_supervisor", ScopeType.WORKSPACE),
    FACILITY_SUPERVISOR("facility_supervisor", ScopeType.FACILITY),
    DEPARTMENT_HEAD("department_head", ScopeType.DEPARTMENT),
    STAFF("staff", ScopeType.SELF);

    private final String value;
    // 권한 판단에 사용하는 유일한 범위 포인터의 종류
    private final ScopeType authoritativeScope;

    AppRole(String value, ScopeType authoritativeScope) {
        this.value = value;
        this.authoritativeScope = authoritativeScope;
    }

    /**
     * 조직 단위 포인터가 반드시 있어야 하는 역할인지 여부
     */
    public boolean requiresScopePointer() {
        return authoritativeScope.isOrgUnit();
    }

    public boolean isManagerial() {
        return authoritativeScope != ScopeType.SELF;
    }

    public static AppRole fromValue(String value) {
        for (AppRole role : AppRole.values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role value: " + value);
    }
}
