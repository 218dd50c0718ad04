package workhub.workhubbackend.enums;

import lombok.Getter;

/**
 * 조직 범위 종류. WORKSPACE ⊃ FACILITY ⊃ DEPARTMENT 순서로 depth가 깊어진다.
 */
@Getter
public enum ScopeType {
    GLOBAL("global", 0),        // 전체 (super_admin)
    WORKSPACE("workspace", 1),
    FACILITY("facility", 2),
    DEPARTMENT("department", 3),
    SELF("self", 4);            // 관리 범위 없음 (staff)

    private final String value;
    private final int depth;

    ScopeType(String value, int depth) {
        this.value = value;
        this.depth = depth;
    }

    /**
     * 실제 조직 단위(워크스페이스/시설/부서)인지 여부
     */
    public boolean isOrgUnit() {
        return this == WORKSPACE || this == FACILITY || this == DEPARTMENT;
    }

    public static ScopeType fromValue(String value) {
        for (ScopeType type : ScopeType.values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scope type: " + value);
    }
}
