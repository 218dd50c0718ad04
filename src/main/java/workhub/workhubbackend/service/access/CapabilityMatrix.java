package workhub.workhubbackend.service.access;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import workhub.workhubbackend.enums.Capability;
import workhub.workhubbackend.enums.ModuleKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 사용자별 모듈 권한 매트릭스. 행이 없는 모듈은 전부 false.
 * 불일치 항목(view 없이 edit/delete/admin)은 기록만 하고 보정하지 않는다.
 */
@ToString
@EqualsAndHashCode(of = "grants")
public final class CapabilityMatrix {

    private static final CapabilityMatrix EMPTY = new CapabilityMatrix(new EnumMap<>(ModuleKey.class), List.of());

    private final Map<ModuleKey, CapabilityFlags> grants;
    private final List<String> violations;

    public CapabilityMatrix(Map<ModuleKey, CapabilityFlags> grants, List<String> violations) {
        EnumMap<ModuleKey, CapabilityFlags> copy = new EnumMap<>(ModuleKey.class);
        copy.putAll(grants);
        this.grants = Collections.unmodifiableMap(copy);
        this.violations = List.copyOf(violations);
    }

    public static CapabilityMatrix empty() {
        return EMPTY;
    }

    public CapabilityFlags flags(ModuleKey moduleKey) {
        return grants.getOrDefault(moduleKey, CapabilityFlags.NONE);
    }

    public boolean allows(ModuleKey moduleKey, Capability capability) {
        return flags(moduleKey).allows(capability);
    }

    public Map<ModuleKey, CapabilityFlags> getGrants() {
        return grants;
    }

    public List<String> getViolations() {
        return violations;
    }

    public boolean isConsistent() {
        return violations.isEmpty();
    }
}
