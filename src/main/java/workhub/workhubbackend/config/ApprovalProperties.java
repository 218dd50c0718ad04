package workhub.workhubbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.enums.ScopeType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 결재 설정 (workhub.approval.*)
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "workhub.approval")
public class ApprovalProperties {

    // 요청 범위 종류별 결재 단계 (index 0 = 1단계)
    private Map<ScopeType, List<AppRole>> levels = defaultLevels();

    // submit 직후 1단계로 바로 라우팅할지 여부
    private boolean autoRoute = true;

    // 조직 단위에 min_staffing이 없을 때 사용하는 최소 근무 인원
    private int defaultMinCoverage = 1;

    public List<AppRole> levelsFor(ScopeType scopeType) {
        return levels.getOrDefault(scopeType, List.of());
    }

    private static Map<ScopeType, List<AppRole>> defaultLevels() {
        Map<ScopeType, List<AppRole>> defaults = new EnumMap<>(ScopeType.class);
        defaults.put(ScopeType.DEPARTMENT,
                List.of(AppRole.DEPARTMENT_HEAD, AppRole.FACILITY_SUPERVISOR, AppRole.WORKPLACE_SUPERVISOR));
        defaults.put(ScopeType.FACILITY, List.of(AppRole.FACILITY_SUPERVISOR, AppRole.WORKPLACE_SUPERVISOR));
        defaults.put(ScopeType.WORKSPACE, List.of(AppRole.WORKPLACE_SUPERVISOR));
        return defaults;
    }
}
