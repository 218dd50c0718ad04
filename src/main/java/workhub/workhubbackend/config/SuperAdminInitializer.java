package workhub.workhubbackend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.enums.AppRole;
import workhub.workhubbackend.repository.mysql.UserRoleRepository;

/**
 * 애플리케이션 시작 시 super_admin 역할이 하나도 없으면 설정된 사용자에게 부여
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SuperAdminInitializer implements ApplicationRunner {

    private final UserRoleRepository userRoleRepository;

    @Value("${workhub.bootstrap.super-admin-id:}")
    private String superAdminId;

    @Override
    public void run(ApplicationArguments args) {
        if (superAdminId == null || superAdminId.isBlank()) {
            log.debug("super_admin 초기화 대상이 설정되지 않았습니다.");
            return;
        }
        if (userRoleRepository.existsByRole(AppRole.SUPER_ADMIN)) {
            return;
        }
        UserRoleEntity superAdmin = new UserRoleEntity(superAdminId, AppRole.SUPER_ADMIN, null, null, null);
        superAdmin.setCreatedBy("system");
        userRoleRepository.save(superAdmin);
        log.info("✅ super_admin 역할 부여: {}", superAdminId);
    }
}
