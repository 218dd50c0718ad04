package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.RoleModuleAccess;
import workhub.workhubbackend.enums.AppRole;

import java.util.Collection;
import java.util.List;

@Repository
public interface RoleModuleAccessRepository extends JpaRepository<RoleModuleAccess, Long> {

    List<RoleModuleAccess> findByRoleIn(Collection<AppRole> roles);
}
