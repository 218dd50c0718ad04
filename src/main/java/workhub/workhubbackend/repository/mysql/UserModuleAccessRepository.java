package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.UserModuleAccess;

import java.util.List;

@Repository
public interface UserModuleAccessRepository extends JpaRepository<UserModuleAccess, Long> {

    List<UserModuleAccess> findByUserIdAndOverrideTrue(String userId);
}
