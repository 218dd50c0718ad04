package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.UserRoleEntity;
import workhub.workhubbackend.enums.AppRole;

import java.util.Collection;
import java.util.List;

@Repository
public interface UserRoleRepository extends JpaRepository<UserRoleEntity, Long> {

    List<UserRoleEntity> findByUserIdOrderByIdAsc(String userId);

    List<UserRoleEntity> findByRoleOrderByIdAsc(AppRole role);

    boolean existsByRole(AppRole role);

    // 부서 집합에 속한 직원 수 (한 사람이 여러 행을 가져도 1명)
    @Query("SELECT COUNT(DISTINCT ur.userId) FROM UserRoleEntity ur " +
            "WHERE ur.role = workhub.workhubbackend.enums.AppRole.STAFF AND ur.departmentId IN :departmentIds")
    long countDistinctStaffByDepartmentIdIn(@Param("departmentIds") Collection<String> departmentIds);
}
