package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.Department;

import java.util.List;

@Repository
public interface DepartmentRepository extends JpaRepository<Department, String> {

    List<Department> findByFacilityId(String facilityId);

    // 사업장 하위 모든 부서 ID
    @Query("SELECT d.id FROM Department d, Facility f WHERE d.facilityId = f.id AND f.workspaceId = :workspaceId")
    List<String> findIdsByWorkspaceId(@Param("workspaceId") String workspaceId);
}
