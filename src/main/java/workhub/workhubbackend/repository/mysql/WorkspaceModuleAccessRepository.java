package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.WorkspaceModuleAccess;

import java.util.Collection;
import java.util.List;

@Repository
public interface WorkspaceModuleAccessRepository extends JpaRepository<WorkspaceModuleAccess, Long> {

    List<WorkspaceModuleAccess> findByWorkspaceIdIn(Collection<String> workspaceIds);
}
