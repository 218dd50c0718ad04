package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.Workspace;

@Repository
public interface WorkspaceRepository extends JpaRepository<Workspace, String> {
}
