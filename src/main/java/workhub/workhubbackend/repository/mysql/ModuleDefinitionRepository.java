package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.ModuleDefinition;

import java.util.List;

@Repository
public interface ModuleDefinitionRepository extends JpaRepository<ModuleDefinition, String> {

    List<ModuleDefinition> findByIsActiveTrue();
}
