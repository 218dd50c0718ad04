package workhub.workhubbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import workhub.workhubbackend.entity.mysql.Facility;

@Repository
public interface FacilityRepository extends JpaRepository<Facility, String> {
}
