package io.worktrack.backend.technician;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TechnicianRepository extends JpaRepository<Technician, UUID> {

  List<Technician> findByIdIn(Collection<UUID> ids);

  List<Technician> findByStatusOrderByNameAsc(TechnicianStatus status);
}
