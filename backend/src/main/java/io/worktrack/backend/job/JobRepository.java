package io.worktrack.backend.job;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JobRepository extends JpaRepository<Job, UUID> {

  Optional<Job> findFirstByExternalUrl(String externalUrl);

  Optional<Job> findFirstByPlatformIdAndPlatformJobCode(UUID platformId, String platformJobCode);

  List<Job> findByIdIn(Collection<UUID> ids);

  List<Job> findByJobDateBetweenOrderByJobDateDescTicketNumberAsc(
      LocalDate fromDate, LocalDate toDate);
}
