package ru.tigran.quotaadmission.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.quotaadmission.model.QuotaConfiguration;

import java.util.Optional;

@Repository
public interface QuotaConfigurationRepository extends JpaRepository<QuotaConfiguration, Long> {
    Optional<QuotaConfiguration> findByResearchId(String researchId);
}
