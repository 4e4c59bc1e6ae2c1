package com.medledger.consentservice.repository;

import com.medledger.consentservice.models.ConsentToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConsentTokenRepository extends JpaRepository<ConsentToken, String> {

    List<ConsentToken> findByPatientIdOrderByCreatedAtAsc(String patientId);

    List<ConsentToken> findByProviderIdOrderByCreatedAtAsc(String providerId);

    List<ConsentToken> findByPatientIdAndProviderIdOrderByCreatedAtAsc(String patientId, String providerId);

    List<ConsentToken> findByPatientIdAndProviderIdAndActiveTrueOrderByCreatedAtAsc(String patientId, String providerId);

    @Query("select max(c.createdAt) from ConsentToken c where c.patientId = :patientId and c.providerId = :providerId")
    Optional<Instant> findLatestCreatedAt(@Param("patientId") String patientId, @Param("providerId") String providerId);
}
