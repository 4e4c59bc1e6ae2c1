package com.medledger.consentservice.repository;

import com.medledger.consentservice.models.MedicalRecord;
import com.medledger.consentservice.models.ResourceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MedicalRecordRepository extends JpaRepository<MedicalRecord, String> {

    List<MedicalRecord> findByPatientIdOrderByCreatedAtAsc(String patientId);

    List<MedicalRecord> findByProviderIdOrderByCreatedAtAsc(String providerId);

    List<MedicalRecord> findByResourceTypeOrderByCreatedAtAsc(ResourceType resourceType);

    List<MedicalRecord> findByPatientIdAndResourceTypeOrderByCreatedAtAsc(String patientId, ResourceType resourceType);
}
