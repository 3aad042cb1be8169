package com.example.callaudit_backend.repository;

import com.example.callaudit_backend.model.AuditJobRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditJobRecordRepository extends JpaRepository<AuditJobRecord, UUID> {
    List<AuditJobRecord> findTop20ByUserIdOrderByCreatedAtDesc(String userId);
}
