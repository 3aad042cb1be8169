package com.example.callaudit_backend.repository;

import com.example.callaudit_backend.model.UserQuota;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserQuotaRepository extends JpaRepository<UserQuota, String> {
}
