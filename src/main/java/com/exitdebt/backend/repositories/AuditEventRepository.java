package com.exitdebt.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.exitdebt.backend.entities.AuditEvent;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {
}
