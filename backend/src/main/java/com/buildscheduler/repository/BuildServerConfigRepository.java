package com.buildscheduler.repository;

import com.buildscheduler.model.BuildServerConfig;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BuildServerConfigRepository extends JpaRepository<BuildServerConfig, UUID> {

    boolean existsByName(String name);

    List<BuildServerConfig> findAllByOrderByNameAsc();
}
