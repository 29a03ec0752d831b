package com.project.regimen.backend.repository;

import com.project.regimen.backend.entity.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;


@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Integer> {
    public Optional<AppUser> findByUsername(String username);
    public boolean existsByUsername(String username);

    public List<AppUser> findByActivePlanId(UUID activePlanId);
}
