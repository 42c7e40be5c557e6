package com.tapas.skus.credential.repository;

import com.tapas.skus.credential.domain.Issuer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface IssuerRepository extends JpaRepository<Issuer, UUID> {

    Optional<Issuer> findByName(String name);
}
