package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Billing;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BillingRepository extends JpaRepository<Billing, String> {

    Optional<Billing> findFirstByStripeCustomerId(String stripeCustomerId);
}
