package com.ecommerce.account;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AccountServiceApplication - entry point of the account microservice.
 *
 * Responsibilities:
 * - Account registration and email/password login
 * - JWT access/refresh token issuance and refresh exchange
 * - Bearer token validation for every protected request
 *
 * Architecture Context:
 * - Runs on port 8081 by default (PORT)
 * - Persists accounts in PostgreSQL (DATABASE_URL)
 * - Stateless: no session store, all session state lives in signed tokens
 *
 * @see com.ecommerce.account.security.TokenService for token operations
 * @see com.ecommerce.account.controller.AuthController for REST endpoints
 */
@SpringBootApplication
public class AccountServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountServiceApplication.class, args);
    }
}
