package com.example.requestgate.model;

/**
 * Environment facts the security headers depend on.
 */
public record SecurityPolicyContext(boolean production) {
}
