package com.example.mcpauth.domain.entity;

/**
 * Supported upstream identity providers.
 * Recorded on every issued token so the upstream credential can be used against the right API.
 */
public enum IdpProvider {
  GOOGLE,
  GITHUB
}
