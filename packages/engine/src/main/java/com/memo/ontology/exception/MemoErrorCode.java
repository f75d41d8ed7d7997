package com.memo.ontology.exception;

/**
 * Canonical error codes for the ontology engine. Codes are stable and suitable for downstream
 * services and logs. Prefer choosing the most specific code that reflects the failure origin and
 * actionability.
 */
public enum MemoErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  INVALID_TRANSITION,
  PROMPT_ERROR,
  EXTERNAL_CAPABILITY_ERROR,
  STORE_ERROR,
}
