package com.codeheadsystems.tessera.server.audit;

public enum AuditEventType {
  OTP_SESSION_CREATED,
  OTP_DISPATCH_FAILED,
  OTP_VERIFIED,
  OTP_VERIFY_FAILED,
  OTP_SESSION_NOT_FOUND,
  OTP_SESSION_ALREADY_USED,
  OTP_SESSION_EXPIRED,
  OTP_ATTEMPTS_EXCEEDED,
  OTP_SESSIONS_PURGED,
  RATE_LIMIT_EXCEEDED,
  RATE_LIMIT_FAIL_OPEN,
  WEBAUTHN_CREDENTIAL_REGISTERED,
  WEBAUTHN_CHALLENGE_ISSUED,
  WEBAUTHN_CREDENTIAL_NOT_FOUND,
  WEBAUTHN_ASSERTION_INVALID,
  WEBAUTHN_AUTHENTICATED,
  CLONING_DETECTED,
  SESSIONS_REVOKED
}
