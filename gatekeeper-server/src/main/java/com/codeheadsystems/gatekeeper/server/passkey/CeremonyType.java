package com.codeheadsystems.gatekeeper.server.passkey;

public enum CeremonyType {
  REGISTRATION,
  AUTHENTICATION,
  REAUTHENTICATION
}
