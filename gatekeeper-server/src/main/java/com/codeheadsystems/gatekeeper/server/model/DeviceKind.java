package com.codeheadsystems.gatekeeper.server.model;

public enum DeviceKind {
  PASSKEY,
  TOTP
}
