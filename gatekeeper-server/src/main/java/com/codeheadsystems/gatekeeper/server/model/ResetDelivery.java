package com.codeheadsystems.gatekeeper.server.model;

/**
 * How invite and reset tokens reach the user: mailed as a link, or handed to an administrator as a
 * code to pass on out of band.
 */
public enum ResetDelivery {
  EMAIL,
  CODE
}
