package com.codeheadsystems.gatekeeper.server.mail;

/**
 * Outbound mail collaborator. Used to deliver invite and reset links.
 */
public interface Mailer {

  /**
   * Sends a plain-text message.
   *
   * @param to      recipient address
   * @param subject subject line
   * @param body    body, may contain a raw token and must not be logged
   * @throws MailDeliveryException if the message could not be handed off
   */
  void send(String to, String subject, String body);
}
