package com.codeheadsystems.gatekeeper.server.mail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Development {@link Mailer} that only logs the recipient and subject. Nothing is delivered.
 */
public class LoggingMailer implements Mailer {

  private static final Logger log = LoggerFactory.getLogger(LoggingMailer.class);

  public LoggingMailer() {
    log.warn("Using LoggingMailer: no mail will be delivered.");
  }

  @Override
  public void send(String to, String subject, String body) {
    log.info("send(to={}, subject={})", to, subject);
  }
}
