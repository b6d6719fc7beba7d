package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.Device;
import com.codeheadsystems.gatekeeper.server.model.DeviceKind;
import com.codeheadsystems.gatekeeper.server.store.DeviceStore;
import com.codeheadsystems.gatekeeper.server.store.PasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.TotpSecretStore;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import java.util.List;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User-facing device management. Deleting a device deletes the credential behind it.
 */
@Singleton
public class DeviceManager {

  private static final Logger log = LoggerFactory.getLogger(DeviceManager.class);

  private final DeviceStore deviceStore;
  private final PasskeyStore passkeyStore;
  private final TotpSecretStore totpSecretStore;
  private final TransactionManager transactionManager;

  @Inject
  public DeviceManager(DeviceStore deviceStore,
                       PasskeyStore passkeyStore,
                       TotpSecretStore totpSecretStore,
                       TransactionManager transactionManager) {
    this.deviceStore = deviceStore;
    this.passkeyStore = passkeyStore;
    this.totpSecretStore = totpSecretStore;
    this.transactionManager = transactionManager;
  }

  public List<Device> list(UUID userId) {
    return deviceStore.listByUserId(userId);
  }

  /**
   * Deletes one of the caller's devices together with its credential. A TOTP device takes every
   * TOTP row of the user with it.
   *
   * @param userId   the caller
   * @param deviceId the device
   * @throws AuthException NOT_FOUND if the device does not exist or belongs to someone else
   */
  public void delete(UUID userId, UUID deviceId) {
    Device device = deviceStore.findById(deviceId)
        .filter(d -> d.userId().equals(userId))
        .orElseThrow(() -> AuthException.notFound("device not found"));
    transactionManager.inTransaction(() -> {
      if (device.kind() == DeviceKind.PASSKEY) {
        if (device.credentialId() != null) {
          passkeyStore.deleteByCredentialId(device.credentialId());
        }
        deviceStore.delete(device.id());
      } else {
        totpSecretStore.deleteByUserId(userId);
        deviceStore.deleteByUserIdAndKind(userId, DeviceKind.TOTP);
      }
    });
    log.info("delete(userId={}, deviceId={}, kind={})", userId, deviceId, device.kind());
  }
}
