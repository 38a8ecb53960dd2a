package com.hubbridge.protocol;

/** Codes a controller uses to commission an identity. */
public record PairingCodes(String qrPairingCode, String manualPairingCode, int passcode, int discriminator) {
}
