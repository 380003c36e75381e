// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.SignatureException;
import java.security.spec.ECGenParameterSpec;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// Holds this validator's key pair and signs canonical payloads with SHA256withECDSA over secp256r1.
public final class Signer {
  static final String ALGORITHM = "SHA256withECDSA";
  static final String CURVE = "secp256r1";

  private final KeyPair keyPair;
  private final PeerId id;

  public Signer(KeyPair keyPair) {
    this.keyPair = keyPair;
    this.id = PeerId.of(keyPair.getPublic());
  }

  public static Signer generate() {
    try {
      final var generator = KeyPairGenerator.getInstance("EC");
      generator.initialize(new ECGenParameterSpec(CURVE));
      return new Signer(generator.generateKeyPair());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("unable to generate " + CURVE + " key pair", e);
    }
  }

  public Signature sign(byte[] payload) {
    try {
      final var signature = java.security.Signature.getInstance(ALGORITHM);
      signature.initSign(keyPair.getPrivate());
      signature.update(payload);
      return new Signature(signature.sign());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("unable to sign payload", e);
    }
  }

  /// @return true only if the signature was made over the payload by the private key of the given public key.
  public static boolean verify(PublicKey publicKey, byte[] payload, Signature signature) {
    try {
      final var verifier = java.security.Signature.getInstance(ALGORITHM);
      verifier.initVerify(publicKey);
      verifier.update(payload);
      return verifier.verify(signature.bytes());
    } catch (SignatureException e) {
      // a malformed signature is a failed verification not a local fault
      LOGGER.finer(() -> "malformed signature " + signature + ": " + e.getMessage());
      return false;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("unable to verify signature", e);
    }
  }

  public PeerId id() {
    return id;
  }

  public PublicKey publicKey() {
    return keyPair.getPublic();
  }

  public Validator validator() {
    return new Validator(id, keyPair.getPublic());
  }
}
