/*
 * Copyright 2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"). You may not use this file except
 * in compliance with the License. A copy of the License is located at
 *
 * http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 */

package org.rocrate.encryption.pgp;

import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.bcpg.SymmetricKeyAlgorithmTags;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPEncryptedData;
import org.bouncycastle.openpgp.PGPEncryptedDataGenerator;
import org.bouncycastle.openpgp.PGPEncryptedDataList;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPLiteralDataGenerator;
import org.bouncycastle.openpgp.PGPPrivateKey;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyEncryptedData;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPSecretKeyRing;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.jcajce.JcaPGPObjectFactory;
import org.bouncycastle.openpgp.operator.PBESecretKeyDecryptor;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPDigestCalculatorProviderBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePBESecretKeyDecryptorBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePGPDataEncryptorBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePublicKeyDataDecryptorFactoryBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePublicKeyKeyEncryptionMethodGenerator;
import org.bouncycastle.util.encoders.Hex;
import org.bouncycastle.util.io.Streams;
import org.rocrate.encryption.exception.BackendFailureException;
import org.rocrate.encryption.keys.CryptoBackend;
import org.rocrate.encryption.keys.HkpKeyserverClient;
import org.rocrate.encryption.keys.KeyIdentity;
import org.rocrate.encryption.keys.KeyImportResult;
import org.rocrate.encryption.keys.KeyserverWarning;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notBlank;
import static org.apache.commons.lang3.Validate.notEmpty;

/**
 * A {@link CryptoBackend} doing OpenPGP (RFC 4880) encryption and decryption locally with
 * BouncyCastle, over key rings held in memory.
 * <p>
 * Messages are encrypted with AES-256 and an integrity packet, once for all recipients, and
 * ASCII-armored. Keys are identified by the upper-case hex fingerprint of their master key.
 * Secret keys are unlocked with the single passphrase given to the builder.
 * <p>
 * Instances are not thread safe.
 */
public class OpenPgpBackend implements CryptoBackend {

    private static final Logger LOGGER = Logger.getLogger(OpenPgpBackend.class.getName());
    private static final int BUFFER_SIZE = 1 << 16;

    private final Map<String, PGPPublicKeyRing> publicKeyRings = new LinkedHashMap<>();
    private final List<PGPSecretKeyRing> secretKeyRings = new ArrayList<>();
    private final char[] passphrase;
    private final HkpKeyserverClient keyserverClient;
    private final SecureRandom secureRandom;

    private OpenPgpBackend(Builder b) {
        this.passphrase = b.passphrase == null ? new char[0] : b.passphrase.clone();
        this.keyserverClient = b.keyserverClient == null ? new HkpKeyserverClient() : b.keyserverClient;
        this.secureRandom = b.secureRandom == null ? new SecureRandom() : b.secureRandom;
        b.publicKeyRings.forEach(this::addPublicKeyRing);
        b.secretKeyRings.forEach(this::addSecretKeyRing);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The upper-case hex fingerprint of a public key.
     */
    public static String fingerprint(final PGPPublicKey key) {
        return Hex.toHexString(key.getFingerprint()).toUpperCase(Locale.ROOT);
    }

    public final String addPublicKeyRing(final PGPPublicKeyRing ring) {
        requireNonNull(ring, "ring is required");
        final String fingerprint = fingerprint(ring.getPublicKey());
        publicKeyRings.put(fingerprint, ring);
        return fingerprint;
    }

    /**
     * Adds a secret key ring, which also makes its public keys available for encryption.
     */
    public final String addSecretKeyRing(final PGPSecretKeyRing ring) {
        requireNonNull(ring, "ring is required");
        final List<PGPPublicKey> publicKeys = new ArrayList<>();
        ring.getPublicKeys().forEachRemaining(publicKeys::add);
        secretKeyRings.add(ring);
        return addPublicKeyRing(new PGPPublicKeyRing(publicKeys));
    }

    /**
     * Removes a key, public and secret parts alike.
     *
     * @return True if the key was known.
     */
    public boolean removeKey(final String fingerprint) {
        final String normalized = normalize(fingerprint);
        secretKeyRings.removeIf(ring -> fingerprint(ring.getPublicKey()).equals(normalized));
        return publicKeyRings.remove(normalized) != null;
    }

    /**
     * Imports every public and secret key ring of an ASCII-armored (or binary) key block.
     *
     * @param armored The key block.
     * @return The fingerprints of the imported master keys.
     * @throws IOException  if the block cannot be read.
     * @throws PGPException if the block holds no key or a malformed key.
     */
    public List<String> importKeys(final String armored) throws IOException, PGPException {
        final List<String> imported = new ArrayList<>();
        for (Object ring : readKeyRings(armored)) {
            if (ring instanceof PGPSecretKeyRing) {
                imported.add(addSecretKeyRing((PGPSecretKeyRing) ring));
            } else {
                imported.add(addPublicKeyRing((PGPPublicKeyRing) ring));
            }
        }
        return imported;
    }

    /**
     * Exports a known public key as an ASCII-armored key block.
     *
     * @throws IllegalArgumentException if the key is unknown.
     */
    public String exportPublicKey(final String fingerprint) {
        final PGPPublicKeyRing ring = publicKeyRings.get(normalize(fingerprint));
        if (ring == null) {
            throw new IllegalArgumentException("Unknown public key " + fingerprint);
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ArmoredOutputStream armored = new ArmoredOutputStream(out)) {
            ring.encode(armored);
        } catch (IOException e) {
            throw new BackendFailureException("Unable to export key " + fingerprint, e);
        }
        return new String(out.toByteArray(), StandardCharsets.US_ASCII);
    }

    @Override
    public String encrypt(final byte[] plaintext, final Set<String> recipientFingerprints) {
        requireNonNull(plaintext, "plaintext is required");
        notEmpty(recipientFingerprints, "At least one recipient is required");

        final PGPEncryptedDataGenerator generator = new PGPEncryptedDataGenerator(
                new JcePGPDataEncryptorBuilder(SymmetricKeyAlgorithmTags.AES_256)
                        .setWithIntegrityPacket(true)
                        .setSecureRandom(secureRandom)
                        .setProvider(BouncyCastleConfiguration.PROVIDER));
        for (String fingerprint : recipientFingerprints) {
            generator.addMethod(new JcePublicKeyKeyEncryptionMethodGenerator(encryptionKey(fingerprint))
                    .setSecureRandom(secureRandom)
                    .setProvider(BouncyCastleConfiguration.PROVIDER));
        }

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ArmoredOutputStream armored = new ArmoredOutputStream(out);
             OutputStream encrypted = generator.open(armored, new byte[BUFFER_SIZE]);
             OutputStream literal = new PGPLiteralDataGenerator().open(encrypted, PGPLiteralData.UTF8,
                     PGPLiteralData.CONSOLE, plaintext.length, new Date())) {
            literal.write(plaintext);
        } catch (IOException | PGPException e) {
            throw new BackendFailureException("Encryption failed: " + e.getMessage(), e);
        }
        return new String(out.toByteArray(), StandardCharsets.US_ASCII);
    }

    @Override
    public byte[] decrypt(final String ciphertext) {
        notBlank(ciphertext, "ciphertext is required");

        try (InputStream in = PGPUtil.getDecoderStream(new ByteArrayInputStream(ciphertext.getBytes(StandardCharsets.US_ASCII)))) {
            final PGPEncryptedDataList encryptedDataList = firstEncryptedDataList(new JcaPGPObjectFactory(in));
            for (PGPEncryptedData encryptedData : encryptedDataList) {
                if (!(encryptedData instanceof PGPPublicKeyEncryptedData)) {
                    continue;
                }
                final PGPPublicKeyEncryptedData publicKeyData = (PGPPublicKeyEncryptedData) encryptedData;
                final PGPPrivateKey privateKey = findPrivateKey(publicKeyData.getKeyID());
                if (privateKey != null) {
                    return readMessage(publicKeyData, privateKey);
                }
            }
        } catch (IOException | PGPException e) {
            throw new BackendFailureException("Decryption failed: " + e.getMessage(), e);
        }
        throw new BackendFailureException("No secret key available to decrypt the message");
    }

    @Override
    public Map<String, KeyIdentity> listLocalKeys() {
        final Map<String, KeyIdentity> keys = new LinkedHashMap<>();
        publicKeyRings.forEach((fingerprint, ring) -> {
            final PGPPublicKey master = ring.getPublicKey();
            final List<String> identities = new ArrayList<>();
            master.getUserIDs().forEachRemaining(identities::add);
            keys.put(fingerprint, new KeyIdentity(String.valueOf(master.getAlgorithm()), fingerprint, identities));
        });
        return keys;
    }

    @Override
    public KeyImportResult fetchKeys(final String keyserverUrl, final Collection<String> fingerprints) {
        final HkpKeyserverClient.Lookup lookup = keyserverClient.fetch(keyserverUrl, fingerprints);
        final List<String> imported = new ArrayList<>();
        final List<KeyserverWarning> warnings = new ArrayList<>(lookup.getWarnings());
        lookup.getArmoredKeys().forEach((fingerprint, armored) -> {
            try {
                final List<String> received = new ArrayList<>();
                PGPPublicKeyRing requested = null;
                for (Object ring : readKeyRings(armored)) {
                    if (ring instanceof PGPPublicKeyRing) {
                        final String receivedFingerprint = fingerprint(((PGPPublicKeyRing) ring).getPublicKey());
                        received.add(receivedFingerprint);
                        if (receivedFingerprint.equals(normalize(fingerprint))) {
                            requested = (PGPPublicKeyRing) ring;
                        }
                    }
                }
                if (requested == null) {
                    warnings.add(KeyserverWarning.report(fingerprint, "server returned other keys " + received));
                } else {
                    imported.add(addPublicKeyRing(requested));
                }
            } catch (IOException | PGPException e) {
                warnings.add(KeyserverWarning.report(fingerprint, "malformed key block: " + e.getMessage()));
            }
        });
        return new KeyImportResult(imported, warnings);
    }

    private PGPPublicKey encryptionKey(final String fingerprint) {
        final PGPPublicKeyRing ring = publicKeyRings.get(normalize(fingerprint));
        if (ring == null) {
            throw new BackendFailureException("INV_RECP: no public key for recipient " + fingerprint);
        }
        PGPPublicKey candidate = null;
        final Iterator<PGPPublicKey> keys = ring.getPublicKeys();
        while (keys.hasNext()) {
            final PGPPublicKey key = keys.next();
            if (key.isEncryptionKey() && (candidate == null || candidate.isMasterKey())) {
                candidate = key;
            }
        }
        if (candidate == null) {
            throw new BackendFailureException("INV_RECP: key " + fingerprint + " cannot encrypt");
        }
        return candidate;
    }

    private PGPPrivateKey findPrivateKey(final long keyId) throws PGPException {
        final PBESecretKeyDecryptor decryptor = new JcePBESecretKeyDecryptorBuilder(
                new JcaPGPDigestCalculatorProviderBuilder().setProvider(BouncyCastleConfiguration.PROVIDER).build())
                .setProvider(BouncyCastleConfiguration.PROVIDER)
                .build(passphrase);
        for (PGPSecretKeyRing ring : secretKeyRings) {
            final PGPSecretKey secretKey = ring.getSecretKey(keyId);
            if (secretKey == null) {
                continue;
            }
            try {
                return secretKey.extractPrivateKey(decryptor);
            } catch (PGPException e) {
                LOGGER.info("Could not unlock secret key " + Long.toHexString(keyId) + " due to: " + e.getMessage());
            }
        }
        return null;
    }

    // public and secret key rings, in block order
    private static List<Object> readKeyRings(final String armored) throws IOException, PGPException {
        notBlank(armored, "armored is required");
        final List<Object> rings = new ArrayList<>();
        try (InputStream in = PGPUtil.getDecoderStream(new ByteArrayInputStream(armored.getBytes(StandardCharsets.US_ASCII)))) {
            final JcaPGPObjectFactory factory = new JcaPGPObjectFactory(in);
            Object next;
            while ((next = factory.nextObject()) != null) {
                if (next instanceof PGPSecretKeyRing || next instanceof PGPPublicKeyRing) {
                    rings.add(next);
                }
            }
        }
        if (rings.isEmpty()) {
            throw new PGPException("Key block holds no key ring");
        }
        return rings;
    }

    private static PGPEncryptedDataList firstEncryptedDataList(final JcaPGPObjectFactory factory) throws IOException, PGPException {
        Object next;
        while ((next = factory.nextObject()) != null) {
            if (next instanceof PGPEncryptedDataList) {
                return (PGPEncryptedDataList) next;
            }
        }
        throw new PGPException("Message holds no encrypted data");
    }

    private static byte[] readMessage(final PGPPublicKeyEncryptedData encryptedData, final PGPPrivateKey privateKey)
            throws IOException, PGPException {
        final byte[] message;
        try (InputStream clear = encryptedData.getDataStream(new JcePublicKeyDataDecryptorFactoryBuilder()
                .setProvider(BouncyCastleConfiguration.PROVIDER)
                .build(privateKey))) {
            Object next = new JcaPGPObjectFactory(clear).nextObject();
            if (next instanceof PGPCompressedData) {
                next = new JcaPGPObjectFactory(((PGPCompressedData) next).getDataStream()).nextObject();
            }
            if (!(next instanceof PGPLiteralData)) {
                throw new PGPException("Message holds no literal data");
            }
            message = Streams.readAll(((PGPLiteralData) next).getInputStream());
        }
        if (encryptedData.isIntegrityProtected() && !encryptedData.verify()) {
            throw new PGPException("Message failed integrity check");
        }
        return message;
    }

    private static String normalize(final String fingerprint) {
        notBlank(fingerprint, "fingerprint is required");
        return fingerprint.replace(" ", "").toUpperCase(Locale.ROOT);
    }

    public static class Builder {
        private final List<PGPPublicKeyRing> publicKeyRings = new ArrayList<>();
        private final List<PGPSecretKeyRing> secretKeyRings = new ArrayList<>();
        private char[] passphrase;
        private HkpKeyserverClient keyserverClient;
        private SecureRandom secureRandom;

        private Builder() {
        }

        public Builder publicKeyRing(PGPPublicKeyRing ring) {
            requireNonNull(ring, "ring is required");
            publicKeyRings.add(ring);
            return this;
        }

        public Builder secretKeyRing(PGPSecretKeyRing ring) {
            requireNonNull(ring, "ring is required");
            secretKeyRings.add(ring);
            return this;
        }

        /**
         * Sets the passphrase that unlocks the secret keys. Note that this does not make a
         * defensive copy; the backend copies it on {@link #build()}.
         */
        public Builder passphrase(char[] passphrase) {
            this.passphrase = passphrase;
            return this;
        }

        public Builder keyserverClient(HkpKeyserverClient keyserverClient) {
            this.keyserverClient = keyserverClient;
            return this;
        }

        public Builder secureRandom(SecureRandom secureRandom) {
            this.secureRandom = secureRandom;
            return this;
        }

        public OpenPgpBackend build() {
            return new OpenPgpBackend(this);
        }
    }
}
