package com.ocilogs.oci;

import java.io.IOException;
import java.io.StringReader;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

final class PemKeys {

    private PemKeys() {
    }

    /**
     * Fails unless {@code pem} holds at least one well formed PEM block.
     */
    static void requireBlock(String profileKey, String pem) {
        if (pem == null || pem.isBlank()) {
            throw new InvalidCredentialException(profileKey, "Invalid Private Key: empty key for profile " + profileKey);
        }
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            PemObject block = reader.readPemObject();
            if (block == null || block.getContent() == null || block.getContent().length == 0) {
                throw new InvalidCredentialException(profileKey, "Invalid Private Key: no PEM block for profile " + profileKey);
            }
        } catch (IOException | DecoderException e) {
            throw new InvalidCredentialException(profileKey, "Invalid Private Key for profile " + profileKey, e);
        }
    }
}
