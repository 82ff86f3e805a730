package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AES-256-GCM with a key derived by SHA-256 from whatever key text is supplied.
 * The combined payload is {@code iv:authTag:ciphertext}, all hex.
 */
@Component
public class EncryptDataExecutor implements NodeExecutor {

    static final String ALGORITHM = "aes-256-gcm";
    static final String DEFAULT_KEY = "default-workflow-key";
    private static final int IV_BYTES = 16;
    private static final int TAG_BITS = 128;

    private final SecureRandom random = new SecureRandom();

    @Override
    public String supportedType() {
        return "Encrypt Data";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) throws GeneralSecurityException {
        String data = NodeConfig.string(node, inputs, "data", "");
        String key = NodeConfig.string(node, inputs, "key", "");
        Map<String, Object> outputs = new LinkedHashMap<>();
        if (data.isEmpty()) {
            outputs.put("success", false);
            outputs.put("error", "No data to encrypt");
            return NodeOutcome.next(outputs);
        }

        byte[] keyBytes = MessageDigest.getInstance("SHA-256")
                .digest((key.isEmpty() ? DEFAULT_KEY : key).getBytes(StandardCharsets.UTF_8));
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);

        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(keyBytes, "AES"), new GCMParameterSpec(TAG_BITS, iv));
        byte[] sealed = cipher.doFinal(data.getBytes(StandardCharsets.UTF_8));

        // JCE appends the tag to the ciphertext
        int tagStart = sealed.length - TAG_BITS / 8;
        HexFormat hex = HexFormat.of();
        String encrypted = hex.formatHex(Arrays.copyOfRange(sealed, 0, tagStart));
        String authTag = hex.formatHex(Arrays.copyOfRange(sealed, tagStart, sealed.length));
        String ivHex = hex.formatHex(iv);

        outputs.put("success", true);
        outputs.put("algorithm", ALGORITHM);
        outputs.put("encrypted", encrypted);
        outputs.put("iv", ivHex);
        outputs.put("authTag", authTag);
        outputs.put("payload", ivHex + ":" + authTag + ":" + encrypted);
        return NodeOutcome.next(outputs);
    }
}
