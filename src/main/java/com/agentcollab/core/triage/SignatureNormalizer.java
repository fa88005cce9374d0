package com.agentcollab.core.triage;

import com.agentcollab.core.model.ErrorClass;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Reduces diagnostic text to a stable failure signature. Volatile tokens (timestamps, epochs,
 * task ids, UUIDs, task-local paths and credentials) are replaced with placeholders before
 * hashing, so two captures that differ only in those tokens produce the same signature.
 */
public final class SignatureNormalizer {

    static final int MAX_NORMALIZED_CHARS = 500;
    static final int SIGNATURE_HEX_CHARS = 16;

    private static final Pattern ISO_TIMESTAMP = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?");
    private static final Pattern EPOCH = Pattern.compile("\\b\\d{10,13}\\b");
    private static final Pattern TASK_ID = Pattern.compile("\\b\\d{8}-\\d{3,}\\b");
    private static final Pattern UUID = Pattern.compile(
            "\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b");
    private static final Pattern TASK_PATH = Pattern.compile("\\.tmp/task/[^\\s/]+");
    private static final Pattern TOKEN = Pattern.compile("(sk-|ghp_|Bearer )[A-Za-z0-9._\\-]{10,}");

    private SignatureNormalizer() {}

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = ISO_TIMESTAMP.matcher(text).replaceAll("TIMESTAMP");
        normalized = TOKEN.matcher(normalized).replaceAll("REDACTED_TOKEN");
        normalized = UUID.matcher(normalized).replaceAll("UUID");
        normalized = TASK_ID.matcher(normalized).replaceAll("TASK_ID");
        normalized = EPOCH.matcher(normalized).replaceAll("EPOCH");
        normalized = TASK_PATH.matcher(normalized).replaceAll(".tmp/task/TASK");
        if (normalized.length() > MAX_NORMALIZED_CHARS) {
            normalized = normalized.substring(0, MAX_NORMALIZED_CHARS);
        }
        return normalized.strip();
    }

    /**
     * @return {@code <class>:sig:<first 16 hex chars of sha256(normalized text)>}
     */
    public static String signature(ErrorClass errorClass, String text) {
        return errorClass.label() + ":sig:" + sha256(normalize(text)).substring(0, SIGNATURE_HEX_CHARS);
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
