package com.libragraph.framekit.types;

public enum DigestAlgorithm {
    SHA_256(0, "sha-256", "SHA-256", 32),
    MD5(1, "md5", "MD5", 16);

    private final int id;
    private final String label;
    private final String jcaName;
    private final int length;

    DigestAlgorithm(int id, String label, String jcaName, int length) {
        this.id = id;
        this.label = label;
        this.jcaName = jcaName;
        this.length = length;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /**
     * Algorithm name as understood by {@link java.security.MessageDigest#getInstance(String)}.
     */
    public String jcaName() {
        return jcaName;
    }

    /**
     * Digest length in bytes.
     */
    public int length() {
        return length;
    }

    /**
     * Length of the lower-case hex rendering (two characters per byte).
     */
    public int hexLength() {
        return length * 2;
    }

    public static DigestAlgorithm fromId(int id) {
        for (DigestAlgorithm a : values()) {
            if (a.id == id) return a;
        }
        throw new IllegalArgumentException("Unknown DigestAlgorithm id: " + id);
    }

    public static DigestAlgorithm fromLabel(String label) {
        for (DigestAlgorithm a : values()) {
            if (a.label.equalsIgnoreCase(label)) return a;
        }
        throw new IllegalArgumentException("Unknown DigestAlgorithm label: " + label);
    }
}
