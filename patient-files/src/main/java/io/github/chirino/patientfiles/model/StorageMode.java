package io.github.chirino.patientfiles.model;

/** Where the bytes of a stored file live. */
public enum StorageMode {
    /** Embedded in the owning stage of the patient record. */
    INLINE("inline"),
    /** Split into ordered chunks in the chunk store, referenced by object id. */
    CHUNKED("chunked");

    private final String value;

    StorageMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static StorageMode fromValue(String value) {
        for (StorageMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown storage mode: " + value);
    }
}
