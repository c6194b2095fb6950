package org.calista.replycraft.usage;

/** Provenance tags passed to {@link UsageLedger#recordSelection}. Opaque to the ledger. */
public final class SelectionSource {
    public static final String MANUAL = "manual";
    public static final String FAVORITE = "favorite";
    public static final String PERSONA = "persona";
    public static final String QUICK_GENERATE = "quick-generate";
    public static final String SMART_DEFAULT = "smart-default";
    public static final String SUGGESTION = "suggestion";
    public static final String CUSTOM_COMBO = "custom-combo";

    private SelectionSource() {
    }
}
