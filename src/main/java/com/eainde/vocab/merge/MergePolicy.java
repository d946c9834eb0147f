package com.eainde.vocab.merge;

/**
 * Field-level conflict resolution used when an incoming row shares a key with an existing one.
 *
 * <ul>
 *   <li>{@code fillBlankOnly}: keep populated existing fields, fill only the empty ones</li>
 *   <li>{@code preferIncoming}: a non-empty incoming field replaces the existing value</li>
 *   <li>neither: replace only when incoming is non-empty and actually different</li>
 * </ul>
 *
 * {@code fillBlankOnly} takes precedence when both flags are set.
 */
public record MergePolicy(boolean fillBlankOnly, boolean preferIncoming) {

    public static final MergePolicy FILL_BLANK_ONLY = new MergePolicy(true, false);
    public static final MergePolicy PREFER_INCOMING = new MergePolicy(false, true);
    public static final MergePolicy CONFLICT_AWARE = new MergePolicy(false, false);

    String resolve(String existing, String incoming) {
        if (fillBlankOnly) {
            return existing.isEmpty() ? incoming : existing;
        }
        if (preferIncoming) {
            return incoming.isEmpty() ? existing : incoming;
        }
        return !incoming.isEmpty() && !incoming.equals(existing) ? incoming : existing;
    }
}
