package com.raditha.syntax.config;

/**
 * Options for building one syntax tree.
 *
 * @param verifyInvariants run the structural self check on the finished tree
 * @param logSummary       log node and fold counts once the tree is finished
 */
public record BuildOptions(
        boolean verifyInvariants,
        boolean logSummary) {

    /**
     * Checked build: every finished tree is verified.
     */
    public static BuildOptions defaults() {
        return new BuildOptions(
                true, // verifyInvariants
                false); // logSummary
    }

    /**
     * Release build: skip the recursive self check. Folding and role
     * assignment are still validated.
     */
    public static BuildOptions unchecked() {
        return new BuildOptions(
                false, // verifyInvariants
                false); // logSummary
    }

    public BuildOptions withLogSummary(boolean enabled) {
        return new BuildOptions(verifyInvariants, enabled);
    }

    public BuildOptions withVerifyInvariants(boolean enabled) {
        return new BuildOptions(enabled, logSummary);
    }
}
